package vn.com.fecredit.mediaupload.model;

import lombok.Getter;

import java.time.Instant;

/**
 * Read-only snapshot of a session, as returned by status queries.
 */
@Getter
public class SessionStatusView {
    private final String sessionId;
    private final SessionStatus status;
    private final String filename;
    private final String contentType;
    private final long totalSize;
    private final int chunkSize;
    private final int receivedCount;
    private final int totalChunks;
    private final Iterable<Integer> missingIndices;
    private final String resultReference;
    private final String failureReason;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;
    private final Instant lastActivityAt;

    public SessionStatusView(ChunkUploadSession session) {
        this.sessionId = session.getSessionId();
        this.status = session.getStatus();
        this.filename = session.getFilename();
        this.contentType = session.getContentType();
        this.totalSize = session.getTotalSize();
        this.chunkSize = session.getChunkSize();
        this.receivedCount = session.getReceivedCount();
        this.totalChunks = session.getTotalChunks();
        this.missingIndices = new MissingChunks(session.getReceivedChunks(), session.getTotalChunks());
        this.resultReference = session.getResultReference();
        this.failureReason = session.getFailureReason();
        this.createdAt = session.getCreatedAt();
        this.updatedAt = session.getUpdatedAt();
        this.completedAt = session.getCompletedAt();
        this.lastActivityAt = session.getLastActivityAt();
    }

    public double getProgressPercent() {
        return totalChunks == 0 ? 100.0 : receivedCount * 100.0 / totalChunks;
    }
}
