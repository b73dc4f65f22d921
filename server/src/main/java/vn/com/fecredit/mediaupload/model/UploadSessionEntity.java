package vn.com.fecredit.mediaupload.model;

import jakarta.persistence.*;
import lombok.Data;
import vn.com.fecredit.mediaupload.model.util.BitsetUtil;

import java.time.Instant;

/**
 * Persistent form of a {@link ChunkUploadSession}.
 *
 * <p>
 * {@code version} backs the optimistic lock that turns every save into a compare-and-swap.
 */
@Entity
@Table(name = "upload_session", indexes = {
        @Index(name = "idx_upload_session_status_activity", columnList = "status, last_activity_at"),
        @Index(name = "idx_upload_session_status_updated", columnList = "status, updated_at")
})
@Data
public class UploadSessionEntity {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(nullable = false)
    private String filename;

    @Column(name = "content_type")
    private String contentType;

    @Column(name = "total_size", nullable = false)
    private long totalSize;

    @Column(name = "chunk_size", nullable = false)
    private int chunkSize;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks;

    @Lob
    @Column(name = "received_chunks", nullable = false)
    private byte[] receivedChunks;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SessionStatus status;

    @Column(name = "expected_checksum", length = 64)
    private String expectedChecksum;

    @Column(name = "result_reference", length = 1024)
    private String resultReference;

    @Column(name = "failure_reason", length = 1024)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt;

    @Version
    private Long version;

    /**
     * Builds a new, not yet persisted entity. The version stays {@code null} so the first save inserts.
     */
    public static UploadSessionEntity fromSession(ChunkUploadSession session) {
        UploadSessionEntity entity = new UploadSessionEntity();
        entity.setSessionId(session.getSessionId());
        entity.setFilename(session.getFilename());
        entity.setContentType(session.getContentType());
        entity.setTotalSize(session.getTotalSize());
        entity.setChunkSize(session.getChunkSize());
        entity.setTotalChunks(session.getTotalChunks());
        entity.setExpectedChecksum(session.getExpectedChecksum());
        entity.setCreatedAt(session.getCreatedAt());
        entity.apply(session);
        return entity;
    }

    /**
     * Copies the fields a session may change over its lifetime onto this entity.
     */
    public void apply(ChunkUploadSession session) {
        this.receivedChunks = BitsetUtil.copyOf(session.getReceivedChunks());
        this.status = session.getStatus();
        this.resultReference = session.getResultReference();
        this.failureReason = session.getFailureReason();
        this.updatedAt = session.getUpdatedAt();
        this.completedAt = session.getCompletedAt();
        this.lastActivityAt = session.getLastActivityAt();
    }

    public ChunkUploadSession toSession() {
        ChunkUploadSession session = new ChunkUploadSession();
        session.setSessionId(sessionId);
        session.setFilename(filename);
        session.setContentType(contentType);
        session.setTotalSize(totalSize);
        session.setChunkSize(chunkSize);
        session.setTotalChunks(totalChunks);
        session.setReceivedChunks(BitsetUtil.copyOf(receivedChunks));
        session.setStatus(status);
        session.setExpectedChecksum(expectedChecksum);
        session.setResultReference(resultReference);
        session.setFailureReason(failureReason);
        session.setCreatedAt(createdAt);
        session.setUpdatedAt(updatedAt);
        session.setCompletedAt(completedAt);
        session.setLastActivityAt(lastActivityAt);
        session.setVersion(version == null ? 0L : version);
        return session;
    }
}
