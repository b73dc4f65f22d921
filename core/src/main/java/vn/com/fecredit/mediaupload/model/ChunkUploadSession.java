package vn.com.fecredit.mediaupload.model;

import lombok.Getter;
import lombok.Setter;
import vn.com.fecredit.mediaupload.model.util.BitsetUtil;

import java.time.Instant;
import java.util.List;

/**
 * One resumable upload attempt.
 *
 * <p>
 * Instances are plain mutable state. Callers never share an instance between threads:
 * repositories hand out copies and apply mutations to their own copy inside the
 * compare-and-swap.
 *
 * <p>
 * Invariants kept by the mutators of this class:
 * <ul>
 * <li>received chunk indices are always in {@code [0, totalChunks)}</li>
 * <li>status only changes along {@link SessionStatus#canTransitionTo(SessionStatus)}</li>
 * <li>{@code resultReference} is set if and only if the status is {@code COMPLETED}</li>
 * <li>{@code COMPLETED} is only reachable once every chunk has been received</li>
 * </ul>
 */
@Getter
@Setter
public class ChunkUploadSession {

    private String sessionId;
    private String filename;
    private String contentType;
    private long totalSize;
    private int chunkSize;
    private int totalChunks;
    private byte[] receivedChunks;
    private SessionStatus status;
    private String expectedChecksum;
    private String resultReference;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private Instant lastActivityAt;
    private long version;

    public ChunkUploadSession() {
    }

    /**
     * Copy constructor. The received-chunk bitset is copied, so the copy can be mutated freely.
     */
    public ChunkUploadSession(ChunkUploadSession other) {
        this.sessionId = other.sessionId;
        this.filename = other.filename;
        this.contentType = other.contentType;
        this.totalSize = other.totalSize;
        this.chunkSize = other.chunkSize;
        this.totalChunks = other.totalChunks;
        this.receivedChunks = BitsetUtil.copyOf(other.receivedChunks);
        this.status = other.status;
        this.expectedChecksum = other.expectedChecksum;
        this.resultReference = other.resultReference;
        this.failureReason = other.failureReason;
        this.createdAt = other.createdAt;
        this.updatedAt = other.updatedAt;
        this.completedAt = other.completedAt;
        this.lastActivityAt = other.lastActivityAt;
        this.version = other.version;
    }

    /**
     * Creates a new session in {@link SessionStatus#PENDING} with nothing received.
     *
     * @throws IllegalArgumentException if the sizes are not positive or yield more chunks than an int holds
     */
    public static ChunkUploadSession create(String sessionId, String filename, String contentType,
                                            long totalSize, int chunkSize, String expectedChecksum, Instant now) {
        int totalChunks = computeTotalChunks(totalSize, chunkSize);
        ChunkUploadSession session = new ChunkUploadSession();
        session.sessionId = sessionId;
        session.filename = filename;
        session.contentType = contentType;
        session.totalSize = totalSize;
        session.chunkSize = chunkSize;
        session.totalChunks = totalChunks;
        session.receivedChunks = BitsetUtil.newBitset(totalChunks);
        session.status = SessionStatus.PENDING;
        session.expectedChecksum = expectedChecksum;
        session.createdAt = now;
        session.updatedAt = now;
        session.lastActivityAt = now;
        return session;
    }

    /**
     * Returns {@code ceil(totalSize / chunkSize)}.
     *
     * @throws IllegalArgumentException if either size is not positive or the result overflows an int
     */
    public static int computeTotalChunks(long totalSize, int chunkSize) {
        if (totalSize <= 0) {
            throw new IllegalArgumentException("totalSize must be positive: " + totalSize);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        long chunks = totalSize / chunkSize + (totalSize % chunkSize == 0 ? 0 : 1);
        if (chunks > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("File of " + totalSize + " bytes needs too many chunks of " + chunkSize + " bytes");
        }
        return (int) chunks;
    }

    public boolean isChunkReceived(int chunkIndex) {
        return BitsetUtil.isBitSet(receivedChunks, chunkIndex);
    }

    public void markChunkReceived(int chunkIndex) {
        if (chunkIndex < 0 || chunkIndex >= totalChunks) {
            throw new IndexOutOfBoundsException("Chunk index " + chunkIndex + " outside [0," + totalChunks + ")");
        }
        BitsetUtil.setBit(receivedChunks, chunkIndex);
    }

    public int getReceivedCount() {
        return BitsetUtil.countSetBits(receivedChunks, totalChunks);
    }

    public boolean isFullyReceived() {
        return BitsetUtil.isComplete(receivedChunks, totalChunks);
    }

    /**
     * Missing chunk indices, ascending.
     */
    public List<Integer> missingChunks() {
        return BitsetUtil.clearBits(receivedChunks, totalChunks);
    }

    /**
     * Byte length a chunk at the given index must have: {@code chunkSize} for every chunk but
     * the last, which carries the remainder.
     */
    public long expectedChunkLength(int chunkIndex) {
        if (chunkIndex < totalChunks - 1) {
            return chunkSize;
        }
        long remainder = totalSize % chunkSize;
        return remainder == 0 ? chunkSize : remainder;
    }

    /**
     * Moves to {@code next} and stamps {@code updatedAt}.
     *
     * @throws IllegalStateException if the transition is not allowed from the current status
     */
    public void transitionTo(SessionStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Session " + sessionId + " cannot move from " + status + " to " + next);
        }
        if (next == SessionStatus.COMPLETED && !isFullyReceived()) {
            throw new IllegalStateException("Session " + sessionId + " cannot complete with chunks missing");
        }
        this.status = next;
        this.updatedAt = now;
    }

    public void markCompleted(String reference, Instant now) {
        if (reference == null) {
            throw new IllegalArgumentException("resultReference must not be null");
        }
        transitionTo(SessionStatus.COMPLETED, now);
        this.resultReference = reference;
        this.completedAt = now;
    }

    public void markFailed(String reason, Instant now) {
        transitionTo(SessionStatus.FAILED, now);
        this.failureReason = reason;
    }

    /**
     * Records client activity; the reaper measures idleness from this instant.
     */
    public void touch(Instant now) {
        this.lastActivityAt = now;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        return "ChunkUploadSession{" +
                "sessionId='" + sessionId + '\'' +
                ", filename='" + filename + '\'' +
                ", status=" + status +
                ", received=" + getReceivedCount() + "/" + totalChunks +
                ", version=" + version +
                '}';
    }
}
