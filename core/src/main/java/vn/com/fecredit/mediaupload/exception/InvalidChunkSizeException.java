package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

/**
 * Chunk payload whose length does not match the session layout. Every chunk but the last
 * must be exactly {@code chunkSize} bytes; the last one carries the remainder.
 */
@Getter
public class InvalidChunkSizeException extends UploadSessionException {

    private final String sessionId;
    private final int chunkIndex;
    private final long expectedLength;
    private final long actualLength;

    public InvalidChunkSizeException(String sessionId, int chunkIndex, long expectedLength, long actualLength) {
        super("INVALID_CHUNK_SIZE", false,
                "Invalid chunk size for chunk " + chunkIndex + ": expected " + expectedLength + " bytes, got " + actualLength);
        this.sessionId = sessionId;
        this.chunkIndex = chunkIndex;
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }
}
