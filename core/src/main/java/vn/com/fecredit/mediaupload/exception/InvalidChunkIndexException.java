package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

/**
 * Chunk index outside {@code [0, totalChunks)}.
 */
@Getter
public class InvalidChunkIndexException extends UploadSessionException {

    private final String sessionId;
    private final int chunkIndex;
    private final int totalChunks;

    public InvalidChunkIndexException(String sessionId, int chunkIndex, int totalChunks) {
        super("INVALID_CHUNK_INDEX", false,
                "Invalid chunk number: " + chunkIndex + ", totalChunks: " + totalChunks);
        this.sessionId = sessionId;
        this.chunkIndex = chunkIndex;
        this.totalChunks = totalChunks;
    }
}
