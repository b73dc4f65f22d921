package vn.com.fecredit.mediaupload.model;

import lombok.Value;

/**
 * Acknowledgement of a stored chunk.
 */
@Value
public class ChunkReceipt {
    String sessionId;
    int chunkIndex;
    int receivedCount;
    int totalChunks;
}
