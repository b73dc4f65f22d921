package vn.com.fecredit.mediaupload.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadChunkResponse {
    private String sessionId;
    private int chunkIndex;
    private int receivedCount;
    private int totalChunks;
}
