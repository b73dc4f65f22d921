package vn.com.fecredit.mediaupload.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Status document of an upload session.
 *
 * <p>
 * {@code missingIndices} lists the chunk indices that still have to be uploaded,
 * ascending. Clients resuming an interrupted upload should only send those.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatusResponse {
    private String sessionId;
    private SessionStatus status;
    private String filename;
    private String contentType;
    private long totalSize;
    private int chunkSize;
    private int totalChunks;
    private int receivedCount;
    private double progressPercent;
    private List<Integer> missingIndices;
    private String resultReference;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private Instant lastActivityAt;
}
