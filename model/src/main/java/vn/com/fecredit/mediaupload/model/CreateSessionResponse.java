package vn.com.fecredit.mediaupload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response returned by the server when a session is opened.
 *
 * <p>
 * Clients split the file into {@code totalChunks} pieces of {@code chunkSize}
 * bytes (the last one may be shorter) and upload them in any order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateSessionResponse {

    /** Session identifier assigned by the server. */
    private String sessionId;
    /** Total number of chunks expected for the file. */
    private int totalChunks;
    /** Chunk size in bytes used for this session. */
    private int chunkSize;

    /**
     * Default constructor for JSON deserialization.
     */
    public CreateSessionResponse() {
    }

    public CreateSessionResponse(String sessionId, int totalChunks, int chunkSize) {
        this.sessionId = sessionId;
        this.totalChunks = totalChunks;
        this.chunkSize = chunkSize;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
}
