package vn.com.fecredit.mediaupload.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;

/**
 * Request object for opening a chunked upload session.
 *
 * <p>
 * Contains everything the server needs to:
 * <ul>
 * <li>Compute how many chunks the file is split into</li>
 * <li>Label the merged artifact</li>
 * <li>Optionally verify the merged bytes against a declared checksum</li>
 * </ul>
 */
public class CreateSessionRequest {

    /**
     * Original name of the file being uploaded.
     * Required and must not be blank.
     */
    @NotBlank
    private String filename;

    /**
     * MIME type reported by the client. Stored as metadata only.
     */
    private String contentType;

    /**
     * Total size of the file in bytes.
     * Must be greater than 0.
     */
    @Positive
    private long totalSize;

    /**
     * Size of every chunk except possibly the last one.
     * Optional; the server default applies when absent.
     */
    @Positive
    private Integer chunkSize;

    /**
     * SHA-256 of the complete file as lowercase hex.
     * Optional; when present the merged artifact is verified against it.
     */
    @Pattern(regexp = "^[0-9a-fA-F]{64}$")
    private String checksum;

    public CreateSessionRequest() {
    }

    public CreateSessionRequest(String filename, String contentType, long totalSize, Integer chunkSize) {
        this.filename = filename;
        this.contentType = contentType;
        this.totalSize = totalSize;
        this.chunkSize = chunkSize;
    }

    /**
     * Gets the filename being uploaded.
     *
     * @return The filename.
     */
    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    /**
     * Gets the total file size in bytes.
     *
     * @return The total file size in bytes.
     */
    public long getTotalSize() {
        return totalSize;
    }

    public void setTotalSize(long totalSize) {
        this.totalSize = totalSize;
    }

    /**
     * Gets the requested chunk size.
     *
     * @return The chunk size in bytes, or null to use the server default
     */
    public Integer getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(Integer chunkSize) {
        this.chunkSize = chunkSize;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }
}
