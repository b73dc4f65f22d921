package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

/**
 * Storage failed while assembling the artifact. The session is back in {@code IN_PROGRESS}
 * and completion can be retried without re-uploading.
 */
@Getter
public class MergeException extends UploadSessionException {

    private final String sessionId;

    public MergeException(String sessionId, String message, Throwable cause) {
        super("MERGE_FAILED", true, message, cause);
        this.sessionId = sessionId;
    }
}
