package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

/**
 * The stored chunks cannot produce the declared file. The session has been failed and its
 * bytes released; the client has to start over.
 */
@Getter
public class CorruptUploadException extends UploadSessionException {

    private final String sessionId;

    public CorruptUploadException(String sessionId, String message) {
        super("CORRUPT_UPLOAD", false, message);
        this.sessionId = sessionId;
    }
}
