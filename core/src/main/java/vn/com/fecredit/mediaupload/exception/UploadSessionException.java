package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

/**
 * Base class of every failure raised by the upload engine.
 *
 * <p>
 * {@code errorCode} is stable and safe to expose to clients. {@code retryable} tells
 * whether the same call against the same session may succeed later; a non-retryable
 * failure means the client has to fix its request or start a new session.
 */
@Getter
public abstract class UploadSessionException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected UploadSessionException(String errorCode, boolean retryable, String message) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    protected UploadSessionException(String errorCode, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
