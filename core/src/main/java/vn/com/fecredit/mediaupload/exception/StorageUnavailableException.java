package vn.com.fecredit.mediaupload.exception;

/**
 * A backing store could not be reached or refused the operation.
 */
public class StorageUnavailableException extends UploadSessionException {

    public StorageUnavailableException(String message) {
        super("STORAGE_UNAVAILABLE", true, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super("STORAGE_UNAVAILABLE", true, message, cause);
    }
}
