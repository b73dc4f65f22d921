package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;
import vn.com.fecredit.mediaupload.model.SessionStatus;

/**
 * A compare-and-swap lost its race. The engine reloads and retries; callers outside the
 * engine should never see this.
 */
@Getter
public class ConflictException extends UploadSessionException {

    private final String sessionId;
    private final SessionStatus expectedStatus;
    private final SessionStatus actualStatus;

    public ConflictException(String sessionId, SessionStatus expectedStatus, SessionStatus actualStatus) {
        super("CONFLICT", true, "Session " + sessionId + " expected " + expectedStatus + " but was " + actualStatus);
        this.sessionId = sessionId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = actualStatus;
    }

    public ConflictException(String sessionId, SessionStatus expectedStatus, Throwable cause) {
        super("CONFLICT", true, "Session " + sessionId + " was modified concurrently", cause);
        this.sessionId = sessionId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = null;
    }
}
