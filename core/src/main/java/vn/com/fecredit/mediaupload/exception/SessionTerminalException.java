package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;
import vn.com.fecredit.mediaupload.model.SessionStatus;

/**
 * The session no longer accepts the requested operation, either because merging has started
 * or because it reached a terminal state.
 */
@Getter
public class SessionTerminalException extends UploadSessionException {

    private final String sessionId;
    private final SessionStatus status;

    public SessionTerminalException(String sessionId, SessionStatus status) {
        super("SESSION_TERMINAL", false, "Upload session " + sessionId + " is " + status);
        this.sessionId = sessionId;
        this.status = status;
    }
}
