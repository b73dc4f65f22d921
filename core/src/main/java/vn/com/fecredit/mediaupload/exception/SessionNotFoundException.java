package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends UploadSessionException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("SESSION_NOT_FOUND", false, "Upload session not found: " + sessionId);
        this.sessionId = sessionId;
    }
}
