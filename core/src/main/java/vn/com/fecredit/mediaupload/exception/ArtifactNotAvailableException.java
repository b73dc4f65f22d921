package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;
import vn.com.fecredit.mediaupload.model.SessionStatus;

/**
 * The merged file was requested for a session that has not completed.
 */
@Getter
public class ArtifactNotAvailableException extends UploadSessionException {

    private final String sessionId;
    private final SessionStatus status;

    public ArtifactNotAvailableException(String sessionId, SessionStatus status) {
        super("ARTIFACT_NOT_AVAILABLE", !status.isTerminal(),
                "Upload session " + sessionId + " has no merged file, status is " + status);
        this.sessionId = sessionId;
        this.status = status;
    }
}
