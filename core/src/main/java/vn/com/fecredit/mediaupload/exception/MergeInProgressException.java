package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

@Getter
public class MergeInProgressException extends UploadSessionException {

    private final String sessionId;

    public MergeInProgressException(String sessionId) {
        super("MERGE_IN_PROGRESS", true, "Upload session " + sessionId + " is already being merged");
        this.sessionId = sessionId;
    }
}
