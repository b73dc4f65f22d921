package vn.com.fecredit.mediaupload.exception;

import lombok.Getter;

import java.util.List;

/**
 * Completion was requested while chunks are still missing. The session stays open and the
 * client may upload the listed indices and try again.
 */
@Getter
public class IncompleteUploadException extends UploadSessionException {

    private final String sessionId;
    private final List<Integer> missingIndices;

    public IncompleteUploadException(String sessionId, List<Integer> missingIndices) {
        super("INCOMPLETE_UPLOAD", true,
                "Upload session " + sessionId + " is missing " + missingIndices.size() + " chunk(s)");
        this.sessionId = sessionId;
        this.missingIndices = List.copyOf(missingIndices);
    }
}
