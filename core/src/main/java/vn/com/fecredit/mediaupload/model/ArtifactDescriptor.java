package vn.com.fecredit.mediaupload.model;

import lombok.Value;

/**
 * What the artifact store needs to know about the file it is about to persist.
 */
@Value
public class ArtifactDescriptor {
    String sessionId;
    String filename;
    String contentType;
    long totalSize;

    public static ArtifactDescriptor of(ChunkUploadSession session) {
        return new ArtifactDescriptor(session.getSessionId(), session.getFilename(),
                session.getContentType(), session.getTotalSize());
    }
}
