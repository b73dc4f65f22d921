package vn.com.fecredit.mediaupload.port.interfaces;

import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.model.ArtifactDescriptor;

import java.io.InputStream;

/**
 * Port interface for the durable storage of merged files.
 */
public interface IArtifactStorePort {

    /**
     * Consumes {@code content} to its end and persists it as one artifact.
     *
     * <p>
     * Unchecked exceptions thrown while reading {@code content} propagate unchanged and
     * leave nothing behind.
     *
     * @param descriptor Metadata of the file.
     * @param content    The merged bytes, in order.
     * @return An opaque reference that can later be passed to {@link #open} or {@link #delete}.
     * @throws StorageUnavailableException if the artifact could not be written
     */
    String store(ArtifactDescriptor descriptor, InputStream content);

    /**
     * Opens a stored artifact for reading. The caller closes the stream.
     *
     * @throws StorageUnavailableException if the artifact is missing or unreadable
     */
    InputStream open(String reference);

    /**
     * Deletes an artifact. Deleting a missing artifact is a no-op.
     */
    void delete(String reference);
}
