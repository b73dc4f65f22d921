package vn.com.fecredit.mediaupload.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.model.ArtifactDescriptor;
import vn.com.fecredit.mediaupload.port.interfaces.IArtifactStorePort;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes merged files to {@code <completeDir>/<sessionId>_<filename>}. The reference handed back
 * is that file name, relative to {@code completeDir}.
 */
public class FileSystemArtifactStorePort implements IArtifactStorePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStorePort.class);

    private final Path completeDir;

    public FileSystemArtifactStorePort(String completeDirPath) throws IOException {
        this.completeDir = Paths.get(completeDirPath).toAbsolutePath().normalize();
        Files.createDirectories(this.completeDir);
    }

    @Override
    public String store(ArtifactDescriptor descriptor, InputStream content) {
        String reference = descriptor.getSessionId() + "_" + descriptor.getFilename();
        Path finalPath = resolve(reference);
        Path temp = null;
        try {
            temp = Files.createTempFile(completeDir, descriptor.getSessionId() + "-", ".tmp");
            long written = Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            FileSystemChunkStorePort.moveIntoPlace(temp, finalPath);
            log.debug("Stored artifact {} ({} bytes) for session {}", finalPath, written, descriptor.getSessionId());
            return reference;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to store artifact for session " + descriptor.getSessionId(), e);
        } finally {
            if (temp != null) {
                deleteTempFile(temp);
            }
        }
    }

    @Override
    public InputStream open(String reference) {
        try {
            return Files.newInputStream(resolve(reference));
        } catch (NoSuchFileException e) {
            throw new StorageUnavailableException("Artifact not found: " + reference, e);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to open artifact " + reference, e);
        }
    }

    @Override
    public void delete(String reference) {
        try {
            if (Files.deleteIfExists(resolve(reference))) {
                log.debug("Deleted artifact {}", reference);
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to delete artifact " + reference, e);
        }
    }

    /**
     * Absolute path of an artifact reference.
     */
    public Path resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Artifact reference cannot be blank");
        }
        Path path = completeDir.resolve(reference).normalize();
        if (!completeDir.equals(path.getParent())) {
            throw new IllegalArgumentException("Invalid artifact reference: " + reference);
        }
        return path;
    }

    private void deleteTempFile(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary artifact file {}: {}", temp, e.getMessage());
        }
    }
}
