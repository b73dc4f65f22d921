package vn.com.fecredit.mediaupload.port.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores every chunk as its own file: {@code <baseDir>/<sessionId>/<chunkIndex>.chunk}.
 *
 * <p>
 * Writes go to a temporary file in the same directory which is then renamed over the
 * target, so a concurrent reader sees either the old or the new payload in full.
 */
public class FileSystemChunkStorePort implements IChunkStorePort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemChunkStorePort.class);
    private static final String CHUNK_SUFFIX = ".chunk";

    private final Path baseDir;

    public FileSystemChunkStorePort(String baseDirPath) throws IOException {
        this.baseDir = Paths.get(baseDirPath).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    @Override
    public void put(String sessionId, int chunkIndex, byte[] data) {
        Path sessionDir = sessionDir(sessionId);
        Path target = sessionDir.resolve(chunkIndex + CHUNK_SUFFIX);
        try {
            Files.createDirectories(sessionDir);
            Path temp = Files.createTempFile(sessionDir, chunkIndex + "-", ".tmp");
            try {
                Files.write(temp, data);
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Stored chunk {} of session {} ({} bytes) at {}", chunkIndex, sessionId, data.length, target);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to write chunk " + chunkIndex + " of session " + sessionId, e);
        }
    }

    @Override
    public Optional<byte[]> get(String sessionId, int chunkIndex) {
        Path chunkPath = sessionDir(sessionId).resolve(chunkIndex + CHUNK_SUFFIX);
        try {
            return Optional.of(Files.readAllBytes(chunkPath));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read chunk " + chunkIndex + " of session " + sessionId, e);
        }
    }

    @Override
    public void deleteAll(String sessionId) {
        Path sessionDir = sessionDir(sessionId);
        if (!Files.isDirectory(sessionDir)) {
            return;
        }
        try {
            try (Stream<Path> files = Files.list(sessionDir)) {
                Iterator<Path> it = files.iterator();
                while (it.hasNext()) {
                    Files.deleteIfExists(it.next());
                }
            }
            Files.deleteIfExists(sessionDir);
            log.debug("Released chunk directory {}", sessionDir);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to release chunks of session " + sessionId, e);
        }
    }

    private Path sessionDir(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be blank");
        }
        Path dir = baseDir.resolve(sessionId).normalize();
        if (!baseDir.equals(dir.getParent())) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return dir;
    }

    static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
