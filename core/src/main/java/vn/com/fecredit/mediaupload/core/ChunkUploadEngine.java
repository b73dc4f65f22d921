package vn.com.fecredit.mediaupload.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.mediaupload.exception.ArtifactNotAvailableException;
import vn.com.fecredit.mediaupload.exception.ConflictException;
import vn.com.fecredit.mediaupload.exception.CorruptUploadException;
import vn.com.fecredit.mediaupload.exception.IncompleteUploadException;
import vn.com.fecredit.mediaupload.exception.InvalidChunkIndexException;
import vn.com.fecredit.mediaupload.exception.InvalidChunkSizeException;
import vn.com.fecredit.mediaupload.exception.MergeException;
import vn.com.fecredit.mediaupload.exception.MergeInProgressException;
import vn.com.fecredit.mediaupload.exception.SessionNotFoundException;
import vn.com.fecredit.mediaupload.exception.SessionTerminalException;
import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.manager.ChunkFenceManager;
import vn.com.fecredit.mediaupload.model.ArtifactDescriptor;
import vn.com.fecredit.mediaupload.model.ChunkReceipt;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.SessionStatus;
import vn.com.fecredit.mediaupload.model.SessionStatusView;
import vn.com.fecredit.mediaupload.model.util.ChecksumUtil;
import vn.com.fecredit.mediaupload.model.util.FileNameValidator;
import vn.com.fecredit.mediaupload.port.interfaces.IArtifactStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.ISessionRepositoryPort;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Coordinates the lifecycle of chunked upload sessions over three ports: the session
 * repository, the chunk store and the artifact store.
 *
 * <p>
 * Every change to a session goes through {@link ISessionRepositoryPort#compareAndSwap}.
 * When a concurrent writer wins, the engine reloads the session and tries again, up to
 * {@code maxCasAttempts} times, after which the call fails with
 * {@link StorageUnavailableException}.
 *
 * <p>
 * The move to {@code MERGING} is the barrier between uploading and assembling: at most one
 * caller gets through it per session and no chunk write started after it succeeds.
 * Merging reads chunks in ascending index order whatever order they arrived in.
 *
 * <p>
 * Example usage:
 * <pre>
 * ChunkUploadEngine engine = new ChunkUploadEngine(sessions, chunks, artifacts, Clock.systemUTC());
 * String id = engine.createSession("movie.mp4", "video/mp4", 300000, 100000);
 * engine.uploadChunk(id, 1, second);
 * engine.uploadChunk(id, 0, first);
 * engine.uploadChunk(id, 2, third);
 * String reference = engine.completeSession(id);
 * </pre>
 */
public class ChunkUploadEngine {

    private static final Logger log = LoggerFactory.getLogger(ChunkUploadEngine.class);

    public static final int DEFAULT_MAX_CAS_ATTEMPTS = 16;
    public static final int DEFAULT_MAX_CHUNKS = 1 << 20;

    @Getter
    private final ISessionRepositoryPort sessionRepositoryPort;
    @Getter
    private final IChunkStorePort chunkStorePort;
    @Getter
    private final IArtifactStorePort artifactStorePort;
    @Getter
    private final Clock clock;
    @Getter
    private final int maxCasAttempts;
    @Getter
    private final boolean allowChunkOverwrite;
    @Getter
    private final int maxChunks;
    private final ChunkFenceManager fenceManager = new ChunkFenceManager();

    public ChunkUploadEngine(ISessionRepositoryPort sessionRepositoryPort, IChunkStorePort chunkStorePort,
                             IArtifactStorePort artifactStorePort, Clock clock) {
        this(sessionRepositoryPort, chunkStorePort, artifactStorePort, clock, DEFAULT_MAX_CAS_ATTEMPTS, true);
    }

    /**
     * @param maxCasAttempts      compare-and-swap attempts per update before giving up
     * @param allowChunkOverwrite {@code true} for last-write-wins on re-uploaded chunks; {@code false}
     *                            keeps the first payload and acknowledges duplicates without storing them
     */
    public ChunkUploadEngine(ISessionRepositoryPort sessionRepositoryPort, IChunkStorePort chunkStorePort,
                             IArtifactStorePort artifactStorePort, Clock clock,
                             int maxCasAttempts, boolean allowChunkOverwrite) {
        this(sessionRepositoryPort, chunkStorePort, artifactStorePort, clock, maxCasAttempts, allowChunkOverwrite,
                DEFAULT_MAX_CHUNKS);
    }

    /**
     * @param maxChunks largest chunk count a session may declare; bounds the received-chunk bitset
     */
    public ChunkUploadEngine(ISessionRepositoryPort sessionRepositoryPort, IChunkStorePort chunkStorePort,
                             IArtifactStorePort artifactStorePort, Clock clock,
                             int maxCasAttempts, boolean allowChunkOverwrite, int maxChunks) {
        if (maxCasAttempts < 1) {
            throw new IllegalArgumentException("maxCasAttempts must be at least 1: " + maxCasAttempts);
        }
        this.sessionRepositoryPort = sessionRepositoryPort;
        this.chunkStorePort = chunkStorePort;
        this.artifactStorePort = artifactStorePort;
        this.clock = clock;
        this.maxCasAttempts = maxCasAttempts;
        this.allowChunkOverwrite = allowChunkOverwrite;
        if (maxChunks < 1) {
            throw new IllegalArgumentException("maxChunks must be at least 1: " + maxChunks);
        }
        this.maxChunks = maxChunks;
    }

    public String createSession(String filename, String contentType, long totalSize, int chunkSize) {
        return createSession(filename, contentType, totalSize, chunkSize, null);
    }

    /**
     * Opens a new session in {@code PENDING}.
     *
     * @param expectedChecksum optional SHA-256 (hex) the merged file must match
     * @return the new session id
     * @throws IllegalArgumentException if sizes are not positive, the file needs more than
     *                                  {@code maxChunks} chunks, the file name is unusable or the
     *                                  checksum is malformed
     */
    public String createSession(String filename, String contentType, long totalSize, int chunkSize, String expectedChecksum) {
        if (!FileNameValidator.isValidFileName(filename)) {
            throw new IllegalArgumentException("Invalid file name: " + filename);
        }
        int totalChunks = ChunkUploadSession.computeTotalChunks(totalSize, chunkSize);
        if (totalChunks > maxChunks) {
            throw new IllegalArgumentException("File of " + totalSize + " bytes needs " + totalChunks
                    + " chunks of " + chunkSize + " bytes, at most " + maxChunks + " are allowed");
        }
        String checksum = ChecksumUtil.normalize(expectedChecksum);
        String sessionId = UUID.randomUUID().toString();
        ChunkUploadSession session = ChunkUploadSession.create(sessionId, filename, contentType,
                totalSize, chunkSize, checksum, clock.instant());
        sessionRepositoryPort.create(session);
        log.info("Created upload session {} for '{}': {} bytes in {} chunk(s) of {} bytes",
                sessionId, filename, totalSize, session.getTotalChunks(), chunkSize);
        return sessionId;
    }

    /**
     * Stores one chunk and records it as received.
     *
     * @throws SessionNotFoundException   if the session is unknown
     * @throws InvalidChunkIndexException if {@code chunkIndex} is outside {@code [0, totalChunks)}
     * @throws InvalidChunkSizeException  if the payload length does not fit the session layout
     * @throws SessionTerminalException   if the session is merging or terminal
     */
    public ChunkReceipt uploadChunk(String sessionId, int chunkIndex, byte[] data) {
        ChunkUploadSession session = load(sessionId);
        checkAcceptsChunks(session);
        if (chunkIndex < 0 || chunkIndex >= session.getTotalChunks()) {
            throw new InvalidChunkIndexException(sessionId, chunkIndex, session.getTotalChunks());
        }
        long expectedLength = session.expectedChunkLength(chunkIndex);
        long actualLength = data != null ? data.length : -1;
        if (actualLength != expectedLength) {
            throw new InvalidChunkSizeException(sessionId, chunkIndex, expectedLength, actualLength);
        }
        return fenceManager.withWriterFence(sessionId, () -> writeChunk(sessionId, chunkIndex, data));
    }

    private ChunkReceipt writeChunk(String sessionId, int chunkIndex, byte[] data) {
        // The status may have moved on while this writer waited for the fence
        ChunkUploadSession session = load(sessionId);
        checkAcceptsChunks(session);
        if (!allowChunkOverwrite && session.isChunkReceived(chunkIndex)) {
            log.debug("Chunk {} of session {} already received, keeping the stored payload", chunkIndex, sessionId);
        } else {
            chunkStorePort.put(sessionId, chunkIndex, data);
        }

        Instant now = clock.instant();
        ChunkUploadSession updated = updateWithRetry(sessionId, s -> {
            checkAcceptsChunks(s);
            return true;
        }, s -> {
            s.markChunkReceived(chunkIndex);
            if (s.getStatus() == SessionStatus.PENDING) {
                s.transitionTo(SessionStatus.IN_PROGRESS, now);
            }
            s.touch(now);
        });
        log.debug("Chunk {} of session {} recorded: {}/{} received",
                chunkIndex, sessionId, updated.getReceivedCount(), updated.getTotalChunks());
        return new ChunkReceipt(sessionId, chunkIndex, updated.getReceivedCount(), updated.getTotalChunks());
    }

    /**
     * Merges every chunk into the artifact store and returns the artifact reference.
     * Calling it again on a completed session returns the same reference without merging again.
     *
     * @throws SessionNotFoundException   if the session is unknown
     * @throws IncompleteUploadException  if chunks are missing; the session stays open
     * @throws MergeInProgressException   if another caller is merging this session
     * @throws MergeException             if storage failed; the session is open again
     * @throws CorruptUploadException     if the stored chunks cannot produce the declared file; the session failed
     * @throws SessionTerminalException   if the session failed or expired, also when it expires mid-merge
     */
    public String completeSession(String sessionId) {
        ChunkUploadSession session = load(sessionId);
        if (session.getStatus() == SessionStatus.COMPLETED) {
            log.debug("Session {} already completed, returning {}", sessionId, session.getResultReference());
            return session.getResultReference();
        }

        Instant now = clock.instant();
        ChunkUploadSession merging = fenceManager.withMergeFence(sessionId,
                () -> updateWithRetry(sessionId, this::canEnterMerging, s -> {
                    s.transitionTo(SessionStatus.MERGING, now);
                    s.touch(now);
                }));
        if (merging == null) {
            // Completed by a concurrent caller after the first read
            return load(sessionId).getResultReference();
        }
        log.info("Session {} is merging {} chunk(s)", sessionId, merging.getTotalChunks());

        List<Integer> missing = merging.missingChunks();
        if (!missing.isEmpty()) {
            IncompleteUploadException incomplete = new IncompleteUploadException(sessionId, missing);
            revertToInProgress(sessionId, incomplete);
            log.info("Session {} cannot complete yet, missing chunks {}", sessionId, missing);
            throw incomplete;
        }
        return merge(merging);
    }

    private boolean canEnterMerging(ChunkUploadSession session) {
        String sessionId = session.getSessionId();
        switch (session.getStatus()) {
            case COMPLETED:
                return false;
            case MERGING:
                throw new MergeInProgressException(sessionId);
            case FAILED:
            case EXPIRED:
                throw new SessionTerminalException(sessionId, session.getStatus());
            case PENDING:
                throw new IncompleteUploadException(sessionId, session.missingChunks());
            default:
                return true;
        }
    }

    private String merge(ChunkUploadSession session) {
        String sessionId = session.getSessionId();
        MergedChunkInputStream merged = new MergedChunkInputStream(chunkStorePort, sessionId, session.getTotalChunks());
        String reference;
        try {
            reference = artifactStorePort.store(ArtifactDescriptor.of(session), merged);
        } catch (CorruptUploadException e) {
            failSession(sessionId, e, null);
            throw e;
        } catch (StorageUnavailableException | UncheckedIOException e) {
            MergeException failure = new MergeException(sessionId,
                    "Failed to merge session " + sessionId + ": " + e.getMessage(), e);
            revertToInProgress(sessionId, failure);
            log.warn("Merge of session {} failed, session reopened: {}", sessionId, e.getMessage());
            throw failure;
        } catch (RuntimeException e) {
            revertToInProgress(sessionId, e);
            throw e;
        }

        String problem = verify(session, merged);
        if (problem != null) {
            CorruptUploadException corrupt = new CorruptUploadException(sessionId, problem);
            failSession(sessionId, corrupt, reference);
            throw corrupt;
        }
        return finish(session, reference);
    }

    private String verify(ChunkUploadSession session, MergedChunkInputStream merged) {
        if (!merged.isExhausted()) {
            return "Stored chunks of session " + session.getSessionId() + " exceed the declared size of "
                    + session.getTotalSize() + " bytes";
        }
        if (merged.getBytesRead() != session.getTotalSize()) {
            return "Merged length " + merged.getBytesRead() + " differs from declared size " + session.getTotalSize();
        }
        String expected = session.getExpectedChecksum();
        if (expected != null) {
            String actual = merged.checksumHex();
            if (!expected.equals(actual)) {
                return "Checksum mismatch after merge: expected " + expected + ", actual " + actual;
            }
        }
        return null;
    }

    private String finish(ChunkUploadSession session, String reference) {
        String sessionId = session.getSessionId();
        Instant now = clock.instant();
        try {
            updateWithRetry(sessionId, s -> {
                if (s.getStatus() != SessionStatus.MERGING) {
                    throw new SessionTerminalException(sessionId, s.getStatus());
                }
                return true;
            }, s -> s.markCompleted(reference, now));
        } catch (RuntimeException e) {
            log.warn("Session {} could not be marked completed, discarding artifact {}: {}", sessionId, reference, e.getMessage());
            discardArtifact(reference, e);
            revertToInProgress(sessionId, e);
            throw e;
        }
        fenceManager.release(sessionId);
        releaseChunks(sessionId);
        log.info("Session {} completed: {} bytes merged into {}", sessionId, session.getTotalSize(), reference);
        return reference;
    }

    /**
     * Read-only view of a session.
     *
     * @throws SessionNotFoundException if the session is unknown
     */
    public SessionStatusView getStatus(String sessionId) {
        return new SessionStatusView(load(sessionId));
    }

    /**
     * Opens the merged file of a completed session. The caller closes the stream.
     *
     * @throws SessionNotFoundException      if the session is unknown
     * @throws ArtifactNotAvailableException if the session has not completed
     */
    public InputStream openArtifact(String sessionId) {
        ChunkUploadSession session = load(sessionId);
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new ArtifactNotAvailableException(sessionId, session.getStatus());
        }
        return artifactStorePort.open(session.getResultReference());
    }

    /**
     * Expires every non-terminal session, {@code MERGING} included, whose last activity is
     * more than {@code ttl} before {@code now}, and releases its chunk bytes. Records are kept.
     * A failure on one session is logged and does not stop the others.
     *
     * @return number of sessions expired by this call
     */
    public int expireStalled(Instant now, Duration ttl) {
        Instant cutoff = now.minus(ttl);
        List<ChunkUploadSession> candidates = sessionRepositoryPort.findActiveIdleSince(cutoff);
        int expired = 0;
        for (ChunkUploadSession candidate : candidates) {
            String sessionId = candidate.getSessionId();
            try {
                if (expire(sessionId, cutoff, now)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to expire session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        if (expired > 0) {
            log.info("Expired {} of {} idle session(s) with no activity since {}", expired, candidates.size(), cutoff);
        }
        return expired;
    }

    private boolean expire(String sessionId, Instant cutoff, Instant now) {
        ChunkUploadSession expired = fenceManager.withMergeFence(sessionId,
                () -> updateWithRetry(sessionId,
                        s -> !s.getStatus().isTerminal() && s.getLastActivityAt().isBefore(cutoff),
                        s -> s.transitionTo(SessionStatus.EXPIRED, now)));
        if (expired == null) {
            return false;
        }
        fenceManager.release(sessionId);
        releaseChunks(sessionId);
        log.info("Session {} expired, last activity at {}", sessionId, expired.getLastActivityAt());
        return true;
    }

    /**
     * Deletes terminal sessions last updated more than {@code retention} before {@code now}.
     * Chunk bytes are released once more first, which also clears chunks an earlier release
     * could not remove.
     *
     * @return number of session records deleted
     */
    public int purgeTerminated(Instant now, Duration retention) {
        Instant cutoff = now.minus(retention);
        int purged = 0;
        for (ChunkUploadSession session : sessionRepositoryPort.findTerminatedBefore(cutoff)) {
            String sessionId = session.getSessionId();
            try {
                chunkStorePort.deleteAll(sessionId);
                if (sessionRepositoryPort.delete(sessionId)) {
                    purged++;
                }
                fenceManager.release(sessionId);
            } catch (RuntimeException e) {
                log.error("Failed to purge session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        if (purged > 0) {
            log.info("Purged {} terminated session(s) last updated before {}", purged, cutoff);
        }
        return purged;
    }

    private ChunkUploadSession load(String sessionId) {
        if (sessionId == null) {
            throw new SessionNotFoundException(null);
        }
        return sessionRepositoryPort.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private void checkAcceptsChunks(ChunkUploadSession session) {
        if (!session.getStatus().acceptsChunks()) {
            throw new SessionTerminalException(session.getSessionId(), session.getStatus());
        }
    }

    /**
     * Applies {@code mutator} through the repository compare-and-swap, reloading and retrying
     * when a concurrent writer gets there first.
     *
     * <p>
     * {@code guard} is evaluated on the freshly loaded state and again on the state the
     * repository hands to the mutator. It may throw to abort the update; returning
     * {@code false} skips it.
     *
     * @return the session as written, or {@code null} if the guard skipped the update
     * @throws StorageUnavailableException if every attempt lost a race
     */
    private ChunkUploadSession updateWithRetry(String sessionId, Predicate<ChunkUploadSession> guard,
                                               Consumer<ChunkUploadSession> mutator) {
        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            ChunkUploadSession current = load(sessionId);
            if (!guard.test(current)) {
                return null;
            }
            SessionStatus expected = current.getStatus();
            try {
                return sessionRepositoryPort.compareAndSwap(sessionId, expected, latest -> {
                    if (!guard.test(latest)) {
                        throw new ConflictException(sessionId, expected, latest.getStatus());
                    }
                    mutator.accept(latest);
                });
            } catch (ConflictException e) {
                log.debug("Compare-and-swap on session {} lost a race (attempt {}/{}): {}",
                        sessionId, attempt, maxCasAttempts, e.getMessage());
            }
        }
        throw new StorageUnavailableException("Session " + sessionId + " is too contended, gave up after "
                + maxCasAttempts + " attempts");
    }

    private void revertToInProgress(String sessionId, Throwable cause) {
        try {
            updateWithRetry(sessionId,
                    s -> s.getStatus() == SessionStatus.MERGING,
                    s -> s.transitionTo(SessionStatus.IN_PROGRESS, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to move session {} back to IN_PROGRESS, it stays fenced until it expires", sessionId, e);
            cause.addSuppressed(e);
        }
    }

    private void failSession(String sessionId, CorruptUploadException cause, String reference) {
        Instant now = clock.instant();
        try {
            updateWithRetry(sessionId, s -> {
                if (s.getStatus() != SessionStatus.MERGING) {
                    throw new SessionTerminalException(sessionId, s.getStatus());
                }
                return true;
            }, s -> s.markFailed(cause.getMessage(), now));
            log.error("Session {} is corrupt and has been failed: {}", sessionId, cause.getMessage());
        } catch (SessionTerminalException e) {
            // Expired mid-merge: the expiry released the chunks, nothing is corrupt
            log.info("Session {} became {} during its merge, dropping the merge", sessionId, e.getStatus());
            e.addSuppressed(cause);
            if (reference != null) {
                discardArtifact(reference, e);
            }
            fenceManager.release(sessionId);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to mark corrupt session {} as FAILED", sessionId, e);
            cause.addSuppressed(e);
        }
        if (reference != null) {
            discardArtifact(reference, cause);
        }
        fenceManager.release(sessionId);
        releaseChunks(sessionId);
    }

    private void discardArtifact(String reference, Throwable cause) {
        try {
            artifactStorePort.delete(reference);
        } catch (RuntimeException e) {
            log.warn("Failed to delete artifact {}: {}", reference, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private void releaseChunks(String sessionId) {
        try {
            chunkStorePort.deleteAll(sessionId);
        } catch (RuntimeException e) {
            log.warn("Failed to release chunks of session {}, the purge pass will retry: {}", sessionId, e.getMessage());
        }
    }
}
