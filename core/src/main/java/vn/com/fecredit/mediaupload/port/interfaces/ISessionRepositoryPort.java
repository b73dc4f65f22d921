package vn.com.fecredit.mediaupload.port.interfaces;

import vn.com.fecredit.mediaupload.exception.ConflictException;
import vn.com.fecredit.mediaupload.exception.SessionNotFoundException;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Port interface for the persistence of upload sessions.
 *
 * <p>
 * {@link #compareAndSwap} is the only way an existing session changes. Implementations
 * must make the status check, the mutation and the write a single atomic step per
 * session, so that two callers can never both win the same transition.
 *
 * <p>
 * Sessions returned by this port are detached copies; mutating them has no effect on
 * the stored state.
 */
public interface ISessionRepositoryPort {

    /**
     * Finds a session by its id.
     *
     * @param sessionId The session id.
     * @return An Optional containing a copy of the session if found, otherwise empty.
     */
    Optional<ChunkUploadSession> get(String sessionId);

    /**
     * Stores a new session.
     *
     * @param session The session to store.
     * @throws IllegalStateException if a session with the same id already exists
     */
    void create(ChunkUploadSession session);

    /**
     * Applies {@code mutator} to the current state of the session if, and only if, its
     * status is still {@code expectedStatus}.
     *
     * <p>
     * If the mutator throws, nothing is written and the exception propagates.
     *
     * @param sessionId      The session id.
     * @param expectedStatus Status the caller last observed.
     * @param mutator        Mutation applied to the latest stored state.
     * @return A copy of the session as written.
     * @throws SessionNotFoundException if the session does not exist
     * @throws ConflictException        if the status differs or a concurrent write won
     */
    ChunkUploadSession compareAndSwap(String sessionId, SessionStatus expectedStatus, Consumer<ChunkUploadSession> mutator);

    /**
     * Non-terminal sessions whose last activity is strictly before {@code cutoff}.
     */
    List<ChunkUploadSession> findActiveIdleSince(Instant cutoff);

    /**
     * Terminal sessions last updated strictly before {@code cutoff}.
     */
    List<ChunkUploadSession> findTerminatedBefore(Instant cutoff);

    /**
     * Removes a session record.
     *
     * @return {@code true} if a record was removed
     */
    boolean delete(String sessionId);
}
