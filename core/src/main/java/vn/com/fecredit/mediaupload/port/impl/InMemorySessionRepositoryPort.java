package vn.com.fecredit.mediaupload.port.impl;

import vn.com.fecredit.mediaupload.exception.ConflictException;
import vn.com.fecredit.mediaupload.exception.SessionNotFoundException;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.SessionStatus;
import vn.com.fecredit.mediaupload.port.interfaces.ISessionRepositoryPort;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ISessionRepositoryPort}.
 *
 * <p>
 * Compare-and-swap runs inside {@link ConcurrentHashMap#compute}, which is atomic per key,
 * so a status check and the write that follows it can never interleave with another
 * caller's write for the same session.
 */
public class InMemorySessionRepositoryPort implements ISessionRepositoryPort {

    private final Map<String, ChunkUploadSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<ChunkUploadSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        ChunkUploadSession found = sessions.get(sessionId);
        return Optional.ofNullable(found).map(ChunkUploadSession::new);
    }

    @Override
    public void create(ChunkUploadSession session) {
        if (session == null || session.getSessionId() == null) {
            throw new IllegalArgumentException("Session or sessionId cannot be null");
        }
        ChunkUploadSession previous = sessions.putIfAbsent(session.getSessionId(), new ChunkUploadSession(session));
        if (previous != null) {
            throw new IllegalStateException("Session already exists: " + session.getSessionId());
        }
    }

    @Override
    public ChunkUploadSession compareAndSwap(String sessionId, SessionStatus expectedStatus, Consumer<ChunkUploadSession> mutator) {
        AtomicReference<ChunkUploadSession> written = new AtomicReference<>();
        ChunkUploadSession result = sessions.computeIfPresent(sessionId, (id, current) -> {
            if (current.getStatus() != expectedStatus) {
                throw new ConflictException(id, expectedStatus, current.getStatus());
            }
            ChunkUploadSession next = new ChunkUploadSession(current);
            mutator.accept(next);
            next.setVersion(current.getVersion() + 1);
            written.set(new ChunkUploadSession(next));
            return next;
        });
        if (result == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return written.get();
    }

    @Override
    public List<ChunkUploadSession> findActiveIdleSince(Instant cutoff) {
        return sessions.values().stream()
                .filter(s -> !s.getStatus().isTerminal())
                .filter(s -> s.getLastActivityAt().isBefore(cutoff))
                .map(ChunkUploadSession::new)
                .collect(Collectors.toList());
    }

    @Override
    public List<ChunkUploadSession> findTerminatedBefore(Instant cutoff) {
        return sessions.values().stream()
                .filter(s -> s.getStatus().isTerminal())
                .filter(s -> s.getUpdatedAt().isBefore(cutoff))
                .map(ChunkUploadSession::new)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }
}
