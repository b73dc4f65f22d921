package vn.com.fecredit.mediaupload.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.mediaupload.exception.ConflictException;
import vn.com.fecredit.mediaupload.exception.SessionNotFoundException;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.SessionStatus;
import vn.com.fecredit.mediaupload.model.UploadSessionEntity;
import vn.com.fecredit.mediaupload.model.UploadSessionEntityRepository;
import vn.com.fecredit.mediaupload.port.interfaces.ISessionRepositoryPort;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * JPA implementation of {@link ISessionRepositoryPort}.
 *
 * <p>
 * Each compare-and-swap runs in its own transaction. The status check happens on the
 * loaded row and the optimistic lock on {@link UploadSessionEntity#getVersion()} rejects
 * the write if another transaction changed the row in between.
 */
@Component
@Transactional
public class JpaSessionRepositoryAdapter implements ISessionRepositoryPort {

    private static final Logger log = LoggerFactory.getLogger(JpaSessionRepositoryAdapter.class);

    private final UploadSessionEntityRepository repository;

    public JpaSessionRepositoryAdapter(UploadSessionEntityRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChunkUploadSession> get(String sessionId) {
        return repository.findById(sessionId).map(UploadSessionEntity::toSession);
    }

    @Override
    public void create(ChunkUploadSession session) {
        if (repository.existsById(session.getSessionId())) {
            throw new IllegalStateException("Session already exists: " + session.getSessionId());
        }
        try {
            repository.saveAndFlush(UploadSessionEntity.fromSession(session));
        } catch (DataIntegrityViolationException e) {
            throw new IllegalStateException("Session already exists: " + session.getSessionId(), e);
        }
        log.debug("Persisted new session {}", session.getSessionId());
    }

    @Override
    public ChunkUploadSession compareAndSwap(String sessionId, SessionStatus expectedStatus,
                                             Consumer<ChunkUploadSession> mutator) {
        UploadSessionEntity entity = repository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (entity.getStatus() != expectedStatus) {
            throw new ConflictException(sessionId, expectedStatus, entity.getStatus());
        }
        ChunkUploadSession session = entity.toSession();
        mutator.accept(session);
        entity.apply(session);
        try {
            return repository.saveAndFlush(entity).toSession();
        } catch (ConcurrencyFailureException e) {
            log.debug("Lost optimistic lock on session {} at version {}", sessionId, session.getVersion());
            throw new ConflictException(sessionId, expectedStatus, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChunkUploadSession> findActiveIdleSince(Instant cutoff) {
        return repository.findByStatusInAndLastActivityAtBefore(SessionStatus.nonTerminal(), cutoff).stream()
                .map(UploadSessionEntity::toSession)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChunkUploadSession> findTerminatedBefore(Instant cutoff) {
        return repository.findByStatusInAndUpdatedAtBefore(SessionStatus.terminal(), cutoff).stream()
                .map(UploadSessionEntity::toSession)
                .collect(Collectors.toList());
    }

    @Override
    public boolean delete(String sessionId) {
        if (!repository.existsById(sessionId)) {
            return false;
        }
        repository.deleteById(sessionId);
        return true;
    }
}
