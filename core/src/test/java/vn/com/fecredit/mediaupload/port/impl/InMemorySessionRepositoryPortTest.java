package vn.com.fecredit.mediaupload.port.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.mediaupload.exception.ConflictException;
import vn.com.fecredit.mediaupload.exception.SessionNotFoundException;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.SessionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySessionRepositoryPortTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemorySessionRepositoryPort repository;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionRepositoryPort();
    }

    @Test
    void testCreateAndGetReturnsCopies() {
        repository.create(session("s-1", 4));

        ChunkUploadSession loaded = repository.get("s-1").orElseThrow();
        loaded.markChunkReceived(0);
        loaded.setStatus(SessionStatus.FAILED);

        ChunkUploadSession again = repository.get("s-1").orElseThrow();
        assertEquals(SessionStatus.PENDING, again.getStatus());
        assertEquals(0, again.getReceivedCount());
        assertTrue(repository.get("unknown").isEmpty());
    }

    @Test
    void testCreateDuplicateRejected() {
        repository.create(session("s-1", 4));
        assertThrows(IllegalStateException.class, () -> repository.create(session("s-1", 4)));
    }

    @Test
    void testCompareAndSwap_appliesMutationAndBumpsVersion() {
        repository.create(session("s-1", 4));

        ChunkUploadSession written = repository.compareAndSwap("s-1", SessionStatus.PENDING, s -> {
            s.markChunkReceived(2);
            s.transitionTo(SessionStatus.IN_PROGRESS, NOW);
        });

        assertEquals(SessionStatus.IN_PROGRESS, written.getStatus());
        assertEquals(1, written.getVersion());
        ChunkUploadSession stored = repository.get("s-1").orElseThrow();
        assertTrue(stored.isChunkReceived(2));
        assertEquals(1, stored.getVersion());
    }

    @Test
    void testCompareAndSwap_statusMismatchIsConflict() {
        repository.create(session("s-1", 4));

        ConflictException ex = assertThrows(ConflictException.class,
                () -> repository.compareAndSwap("s-1", SessionStatus.IN_PROGRESS, s -> s.markChunkReceived(0)));
        assertEquals(SessionStatus.PENDING, ex.getActualStatus());
        assertEquals(0, repository.get("s-1").orElseThrow().getReceivedCount());
    }

    @Test
    void testCompareAndSwap_unknownSession() {
        assertThrows(SessionNotFoundException.class,
                () -> repository.compareAndSwap("nope", SessionStatus.PENDING, s -> s.markChunkReceived(0)));
    }

    @Test
    void testCompareAndSwap_failingMutatorLeavesStateUnchanged() {
        repository.create(session("s-1", 4));

        assertThrows(IllegalStateException.class, () -> repository.compareAndSwap("s-1", SessionStatus.PENDING, s -> {
            s.markChunkReceived(1);
            s.transitionTo(SessionStatus.COMPLETED, NOW);
        }));

        ChunkUploadSession stored = repository.get("s-1").orElseThrow();
        assertEquals(0, stored.getReceivedCount());
        assertEquals(0, stored.getVersion());
    }

    @Test
    void testCompareAndSwap_concurrentMutationsAreNotLost() throws Exception {
        int n = 64;
        repository.create(session("s-1", n));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChunkUploadSession>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < n; i++) {
                final int index = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return repository.compareAndSwap("s-1", SessionStatus.PENDING, s -> s.markChunkReceived(index));
                }));
            }
            start.countDown();
            for (Future<ChunkUploadSession> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ChunkUploadSession stored = repository.get("s-1").orElseThrow();
        assertEquals(n, stored.getReceivedCount());
        assertEquals(n, stored.getVersion());
    }

    @Test
    void testFindQueries() {
        ChunkUploadSession idle = session("idle", 1);
        idle.setLastActivityAt(NOW.minus(Duration.ofHours(1)));
        ChunkUploadSession busy = session("busy", 1);
        ChunkUploadSession done = session("done", 1);
        done.setStatus(SessionStatus.EXPIRED);
        done.setLastActivityAt(NOW.minus(Duration.ofHours(2)));
        done.setUpdatedAt(NOW.minus(Duration.ofDays(10)));
        repository.create(idle);
        repository.create(busy);
        repository.create(done);

        Instant cutoff = NOW.minus(Duration.ofMinutes(30));
        assertEquals(List.of("idle"), ids(repository.findActiveIdleSince(cutoff)));
        assertEquals(List.of("done"), ids(repository.findTerminatedBefore(NOW.minus(Duration.ofDays(7)))));
        assertTrue(repository.findTerminatedBefore(NOW.minus(Duration.ofDays(11))).isEmpty());
    }

    @Test
    void testDelete() {
        repository.create(session("s-1", 1));
        assertTrue(repository.delete("s-1"));
        assertFalse(repository.delete("s-1"));
        assertTrue(repository.get("s-1").isEmpty());
    }

    private static ChunkUploadSession session(String id, int totalChunks) {
        return ChunkUploadSession.create(id, id + ".bin", null, totalChunks * 10L, 10, null, NOW);
    }

    private static List<String> ids(List<ChunkUploadSession> sessions) {
        return sessions.stream().map(ChunkUploadSession::getSessionId).sorted().collect(Collectors.toList());
    }
}
