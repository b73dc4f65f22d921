package vn.com.fecredit.mediaupload.manager;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Per-session fence between chunk writers and the start of a merge.
 *
 * <p>
 * Chunk writers share the read side, so uploads of different chunks of the same session
 * run in parallel. Status transitions that close the session to writers (entering
 * {@code MERGING}, expiry) take the write side, which waits for every in-flight writer
 * to finish its store write and its bookkeeping. A writer that gets the read side after
 * such a transition sees the new status and gives up before touching the chunk store.
 *
 * <p>
 * The fence only covers writers inside this process. Across processes the repository
 * compare-and-swap still rejects late writers.
 *
 * <p>
 * Example usage:
 * <pre>
 * ChunkFenceManager fences = new ChunkFenceManager();
 * fences.withWriterFence(sessionId, () -> storeChunk(...));
 * fences.withMergeFence(sessionId, () -> moveToMerging(...));
 * </pre>
 */
public class ChunkFenceManager {

    // Locks for concurrent chunk uploads, one per sessionId
    private final ConcurrentHashMap<String, ReentrantReadWriteLock> sessionLocks = new ConcurrentHashMap<>();

    public <T> T withWriterFence(String sessionId, Supplier<T> action) {
        ReentrantReadWriteLock lock = lockFor(sessionId);
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T withMergeFence(String sessionId, Supplier<T> action) {
        ReentrantReadWriteLock lock = lockFor(sessionId);
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forgets the lock of a session that no longer accepts writes.
     */
    public void release(String sessionId) {
        sessionLocks.remove(sessionId);
    }

    public int size() {
        return sessionLocks.size();
    }

    private ReentrantReadWriteLock lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId, k -> new ReentrantReadWriteLock());
    }
}
