package vn.com.fecredit.mediaupload.port.impl;

import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of {@link IChunkStorePort}. Payloads are copied on the way
 * in and out.
 */
public class InMemoryChunkStorePort implements IChunkStorePort {

    private final Map<String, Map<Integer, byte[]>> chunks = new ConcurrentHashMap<>();

    @Override
    public void put(String sessionId, int chunkIndex, byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Chunk data cannot be null");
        }
        chunks.computeIfAbsent(sessionId, k -> new ConcurrentHashMap<>())
                .put(chunkIndex, Arrays.copyOf(data, data.length));
    }

    @Override
    public Optional<byte[]> get(String sessionId, int chunkIndex) {
        Map<Integer, byte[]> sessionChunks = chunks.get(sessionId);
        if (sessionChunks == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionChunks.get(chunkIndex)).map(b -> Arrays.copyOf(b, b.length));
    }

    @Override
    public void deleteAll(String sessionId) {
        chunks.remove(sessionId);
    }

    /**
     * Number of chunks currently held for a session.
     */
    public int chunkCount(String sessionId) {
        Map<Integer, byte[]> sessionChunks = chunks.get(sessionId);
        return sessionChunks == null ? 0 : sessionChunks.size();
    }
}
