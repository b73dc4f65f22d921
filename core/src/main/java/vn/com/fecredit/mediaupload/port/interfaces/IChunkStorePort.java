package vn.com.fecredit.mediaupload.port.interfaces;

import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;

import java.util.Optional;

/**
 * Port interface for the temporary storage of chunk bytes, keyed by session id and chunk index.
 *
 * <p>
 * A reader never observes a partially written chunk: {@link #get} returns either the
 * previous payload or the new one. Every method may throw {@link StorageUnavailableException}.
 */
public interface IChunkStorePort {

    /**
     * Stores a chunk, replacing any payload previously stored under the same index.
     */
    void put(String sessionId, int chunkIndex, byte[] data);

    /**
     * @return the chunk bytes, or empty if nothing is stored under this index
     */
    Optional<byte[]> get(String sessionId, int chunkIndex);

    /**
     * Releases every chunk of the session. Releasing an unknown session is a no-op.
     */
    void deleteAll(String sessionId);
}
