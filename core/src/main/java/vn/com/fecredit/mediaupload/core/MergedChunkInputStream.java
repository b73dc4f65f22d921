package vn.com.fecredit.mediaupload.core;

import vn.com.fecredit.mediaupload.exception.CorruptUploadException;
import vn.com.fecredit.mediaupload.model.util.ChecksumUtil;
import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;

import java.io.InputStream;
import java.security.MessageDigest;

/**
 * Concatenation of a session's chunks in ascending index order.
 *
 * <p>
 * Only one chunk is held in memory at a time; the next one is fetched from the store when
 * the current one is used up. Every byte handed out is counted and fed to a SHA-256 digest,
 * so the caller can verify length and checksum once the stream has been drained.
 *
 * <p>
 * A chunk missing from the store raises {@link CorruptUploadException}. Store failures
 * propagate as thrown by the store.
 */
class MergedChunkInputStream extends InputStream {

    private final IChunkStorePort chunkStorePort;
    private final String sessionId;
    private final int totalChunks;
    private final MessageDigest digest = ChecksumUtil.newSha256();

    private int nextChunk;
    private byte[] current = new byte[0];
    private int position;
    private long bytesRead;

    MergedChunkInputStream(IChunkStorePort chunkStorePort, String sessionId, int totalChunks) {
        this.chunkStorePort = chunkStorePort;
        this.sessionId = sessionId;
        this.totalChunks = totalChunks;
    }

    @Override
    public int read() {
        if (!ensureAvailable()) {
            return -1;
        }
        int b = current[position++] & 0xFF;
        digest.update((byte) b);
        bytesRead++;
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) {
        if (len == 0) {
            return 0;
        }
        if (!ensureAvailable()) {
            return -1;
        }
        int n = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, n);
        digest.update(current, position, n);
        position += n;
        bytesRead += n;
        return n;
    }

    private boolean ensureAvailable() {
        while (position >= current.length) {
            if (nextChunk >= totalChunks) {
                return false;
            }
            int index = nextChunk++;
            current = chunkStorePort.get(sessionId, index)
                    .orElseThrow(() -> new CorruptUploadException(sessionId,
                            "Chunk " + index + " of session " + sessionId + " is marked received but missing from the chunk store"));
            position = 0;
        }
        return true;
    }

    boolean isExhausted() {
        return nextChunk >= totalChunks && position >= current.length;
    }

    long getBytesRead() {
        return bytesRead;
    }

    String checksumHex() {
        return ChecksumUtil.toHex(digest.digest());
    }
}
