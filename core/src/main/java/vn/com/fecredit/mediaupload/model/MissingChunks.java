package vn.com.fecredit.mediaupload.model;

import vn.com.fecredit.mediaupload.model.util.BitsetUtil;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Ascending sequence of the chunk indices absent from a bitset snapshot.
 *
 * <p>
 * Indices are produced on demand; every call to {@link #iterator()} starts over.
 */
public class MissingChunks implements Iterable<Integer> {

    private final byte[] bitset;
    private final int totalChunks;

    public MissingChunks(byte[] bitset, int totalChunks) {
        this.bitset = BitsetUtil.copyOf(bitset);
        this.totalChunks = totalChunks;
    }

    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<>() {
            private int next = advance(0);

            @Override
            public boolean hasNext() {
                return next < totalChunks;
            }

            @Override
            public Integer next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int current = next;
                next = advance(current + 1);
                return current;
            }
        };
    }

    private int advance(int from) {
        int i = from;
        while (i < totalChunks && BitsetUtil.isBitSet(bitset, i)) {
            i++;
        }
        return i;
    }
}
