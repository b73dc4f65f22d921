package vn.com.fecredit.mediaupload.model;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.mediaupload.model.util.BitsetUtil;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class MissingChunksTest {

    @Test
    void testIteratesClearBitsAscending() {
        byte[] bitset = BitsetUtil.newBitset(12);
        BitsetUtil.setBit(bitset, 0);
        BitsetUtil.setBit(bitset, 5);
        BitsetUtil.setBit(bitset, 9);
        BitsetUtil.setBit(bitset, 11);

        List<Integer> missing = new ArrayList<>();
        new MissingChunks(bitset, 12).forEach(missing::add);
        assertEquals(List.of(1, 2, 3, 4, 6, 7, 8, 10), missing);
    }

    @Test
    void testSnapshotIgnoresLaterChanges() {
        byte[] bitset = BitsetUtil.newBitset(3);
        MissingChunks missing = new MissingChunks(bitset, 3);
        BitsetUtil.setBit(bitset, 1);

        List<Integer> indices = new ArrayList<>();
        missing.forEach(indices::add);
        assertEquals(List.of(0, 1, 2), indices);
    }

    @Test
    void testEmptyWhenComplete() {
        byte[] bitset = BitsetUtil.newBitset(2);
        BitsetUtil.setBit(bitset, 0);
        BitsetUtil.setBit(bitset, 1);

        Iterator<Integer> it = new MissingChunks(bitset, 2).iterator();
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }
}
