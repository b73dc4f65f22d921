package vn.com.fecredit.mediaupload.model.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BitsetUtilTest {

    @Test
    void testNewBitset_sizeRoundsUpToWholeBytes() {
        assertEquals(0, BitsetUtil.newBitset(0).length);
        assertEquals(1, BitsetUtil.newBitset(5).length);
        assertEquals(1, BitsetUtil.newBitset(8).length);
        assertEquals(2, BitsetUtil.newBitset(10).length);
    }

    @Test
    void testByteLength_doesNotWrapNearIntLimit() {
        assertEquals(268435456, BitsetUtil.byteLength(Integer.MAX_VALUE));
        assertEquals(268435456, BitsetUtil.byteLength(Integer.MAX_VALUE - 6));
        assertEquals(268435455, BitsetUtil.byteLength(Integer.MAX_VALUE - 7));
        assertEquals(2, BitsetUtil.byteLength(9));
    }

    @Test
    void testNewBitset_negativeRejected() {
        assertThrows(IllegalArgumentException.class, () -> BitsetUtil.newBitset(-1));
    }

    /**
     * Chunks 0, 1, 8 and 9 of a 10 chunk upload.
     *
     * <p>
     * Expected result: first byte 00000011, second byte 00000011
     */
    @Test
    void testSetBit_lowBitsFirst() {
        byte[] bitset = BitsetUtil.newBitset(10);
        BitsetUtil.setBit(bitset, 0);
        BitsetUtil.setBit(bitset, 1);
        BitsetUtil.setBit(bitset, 8);
        BitsetUtil.setBit(bitset, 9);
        assertEquals((byte) 0x03, bitset[0], "Bitset: " + BitsetUtil.bitsetToString(bitset));
        assertEquals((byte) 0x03, bitset[1], "Bitset: " + BitsetUtil.bitsetToString(bitset));
        assertEquals("00000011 00000011", BitsetUtil.bitsetToString(bitset));
    }

    @Test
    void testSetBit_outOfRange() {
        byte[] bitset = BitsetUtil.newBitset(10);
        assertThrows(IndexOutOfBoundsException.class, () -> BitsetUtil.setBit(bitset, 16));
        assertThrows(IndexOutOfBoundsException.class, () -> BitsetUtil.setBit(bitset, -1));
    }

    @Test
    void testSetBit_idempotent() {
        byte[] bitset = BitsetUtil.newBitset(3);
        BitsetUtil.setBit(bitset, 2);
        BitsetUtil.setBit(bitset, 2);
        assertEquals(1, BitsetUtil.countSetBits(bitset, 3));
    }

    @Test
    void testIsBitSet() {
        byte[] bitset = BitsetUtil.newBitset(12);
        BitsetUtil.setBit(bitset, 11);
        assertTrue(BitsetUtil.isBitSet(bitset, 11));
        assertFalse(BitsetUtil.isBitSet(bitset, 10));
        assertFalse(BitsetUtil.isBitSet(bitset, 100));
        assertFalse(BitsetUtil.isBitSet(null, 0));
    }

    @Test
    void testCountSetBitsAndComplete() {
        int totalChunks = 13;
        byte[] bitset = BitsetUtil.newBitset(totalChunks);
        for (int i = 0; i < totalChunks; i++) {
            assertFalse(BitsetUtil.isComplete(bitset, totalChunks));
            BitsetUtil.setBit(bitset, i);
            assertEquals(i + 1, BitsetUtil.countSetBits(bitset, totalChunks));
        }
        assertTrue(BitsetUtil.isComplete(bitset, totalChunks));
    }

    @Test
    void testClearBits_ascending() {
        byte[] bitset = BitsetUtil.newBitset(6);
        BitsetUtil.setBit(bitset, 0);
        BitsetUtil.setBit(bitset, 1);
        BitsetUtil.setBit(bitset, 3);
        BitsetUtil.setBit(bitset, 4);
        assertEquals(List.of(2, 5), BitsetUtil.clearBits(bitset, 6));
    }

    @Test
    void testBitsetToList() {
        byte[] bitset = BitsetUtil.newBitset(20);
        BitsetUtil.setBit(bitset, 3);
        BitsetUtil.setBit(bitset, 17);
        assertEquals(List.of(3, 17), BitsetUtil.bitsetToList(bitset));
        assertTrue(BitsetUtil.bitsetToList(null).isEmpty());
    }

    @Test
    void testCopyOf_isIndependent() {
        byte[] bitset = BitsetUtil.newBitset(8);
        byte[] copy = BitsetUtil.copyOf(bitset);
        BitsetUtil.setBit(copy, 0);
        assertFalse(BitsetUtil.isBitSet(bitset, 0));
        assertNull(BitsetUtil.copyOf(null));
    }
}
