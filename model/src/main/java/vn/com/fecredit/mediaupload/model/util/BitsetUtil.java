package vn.com.fecredit.mediaupload.model.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility class for the received-chunk bitsets of upload sessions.
 *
 * <p>
 * Bit {@code i} lives in byte {@code i / 8} at position {@code i % 8}. A set bit means
 * chunk {@code i} has been received. Bits at or beyond {@code totalChunks} are never
 * set.
 */
public final class BitsetUtil {

    private BitsetUtil() {
    }

    /**
     * Allocates an empty bitset large enough for {@code totalChunks} bits.
     */
    public static byte[] newBitset(int totalChunks) {
        if (totalChunks < 0) {
            throw new IllegalArgumentException("totalChunks must not be negative: " + totalChunks);
        }
        return new byte[byteLength(totalChunks)];
    }

    /**
     * Number of bytes needed for {@code totalChunks} bits. Computed in {@code long} so
     * counts near {@link Integer#MAX_VALUE} do not wrap.
     */
    public static int byteLength(int totalChunks) {
        return (int) (((long) totalChunks + 7) / 8);
    }

    /**
     * Sets a specific bit to 1 to mark the chunk as received.
     */
    public static void setBit(byte[] bitset, int bitIndex) {
        checkIndex(bitset, bitIndex);
        bitset[bitIndex / 8] |= (byte) (1 << (bitIndex % 8));
    }

    public static boolean isBitSet(byte[] bitset, int bitIndex) {
        if (bitset == null || bitIndex < 0 || bitIndex / 8 >= bitset.length) {
            return false;
        }
        return (bitset[bitIndex / 8] & (1 << (bitIndex % 8))) != 0;
    }

    /**
     * Counts the set bits among the first {@code totalChunks} positions.
     */
    public static int countSetBits(byte[] bitset, int totalChunks) {
        if (bitset == null) {
            return 0;
        }
        int count = 0;
        int fullBytes = Math.min(totalChunks / 8, bitset.length);
        for (int i = 0; i < fullBytes; i++) {
            count += Integer.bitCount(bitset[i] & 0xFF);
        }
        for (int i = fullBytes * 8; i < totalChunks; i++) {
            if (isBitSet(bitset, i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Checks if all bits below {@code totalChunks} are set.
     */
    public static boolean isComplete(byte[] bitset, int totalChunks) {
        return countSetBits(bitset, totalChunks) == totalChunks;
    }

    /**
     * Returns the indices below {@code totalChunks} whose bit is clear, ascending.
     */
    public static List<Integer> clearBits(byte[] bitset, int totalChunks) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!isBitSet(bitset, i)) {
                indices.add(i);
            }
        }
        return indices;
    }

    /**
     * Converts a bitset to a list of integers representing set bit indices.
     */
    public static List<Integer> bitsetToList(byte[] bitset) {
        List<Integer> indices = new ArrayList<>();
        if (bitset != null) {
            for (int byteIdx = 0; byteIdx < bitset.length; byteIdx++) {
                for (int bit = 0; bit < 8; bit++) {
                    if ((bitset[byteIdx] & (1 << bit)) != 0) {
                        indices.add(byteIdx * 8 + bit);
                    }
                }
            }
        }
        return indices;
    }

    public static byte[] copyOf(byte[] bitset) {
        return bitset == null ? null : Arrays.copyOf(bitset, bitset.length);
    }

    /**
     * Converts the bitset to a string of bits, highest byte first (e.g. "00000011 01001101").
     */
    public static String bitsetToString(byte[] bitset) {
        StringBuilder sb = new StringBuilder();
        if (null != bitset && bitset.length > 0)
            for (int i = bitset.length - 1; i > -1; i--) {
                byte b = bitset[i];
                sb.append(String.format("%8s", Integer.toBinaryString(b & 0xFF)).replace(' ', '0')).append(" ");
            }
        return sb.toString().trim();
    }

    private static void checkIndex(byte[] bitset, int bitIndex) {
        if (bitset == null) {
            throw new IllegalArgumentException("bitset must not be null");
        }
        if (bitIndex < 0 || bitIndex / 8 >= bitset.length) {
            throw new IndexOutOfBoundsException("Bit index " + bitIndex + " outside bitset of " + bitset.length + " bytes");
        }
    }
}
