package vn.com.fecredit.mediaupload.model.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * Utility class for SHA-256 checksums of uploaded content.
 *
 * <p>
 * Usage example:
 * <pre>
 * MessageDigest digest = ChecksumUtil.newSha256();
 * // feed the merged stream through a DigestInputStream
 * String checksum = ChecksumUtil.toHex(digest.digest());
 * </pre>
 */
public final class ChecksumUtil {

    private static final Pattern SHA256_HEX = Pattern.compile("^[0-9a-f]{64}$");

    private ChecksumUtil() {
        // Utility class, no instances allowed
    }

    /**
     * Creates a fresh SHA-256 digest.
     *
     * @throws IllegalStateException if the JVM does not provide SHA-256
     */
    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm is unavailable", e);
        }
    }

    /**
     * Generates a SHA-256 checksum for an in-memory buffer.
     *
     * @param data bytes to hash
     * @return SHA-256 checksum as a lowercase hex string
     */
    public static String sha256Hex(byte[] data) {
        MessageDigest digest = newSha256();
        digest.update(data);
        return toHex(digest.digest());
    }

    public static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * Normalizes a client supplied checksum to lowercase and validates its shape.
     *
     * @return the normalized checksum, or {@code null} if none was supplied
     * @throws IllegalArgumentException if the value is not 64 hex characters
     */
    public static String normalize(String checksum) {
        if (checksum == null || checksum.isBlank()) {
            return null;
        }
        String normalized = checksum.trim().toLowerCase();
        if (!SHA256_HEX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Checksum must be a 64 character SHA-256 hex string");
        }
        return normalized;
    }
}
