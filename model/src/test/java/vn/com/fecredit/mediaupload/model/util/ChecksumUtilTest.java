package vn.com.fecredit.mediaupload.model.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumUtilTest {

    private static final String HELLO_SHA256 = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @Test
    void testSha256Hex_knownValue() {
        assertEquals(HELLO_SHA256, ChecksumUtil.sha256Hex("hello".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testToHex_keepsLeadingZeros() {
        assertEquals("000fff", ChecksumUtil.toHex(new byte[]{0x00, 0x0f, (byte) 0xff}));
    }

    @Test
    void testNormalize() {
        assertNull(ChecksumUtil.normalize(null));
        assertNull(ChecksumUtil.normalize("  "));
        assertEquals(HELLO_SHA256, ChecksumUtil.normalize(HELLO_SHA256.toUpperCase()));
        assertThrows(IllegalArgumentException.class, () -> ChecksumUtil.normalize("dummychecksum"));
    }
}
