package vn.com.fecredit.mediaupload.model.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNameValidatorTest {

    @Test
    void testValidNames() {
        assertTrue(FileNameValidator.isValidFileName("movie.mp4"));
        assertTrue(FileNameValidator.isValidFileName("holiday photo (1).jpg"));
    }

    @Test
    void testInvalidNames() {
        assertFalse(FileNameValidator.isValidFileName(null));
        assertFalse(FileNameValidator.isValidFileName(""));
        assertFalse(FileNameValidator.isValidFileName("   "));
        assertFalse(FileNameValidator.isValidFileName(".."));
        assertFalse(FileNameValidator.isValidFileName("temp/testfile.txt"));
        assertFalse(FileNameValidator.isValidFileName("..\\boot.ini"));
        assertFalse(FileNameValidator.isValidFileName("what?.txt"));
        assertFalse(FileNameValidator.isValidFileName("CON"));
        assertFalse(FileNameValidator.isValidFileName("lpt1.txt"));
        assertFalse(FileNameValidator.isValidFileName("a\u0000b"));
        assertFalse(FileNameValidator.isValidFileName("x".repeat(256)));
    }
}
