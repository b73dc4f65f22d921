package vn.com.fecredit.mediaupload.model.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that a client supplied file name can be used as the last segment of an artifact path.
 */
public class FileNameValidator {

    private static final int MAX_LENGTH = 255;
    private static final String INVALID_CHARS = "<>:\"/\\|?*";
    private static final Set<String> RESERVED_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    private FileNameValidator() {
    }

    public static boolean isValidFileName(String fileName) {
        if (fileName == null || fileName.trim().isEmpty() || fileName.length() > MAX_LENGTH) {
            return false;
        }
        if (".".equals(fileName) || "..".equals(fileName)) {
            return false;
        }

        try {
            // Try to create a path, will throw exception if invalid
            Paths.get(fileName);
        } catch (InvalidPathException e) {
            return false;
        }

        // Artifacts may be copied to any platform, so the strictest rules apply everywhere
        for (char c : fileName.toCharArray()) {
            if (c < 0x20 || INVALID_CHARS.indexOf(c) >= 0) {
                return false;
            }
        }

        int dot = fileName.indexOf('.');
        String base = (dot < 0 ? fileName : fileName.substring(0, dot)).toUpperCase(Locale.ROOT);
        return !RESERVED_NAMES.contains(base);
    }
}
