package vn.com.fecredit.mediaupload.port.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemChunkStorePortTest {

    @TempDir
    Path baseDir;

    private FileSystemChunkStorePort store;

    @BeforeEach
    void setUp() throws IOException {
        store = new FileSystemChunkStorePort(baseDir.resolve("chunks").toString());
    }

    @Test
    void testPutAndGet() {
        store.put("s-1", 0, bytes("first"));
        store.put("s-1", 7, bytes("eighth"));

        assertEquals("first", text(store.get("s-1", 0).orElseThrow()));
        assertEquals("eighth", text(store.get("s-1", 7).orElseThrow()));
        assertTrue(store.get("s-1", 1).isEmpty());
        assertTrue(store.get("other", 0).isEmpty());
        assertTrue(Files.exists(baseDir.resolve("chunks").resolve("s-1").resolve("7.chunk")));
    }

    @Test
    void testPutReplacesAndLeavesNoTemporaryFiles() throws IOException {
        store.put("s-1", 0, bytes("old"));
        store.put("s-1", 0, bytes("new"));

        assertEquals("new", text(store.get("s-1", 0).orElseThrow()));
        try (Stream<Path> files = Files.list(baseDir.resolve("chunks").resolve("s-1"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testDeleteAll() {
        store.put("s-1", 0, bytes("a"));
        store.put("s-1", 1, bytes("b"));
        store.put("s-2", 0, bytes("c"));

        store.deleteAll("s-1");
        store.deleteAll("s-1");
        store.deleteAll("never-existed");

        assertTrue(store.get("s-1", 0).isEmpty());
        assertFalse(Files.exists(baseDir.resolve("chunks").resolve("s-1")));
        assertEquals("c", text(store.get("s-2", 0).orElseThrow()));
    }

    @Test
    void testRejectsPathTraversal() {
        assertThrows(IllegalArgumentException.class, () -> store.put("../escape", 0, bytes("x")));
        assertThrows(IllegalArgumentException.class, () -> store.get("a/b", 0));
        assertThrows(IllegalArgumentException.class, () -> store.deleteAll(".."));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }
}
