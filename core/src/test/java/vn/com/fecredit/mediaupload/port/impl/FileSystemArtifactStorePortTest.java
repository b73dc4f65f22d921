package vn.com.fecredit.mediaupload.port.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import vn.com.fecredit.mediaupload.exception.StorageUnavailableException;
import vn.com.fecredit.mediaupload.model.ArtifactDescriptor;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArtifactStorePortTest {

    @TempDir
    Path baseDir;

    private Path completeDir;
    private FileSystemArtifactStorePort store;

    @BeforeEach
    void setUp() throws IOException {
        completeDir = baseDir.resolve("complete");
        store = new FileSystemArtifactStorePort(completeDir.toString());
    }

    @Test
    void testStoreOpenDelete() throws IOException {
        byte[] content = "merged content".getBytes(StandardCharsets.UTF_8);
        ArtifactDescriptor descriptor = new ArtifactDescriptor("s-1", "report.pdf", "application/pdf", content.length);

        String reference = store.store(descriptor, new ByteArrayInputStream(content));

        assertEquals("s-1_report.pdf", reference);
        assertArrayEquals(content, Files.readAllBytes(completeDir.resolve(reference)));
        try (InputStream in = store.open(reference)) {
            assertArrayEquals(content, in.readAllBytes());
        }

        store.delete(reference);
        store.delete(reference);
        assertFalse(Files.exists(completeDir.resolve(reference)));
        assertThrows(StorageUnavailableException.class, () -> store.open(reference));
    }

    @Test
    void testFailingContentLeavesNothingBehind() throws IOException {
        ArtifactDescriptor descriptor = new ArtifactDescriptor("s-1", "broken.bin", null, 100);
        InputStream failing = new InputStream() {
            private int served;

            @Override
            public int read() {
                if (served++ < 10) {
                    return 'x';
                }
                throw new IllegalStateException("source went away");
            }
        };

        assertThrows(IllegalStateException.class, () -> store.store(descriptor, failing));
        try (Stream<Path> files = Files.list(completeDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void testRejectsReferencesOutsideDirectory() {
        assertThrows(IllegalArgumentException.class, () -> store.open("../secret"));
        assertThrows(IllegalArgumentException.class, () -> store.delete("sub/file"));
    }
}
