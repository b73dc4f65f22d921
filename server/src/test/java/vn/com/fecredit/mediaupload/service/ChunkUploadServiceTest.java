package vn.com.fecredit.mediaupload.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import vn.com.fecredit.mediaupload.model.CompleteSessionResponse;
import vn.com.fecredit.mediaupload.model.CreateSessionRequest;
import vn.com.fecredit.mediaupload.model.CreateSessionResponse;
import vn.com.fecredit.mediaupload.model.SessionStatus;
import vn.com.fecredit.mediaupload.model.SessionStatusResponse;
import vn.com.fecredit.mediaupload.model.UploadChunkResponse;
import vn.com.fecredit.mediaupload.port.impl.InMemoryArtifactStorePort;
import vn.com.fecredit.mediaupload.port.impl.InMemoryChunkStorePort;
import vn.com.fecredit.mediaupload.port.impl.InMemorySessionRepositoryPort;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the API mapping of {@link ChunkUploadService}, without a Spring context.
 */
public class ChunkUploadServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ChunkUploadService service;

    @BeforeEach
    public void setup() {
        service = new ChunkUploadService(new InMemorySessionRepositoryPort(), new InMemoryChunkStorePort(),
                new InMemoryArtifactStorePort(), Clock.fixed(NOW, ZoneOffset.UTC), 4, 16, true, 8);
    }

    @Test
    public void testCreateSessionUsesDefaultChunkSize() {
        CreateSessionResponse response = service.createSession(new CreateSessionRequest("a.txt", "text/plain", 10, null));

        assertNotNull(response.getSessionId());
        assertEquals(4, response.getChunkSize());
        assertEquals(3, response.getTotalChunks());
    }

    @Test
    public void testCreateSessionHonoursRequestedChunkSize() {
        CreateSessionResponse response = service.createSession(new CreateSessionRequest("a.txt", null, 10, 5));

        assertEquals(5, response.getChunkSize());
        assertEquals(2, response.getTotalChunks());
    }

    @Test
    public void testStatusResponseMapping() {
        String sessionId = service.createSession(new CreateSessionRequest("a.txt", "text/plain", 10, null)).getSessionId();

        UploadChunkResponse chunk = service.uploadChunkResponse(sessionId, 1, new byte[]{1, 2, 3, 4});
        assertEquals(1, chunk.getReceivedCount());
        assertEquals(3, chunk.getTotalChunks());

        SessionStatusResponse status = service.getStatusResponse(sessionId);
        assertEquals(SessionStatus.IN_PROGRESS, status.getStatus());
        assertEquals(List.of(0, 2), status.getMissingIndices());
        assertEquals(1, status.getReceivedCount());
        assertEquals(100.0 / 3, status.getProgressPercent(), 0.0001);
        assertEquals("text/plain", status.getContentType());
        assertEquals(NOW, status.getLastActivityAt());
        assertNull(status.getResultReference());
    }

    @Test
    public void testCompleteSessionResponse() {
        String sessionId = service.createSession(new CreateSessionRequest("a.txt", null, 6, null)).getSessionId();
        service.uploadChunkResponse(sessionId, 0, new byte[]{1, 2, 3, 4});
        service.uploadChunkResponse(sessionId, 1, new byte[]{5, 6});

        CompleteSessionResponse response = service.completeSessionResponse(sessionId);

        assertEquals(sessionId, response.getSessionId());
        assertEquals(response.getResultReference(), service.getStatusResponse(sessionId).getResultReference());
        assertTrue(service.getStatusResponse(sessionId).getMissingIndices().isEmpty());
    }

    @Test
    public void testCreateSessionRespectsChunkCap() {
        assertEquals(8, service.createSession(new CreateSessionRequest("a.txt", null, 32, null)).getTotalChunks());
        assertThrows(IllegalArgumentException.class,
                () -> service.createSession(new CreateSessionRequest("a.txt", null, 33, null)));
    }

    @Test
    public void testRejectsNonPositiveDefaultChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkUploadService(new InMemorySessionRepositoryPort(),
                new InMemoryChunkStorePort(), new InMemoryArtifactStorePort(), Clock.systemUTC(), 0, 16, true, 8));
    }
}
