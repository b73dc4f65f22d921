package vn.com.fecredit.mediaupload.service;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import vn.com.fecredit.mediaupload.core.ChunkUploadEngine;
import vn.com.fecredit.mediaupload.model.ChunkReceipt;
import vn.com.fecredit.mediaupload.model.ChunkUploadSession;
import vn.com.fecredit.mediaupload.model.CompleteSessionResponse;
import vn.com.fecredit.mediaupload.model.CreateSessionRequest;
import vn.com.fecredit.mediaupload.model.CreateSessionResponse;
import vn.com.fecredit.mediaupload.model.SessionStatusResponse;
import vn.com.fecredit.mediaupload.model.SessionStatusView;
import vn.com.fecredit.mediaupload.model.UploadChunkResponse;
import vn.com.fecredit.mediaupload.port.interfaces.IArtifactStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.IChunkStorePort;
import vn.com.fecredit.mediaupload.port.interfaces.ISessionRepositoryPort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring-managed upload engine. Adds the API document mapping on top of {@link ChunkUploadEngine}.
 */
@Service
public class ChunkUploadService extends ChunkUploadEngine {
    private static final Logger log = LoggerFactory.getLogger(ChunkUploadService.class);

    @Getter
    private final int defaultChunkSize;

    @Autowired
    public ChunkUploadService(
            ISessionRepositoryPort sessionRepositoryPort,
            IChunkStorePort chunkStorePort,
            IArtifactStorePort artifactStorePort,
            Clock clock,
            @Value("${mediaupload.default-chunk-size:524288}") int defaultChunkSize,
            @Value("${mediaupload.max-cas-attempts:16}") int maxCasAttempts,
            @Value("${mediaupload.allow-chunk-overwrite:true}") boolean allowChunkOverwrite,
            @Value("${mediaupload.max-chunks:1048576}") int maxChunks) {
        super(sessionRepositoryPort, chunkStorePort, artifactStorePort, clock, maxCasAttempts, allowChunkOverwrite, maxChunks);
        if (defaultChunkSize <= 0) {
            throw new IllegalArgumentException("Default chunk size must be positive: " + defaultChunkSize);
        }
        this.defaultChunkSize = defaultChunkSize;
        log.info("Upload service initialized with default chunk size: {}, max chunks: {}, max CAS attempts: {}, chunk overwrite: {}",
                defaultChunkSize, maxChunks, maxCasAttempts, allowChunkOverwrite);
    }

    /**
     * Opens a session for the request, falling back to the default chunk size when the client sent none.
     */
    public CreateSessionResponse createSession(CreateSessionRequest request) {
        int chunkSize = request.getChunkSize() != null ? request.getChunkSize() : defaultChunkSize;
        String sessionId = createSession(request.getFilename(), request.getContentType(), request.getTotalSize(),
                chunkSize, request.getChecksum());
        return new CreateSessionResponse(sessionId, ChunkUploadSession.computeTotalChunks(request.getTotalSize(), chunkSize), chunkSize);
    }

    public UploadChunkResponse uploadChunkResponse(String sessionId, int chunkIndex, byte[] data) {
        ChunkReceipt receipt = uploadChunk(sessionId, chunkIndex, data);
        return new UploadChunkResponse(receipt.getSessionId(), receipt.getChunkIndex(),
                receipt.getReceivedCount(), receipt.getTotalChunks());
    }

    public CompleteSessionResponse completeSessionResponse(String sessionId) {
        return new CompleteSessionResponse(sessionId, completeSession(sessionId));
    }

    public SessionStatusResponse getStatusResponse(String sessionId) {
        return toResponse(getStatus(sessionId));
    }

    static SessionStatusResponse toResponse(SessionStatusView view) {
        List<Integer> missing = new ArrayList<>();
        view.getMissingIndices().forEach(missing::add);
        return SessionStatusResponse.builder()
                .sessionId(view.getSessionId())
                .status(view.getStatus())
                .filename(view.getFilename())
                .contentType(view.getContentType())
                .totalSize(view.getTotalSize())
                .chunkSize(view.getChunkSize())
                .totalChunks(view.getTotalChunks())
                .receivedCount(view.getReceivedCount())
                .progressPercent(view.getProgressPercent())
                .missingIndices(missing)
                .resultReference(view.getResultReference())
                .failureReason(view.getFailureReason())
                .createdAt(view.getCreatedAt())
                .updatedAt(view.getUpdatedAt())
                .completedAt(view.getCompletedAt())
                .lastActivityAt(view.getLastActivityAt())
                .build();
    }
}
