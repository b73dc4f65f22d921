package vn.com.fecredit.mediaupload.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import vn.com.fecredit.mediaupload.exception.*;
import vn.com.fecredit.mediaupload.model.CompleteSessionResponse;
import vn.com.fecredit.mediaupload.model.CreateSessionRequest;
import vn.com.fecredit.mediaupload.model.CreateSessionResponse;
import vn.com.fecredit.mediaupload.model.ErrorResponse;
import vn.com.fecredit.mediaupload.model.SessionStatusResponse;
import vn.com.fecredit.mediaupload.model.SessionStatusView;
import vn.com.fecredit.mediaupload.model.UploadChunkResponse;
import vn.com.fecredit.mediaupload.service.ChunkUploadService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for chunked upload sessions.
 * <p>
 * A client opens a session, sends chunks in any order (several at a time if it likes),
 * polls the status to learn which chunks are still missing, and finally asks the server
 * to merge them. Every error body is an {@link ErrorResponse} whose {@code retryable}
 * flag tells the client whether the same session can still succeed.
 * </p>
 */
@RestController
@RequestMapping("/api/upload/sessions")
public class ChunkUploadController {
    private static final Logger log = LoggerFactory.getLogger(ChunkUploadController.class);

    @Autowired
    private ChunkUploadService uploadService;

    /**
     * Opens a new upload session.
     *
     * @param req file name, size and optional chunk size and checksum
     * @return the session id and the chunk layout the client has to follow
     */
    @PostMapping
    public ResponseEntity<CreateSessionResponse> createSession(@Valid @RequestBody CreateSessionRequest req) {
        log.debug("Received CreateSessionRequest: filename={}, totalSize={}", req.getFilename(), req.getTotalSize());
        CreateSessionResponse response = uploadService.createSession(req);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Uploads one chunk sent as the {@code file} part of a multipart request.
     *
     * @param sessionId  Upload session ID
     * @param chunkIndex Chunk index (0-based)
     * @param file       Chunk data
     * @throws IOException if the request body cannot be read
     */
    @PutMapping(value = "/{sessionId}/chunks/{chunkIndex}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadChunkResponse> uploadChunk(
            @PathVariable("sessionId") String sessionId,
            @PathVariable("chunkIndex") int chunkIndex,
            @RequestPart("file") MultipartFile file) throws IOException {
        return ResponseEntity.ok(uploadService.uploadChunkResponse(sessionId, chunkIndex, file.getBytes()));
    }

    /**
     * Uploads one chunk sent as the raw request body.
     */
    @PutMapping(value = "/{sessionId}/chunks/{chunkIndex}", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<UploadChunkResponse> uploadRawChunk(
            @PathVariable("sessionId") String sessionId,
            @PathVariable("chunkIndex") int chunkIndex,
            @RequestBody byte[] data) {
        return ResponseEntity.ok(uploadService.uploadChunkResponse(sessionId, chunkIndex, data));
    }

    /**
     * Merges the received chunks. Calling it again after success returns the same reference.
     */
    @PostMapping("/{sessionId}/complete")
    public ResponseEntity<CompleteSessionResponse> complete(@PathVariable("sessionId") String sessionId) {
        CompleteSessionResponse response = uploadService.completeSessionResponse(sessionId);
        log.debug("Upload completed for sessionId={}, reference={}", sessionId, response.getResultReference());
        return ResponseEntity.ok(response);
    }

    /**
     * Gets the current status of an upload session, including the chunks still missing.
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionStatusResponse> getStatus(@PathVariable("sessionId") String sessionId) {
        return ResponseEntity.ok(uploadService.getStatusResponse(sessionId));
    }

    /**
     * Streams the merged file of a completed session.
     */
    @GetMapping("/{sessionId}/content")
    public ResponseEntity<InputStreamResource> download(@PathVariable("sessionId") String sessionId) {
        SessionStatusView status = uploadService.getStatus(sessionId);
        InputStream content = uploadService.openArtifact(sessionId);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(status.getFilename(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .contentType(mediaTypeOf(status.getContentType()))
                .contentLength(status.getTotalSize())
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(new InputStreamResource(content));
    }

    private static MediaType mediaTypeOf(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            log.debug("Serving unparseable content type '{}' as octet-stream: {}", contentType, e.getMessage());
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler(InvalidChunkIndexException.class)
    public ResponseEntity<ErrorResponse> handleInvalidChunkIndex(InvalidChunkIndexException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("chunkIndex", e.getChunkIndex());
        details.put("totalChunks", e.getTotalChunks());
        return error(HttpStatus.BAD_REQUEST, e, details);
    }

    @ExceptionHandler(InvalidChunkSizeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidChunkSize(InvalidChunkSizeException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("chunkIndex", e.getChunkIndex());
        details.put("expectedLength", e.getExpectedLength());
        details.put("actualLength", e.getActualLength());
        return error(HttpStatus.BAD_REQUEST, e, details);
    }

    @ExceptionHandler(IncompleteUploadException.class)
    public ResponseEntity<ErrorResponse> handleIncompleteUpload(IncompleteUploadException e) {
        return error(HttpStatus.CONFLICT, e, Map.of("missingIndices", e.getMissingIndices()));
    }

    @ExceptionHandler(SessionTerminalException.class)
    public ResponseEntity<ErrorResponse> handleSessionTerminal(SessionTerminalException e) {
        return error(HttpStatus.CONFLICT, e, Map.of("status", e.getStatus()));
    }

    @ExceptionHandler({MergeInProgressException.class, ArtifactNotAvailableException.class, ConflictException.class})
    public ResponseEntity<ErrorResponse> handleConflict(UploadSessionException e) {
        return error(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(CorruptUploadException.class)
    public ResponseEntity<ErrorResponse> handleCorruptUpload(CorruptUploadException e) {
        log.warn("Rejected corrupt upload {}: {}", e.getSessionId(), e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e, null);
    }

    @ExceptionHandler({MergeException.class, StorageUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleStorageFailure(UploadSessionException e) {
        log.error("Upload storage failure: {}", e.getMessage(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(fieldError -> details.put(fieldError.getField(), fieldError.getDefaultMessage()));
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("INVALID_REQUEST")
                .message("Request validation failed")
                .retryable(false)
                .details(details)
                .build());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestPartException.class, IOException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.debug("Bad upload request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .code("INVALID_REQUEST")
                .message(e.getMessage())
                .retryable(false)
                .build());
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, UploadSessionException e, Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(e.getErrorCode())
                .message(e.getMessage())
                .retryable(e.isRetryable())
                .details(details)
                .build());
    }
}
