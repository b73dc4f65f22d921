package vn.com.fecredit.mediaupload.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by the upload API.
 *
 * <p>
 * {@code retryable} tells the client whether repeating the call on the same session
 * can succeed. A non-retryable error means a new session has to be started.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private boolean retryable;
    private Map<String, Object> details;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
