package vn.com.fecredit.mediaupload.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a successful merge. Repeated completion calls return the same reference.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompleteSessionResponse {
    private String sessionId;
    private String resultReference;
}
