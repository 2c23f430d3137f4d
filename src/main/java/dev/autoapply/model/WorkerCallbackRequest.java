package dev.autoapply.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the worker's completion notice.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerCallbackRequest {

    private Long queueId;
    private Long jobId;
    private Long userId;

    @JsonAlias({"finalStatus", "status"})
    private SubmissionOutcome outcome;

    @JsonAlias({"reason", "error"})
    private String message;

    /** Fallback when the X-Worker-Secret header is absent. */
    private String secret;
}
