package dev.autoapply.worker;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import dev.autoapply.model.ApplicationPayload;

/**
 * Body of {@code POST /submit}: the payload fields at top level plus a
 * {@code callback} object.
 */
public record WorkerSubmission(
        @JsonUnwrapped ApplicationPayload payload,
        CallbackDescriptor callback) {
}
