package dev.autoapply.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.autoapply.entity.QueueStatus;

import java.util.Locale;

/**
 * Terminal result reported by the worker.
 */
public enum SubmissionOutcome {
    SUCCESS("success", QueueStatus.COMPLETED),
    SKIPPED("skipped", QueueStatus.SKIPPED),
    FAILED("failed", QueueStatus.FAILED);

    private final String value;
    private final QueueStatus queueStatus;

    SubmissionOutcome(String value, QueueStatus queueStatus) {
        this.value = value;
        this.queueStatus = queueStatus;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public QueueStatus getQueueStatus() {
        return queueStatus;
    }

    /**
     * Accepts the names used by older worker builds ("completed", "error").
     *
     * @return the outcome, or null for unknown text
     */
    @JsonCreator
    public static SubmissionOutcome fromValue(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "success", "completed", "applied" -> SUCCESS;
            case "skipped" -> SKIPPED;
            case "failed", "error" -> FAILED;
            default -> null;
        };
    }

    public static SubmissionOutcome fromQueueStatus(QueueStatus status) {
        return switch (status) {
            case COMPLETED -> SUCCESS;
            case SKIPPED -> SKIPPED;
            case FAILED -> FAILED;
            default -> null;
        };
    }
}
