package dev.autoapply.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.autoapply.entity.QueueEntry;
import dev.autoapply.entity.QueueStatus;

import java.time.LocalDateTime;

/**
 * Pollable view of a queue entry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplicationStatus(
        Long queueId,
        QueueStatus status,
        String error,
        LocalDateTime processedAt,
        SubmissionOutcome result,
        Long jobId) {

    public static ApplicationStatus of(QueueEntry entry) {
        return new ApplicationStatus(
                entry.getId(),
                entry.getStatus(),
                entry.getError(),
                entry.getProcessedAt(),
                SubmissionOutcome.fromQueueStatus(entry.getStatus()),
                entry.getJobId());
    }
}
