package dev.autoapply.model;

import dev.autoapply.entity.QueueStatus;

/**
 * Outcome of handling one callback.
 *
 * @param applied false when the entry was already terminal and nothing changed
 */
public record CallbackResult(
        Long queueId,
        QueueStatus queueStatus,
        Long jobId,
        boolean applied) {
}
