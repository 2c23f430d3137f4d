package dev.autoapply.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submission attempt.
 * <p>
 * PENDING -> PROCESSING -> COMPLETED | FAILED | SKIPPED, with STANDBY parking
 * entries while their user's daily cap is exhausted. A worker callback may
 * finish any non-terminal entry. COMPLETED, FAILED and SKIPPED are terminal.
 */
public enum QueueStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    SKIPPED,
    STANDBY;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean canTransitionTo(QueueStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<QueueStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, STANDBY, COMPLETED, FAILED, SKIPPED);
            case STANDBY -> EnumSet.of(PENDING, COMPLETED, FAILED, SKIPPED);
            case PROCESSING -> EnumSet.of(COMPLETED, FAILED, SKIPPED, STANDBY);
            case COMPLETED, FAILED, SKIPPED -> EnumSet.noneOf(QueueStatus.class);
        };
    }
}
