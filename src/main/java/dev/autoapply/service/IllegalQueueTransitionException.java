package dev.autoapply.service;

import dev.autoapply.entity.QueueStatus;

/**
 * A state change was attempted that the queue state machine forbids,
 * typically out of a terminal state.
 */
public class IllegalQueueTransitionException extends RuntimeException {

    private final QueueStatus from;
    private final QueueStatus to;

    public IllegalQueueTransitionException(Long queueId, QueueStatus from, QueueStatus to) {
        super("Queue entry " + queueId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public QueueStatus getFrom() {
        return from;
    }

    public QueueStatus getTo() {
        return to;
    }
}
