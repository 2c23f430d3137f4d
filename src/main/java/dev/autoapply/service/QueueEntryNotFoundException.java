package dev.autoapply.service;

public class QueueEntryNotFoundException extends RuntimeException {

    public QueueEntryNotFoundException(Long queueId) {
        super("Queue entry " + queueId + " not found");
    }
}
