package dev.autoapply.api;

import dev.autoapply.dedup.DedupException;
import dev.autoapply.service.CallbackRejectedException;
import dev.autoapply.service.IllegalQueueTransitionException;
import dev.autoapply.service.QueueEntryNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class QueueExceptionHandler {

    @ExceptionHandler(CallbackRejectedException.class)
    public ResponseEntity<Map<String, String>> handleRejected(CallbackRejectedException ex) {
        return ResponseEntity.status(ex.getStatus())
                .body(Map.of("error", ex.getStatus() == HttpStatus.UNAUTHORIZED ? "unauthorized" : "bad_request",
                        "message", ex.getMessage()));
    }

    @ExceptionHandler(QueueEntryNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(QueueEntryNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "queue_entry_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalQueueTransitionException.class)
    public ResponseEntity<Map<String, String>> handleIllegalTransition(IllegalQueueTransitionException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "illegal_transition", "message", ex.getMessage()));
    }

    @ExceptionHandler(DedupException.class)
    public ResponseEntity<Map<String, String>> handleDedup(DedupException ex) {
        log.error("Deduplication failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "dedup_failed", "message", ex.getMessage()));
    }
}
