package dev.autoapply.dedup;

/**
 * A deduplication run could not persist its priority rewrite.
 * The run's transaction is rolled back when this is thrown.
 */
public class DedupException extends RuntimeException {

    public DedupException(String message, Throwable cause) {
        super(message, cause);
    }
}
