package dev.autoapply.worker;

/**
 * Tells the worker where and how to report the outcome of one submission.
 */
public record CallbackDescriptor(
        String url,
        String secret,
        Long queueId,
        Long jobId,
        Long userId) {
}
