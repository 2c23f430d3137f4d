package dev.autoapply.worker;

import reactor.core.publisher.Mono;

/**
 * Remote browser-automation worker.
 */
public interface WorkerClient {

    /**
     * Probe the worker's health endpoint once.
     * Errors (including the probe timeout) are signalled on the Mono.
     */
    Mono<WorkerStatus> fetchStatus();

    /**
     * Hand one submission off to the worker.
     *
     * @return the HTTP status code of the response; 202 means accepted
     */
    Mono<Integer> submit(WorkerSubmission submission);
}
