package dev.autoapply.service;

import dev.autoapply.config.WorkerConfig;
import dev.autoapply.entity.QueueEntry;
import dev.autoapply.entity.QueueStatus;
import dev.autoapply.metrics.QueueMetrics;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.DispatchResult;
import dev.autoapply.worker.CallbackDescriptor;
import dev.autoapply.worker.WorkerClient;
import dev.autoapply.worker.WorkerStatus;
import dev.autoapply.worker.WorkerSubmission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Hands one queued entry to the remote worker.
 * <p>
 * The worker may be cold, so it is first polled on its health endpoint with
 * escalating waits until it reports spare capacity. The submission itself is a
 * short handoff: a 202 only means the worker took the job, and the outcome
 * arrives later through the callback. Nothing here waits for the automation.
 */
@Slf4j
@Service
public class SubmissionDispatcher {

    static final String PAYLOAD_MISSING_ERROR = "Application payload not found";
    private static final String NO_REJECTION = "";

    private final ApplicationQueueService queueService;
    private final DailyQuotaService quotaService;
    private final WorkerClient workerClient;
    private final WorkerConfig workerConfig;
    private final QueueMetrics metrics;

    // quota check and claim must not interleave, or concurrent dispatches overshoot the cap
    private final Object claimLock = new Object();

    public SubmissionDispatcher(ApplicationQueueService queueService, DailyQuotaService quotaService,
                                WorkerClient workerClient, WorkerConfig workerConfig, QueueMetrics metrics) {
        this.queueService = queueService;
        this.quotaService = quotaService;
        this.workerClient = workerClient;
        this.workerConfig = workerConfig;
        this.metrics = metrics;

        if (workerConfig.getCompleteUrl().isEmpty()) {
            log.warn("No worker URL configured! Every dispatch will fail its wake-up.");
        }
        if (workerConfig.getSharedSecret() == null || workerConfig.getSharedSecret().isBlank()) {
            log.warn("No worker shared secret configured! Every callback will be rejected.");
        }
    }

    /**
     * Dispatch a single queue entry.
     *
     * @param queueId entry to dispatch; must be PENDING
     * @return what happened to the entry
     */
    public Mono<DispatchResult> dispatch(Long queueId) {
        return blocking(() -> claim(queueId))
                .flatMap(claim -> claim.shortCircuit() != null
                        ? Mono.just(claim.shortCircuit())
                        : wakeUpAndHandOff(claim.entry(), claim.payload()))
                .doOnNext(result -> {
                    metrics.recordDispatch(result);
                    log.info("Dispatch of queue entry {} finished: {}", queueId, result);
                });
    }

    /**
     * Poll the worker until it reports ready, waiting the configured delay
     * before each probe.
     *
     * @return true once a probe reports ready, false after the last probe
     */
    public Mono<Boolean> awaitWorkerReady() {
        List<Duration> delays = workerConfig.getWakeUpDelays();
        int maxProbes = delays.size();
        return Flux.range(0, maxProbes)
                .concatMap(attempt -> Mono.delay(delays.get(attempt))
                        .then(probe(attempt + 1, maxProbes)))
                .filter(WorkerStatus::isReady)
                .next()
                .map(status -> true)
                .defaultIfEmpty(false);
    }

    private Claim claim(Long queueId) {
        Optional<QueueEntry> found = queueService.findEntry(queueId);
        if (found.isEmpty()) {
            log.warn("Queue entry {} not found, nothing to dispatch", queueId);
            return Claim.skipped(DispatchResult.NOT_DISPATCHABLE);
        }
        QueueEntry entry = found.get();
        if (entry.getStatus() != QueueStatus.PENDING) {
            log.debug("Queue entry {} is {}, not dispatching", queueId, entry.getStatus());
            return Claim.skipped(DispatchResult.NOT_DISPATCHABLE);
        }

        Optional<QueueEntry> claimed;
        synchronized (claimLock) {
            long remaining = quotaService.remainingToday(entry.getUserId());
            if (remaining <= 0) {
                queueService.moveToStandby(queueId,
                        "Daily application limit reached, will resume after " + quotaService.nextReset() + " UTC");
                return Claim.skipped(DispatchResult.STANDBY);
            }
            claimed = queueService.beginProcessing(queueId);
        }
        if (claimed.isEmpty()) {
            return Claim.skipped(DispatchResult.NOT_DISPATCHABLE);
        }

        Optional<ApplicationPayload> payload = queueService.getPayload(queueId);
        if (payload.isEmpty()) {
            queueService.markFailed(queueId, PAYLOAD_MISSING_ERROR);
            return Claim.skipped(DispatchResult.PAYLOAD_MISSING);
        }
        return new Claim(claimed.get(), payload.get(), null);
    }

    private Mono<DispatchResult> wakeUpAndHandOff(QueueEntry entry, ApplicationPayload payload) {
        return awaitWorkerReady()
                .flatMap(ready -> {
                    if (!ready) {
                        String error = "Worker wake-up failed: not ready after "
                                + workerConfig.getMaxProbes() + " health probes";
                        return fail(entry.getId(), error, DispatchResult.WAKE_UP_FAILED);
                    }
                    return handOff(entry, payload);
                });
    }

    private Mono<WorkerStatus> probe(int attempt, int maxProbes) {
        return Mono.defer(workerClient::fetchStatus)
                .timeout(workerConfig.getProbeTimeout())
                .doOnSubscribe(s -> metrics.recordProbe())
                .doOnNext(status -> log.debug("Worker probe {}/{}: throttled={}, active={}/{}",
                        attempt, maxProbes, status.isThrottled(), status.getActiveTasks(), status.getMaxConcurrent()))
                .onErrorResume(e -> {
                    log.debug("Worker probe {}/{} failed: {}", attempt, maxProbes, describe(e));
                    return Mono.just(WorkerStatus.unreachable());
                })
                .defaultIfEmpty(WorkerStatus.unreachable());
    }

    private Mono<DispatchResult> handOff(QueueEntry entry, ApplicationPayload payload) {
        CallbackDescriptor callback = new CallbackDescriptor(
                workerConfig.getCallbackUrl(),
                workerConfig.getSharedSecret(),
                entry.getId(),
                entry.getJobId(),
                entry.getUserId());

        return Mono.defer(() -> workerClient.submit(new WorkerSubmission(payload, callback)))
                .timeout(workerConfig.getHandoffTimeout())
                .map(status -> status == HttpStatus.ACCEPTED.value()
                        ? NO_REJECTION
                        : "Worker rejected handoff with HTTP " + status)
                .onErrorResume(e -> Mono.just("Worker handoff failed: " + describe(e)))
                .defaultIfEmpty("Worker handoff failed: empty response")
                .flatMap(rejection -> {
                    if (rejection.isEmpty()) {
                        log.info("Worker accepted queue entry {} for user {}", entry.getId(), entry.getUserId());
                        return Mono.just(DispatchResult.ACCEPTED);
                    }
                    return fail(entry.getId(), rejection, DispatchResult.REJECTED);
                });
    }

    private Mono<DispatchResult> fail(Long queueId, String error, DispatchResult result) {
        return blocking(() -> {
            if (!queueService.markFailed(queueId, error)) {
                // the callback finished the entry first
                log.info("Queue entry {} already finished, dropping dispatch error: {}", queueId, error);
                return DispatchResult.ALREADY_FINISHED;
            }
            return result;
        });
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private record Claim(QueueEntry entry, ApplicationPayload payload, DispatchResult shortCircuit) {
        static Claim skipped(DispatchResult result) {
            return new Claim(null, null, result);
        }
    }
}
