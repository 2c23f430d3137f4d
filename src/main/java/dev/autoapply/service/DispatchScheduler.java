package dev.autoapply.service;

import dev.autoapply.config.QueueConfig;
import dev.autoapply.entity.QueueEntry;
import dev.autoapply.model.DispatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Outer dispatch loop. Each tick wakes parked entries whose user has cap left,
 * runs the deduplicator once per UTC day and dispatches the next batch.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "queue.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchScheduler {

    private final ApplicationQueueService queueService;
    private final SubmissionDispatcher dispatcher;
    private final DailyQuotaService quotaService;
    private final LinkDeduplicationService deduplicationService;
    private final QueueConfig queueConfig;
    private final Clock clock;

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicReference<LocalDate> lastDedupDay = new AtomicReference<>();

    public DispatchScheduler(ApplicationQueueService queueService, SubmissionDispatcher dispatcher,
                             DailyQuotaService quotaService, LinkDeduplicationService deduplicationService,
                             QueueConfig queueConfig, Clock clock) {
        this.queueService = queueService;
        this.dispatcher = dispatcher;
        this.quotaService = quotaService;
        this.deduplicationService = deduplicationService;
        this.queueConfig = queueConfig;
        this.clock = clock;
        log.info("Dispatch scheduler enabled: every {}, batch {}, concurrency {}",
                queueConfig.getScheduler().getInterval(),
                queueConfig.getScheduler().getBatchSize(),
                queueConfig.getScheduler().getConcurrency());
    }

    @Scheduled(fixedDelayString = "${queue.scheduler.interval:10s}",
            initialDelayString = "${queue.scheduler.interval:10s}")
    public void tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            log.debug("Previous dispatch tick still running, skipping");
            return;
        }
        try {
            runOnce();
        } catch (Exception e) {
            log.error("Dispatch tick failed: {}", e.getMessage(), e);
        } finally {
            tickInProgress.set(false);
        }
    }

    /**
     * One full pass of the loop. Blocks until every dispatch in the batch has finished.
     *
     * @return dispatch results by outcome
     */
    public Map<DispatchResult, Long> runOnce() {
        reactivateStandby();
        dedupIfNewDay();

        List<QueueEntry> batch = queueService.nextPending(queueConfig.getScheduler().getBatchSize());
        if (batch.isEmpty()) {
            return Map.of();
        }

        List<DispatchResult> results = Flux.fromIterable(batch)
                .flatMap(entry -> dispatcher.dispatch(entry.getId())
                        .onErrorResume(e -> {
                            log.error("Dispatch of queue entry {} failed: {}", entry.getId(), e.getMessage(), e);
                            return Mono.just(DispatchResult.ERROR);
                        }), queueConfig.getScheduler().getConcurrency())
                .collectList()
                .block();

        Map<DispatchResult, Long> summary = results == null ? Map.of() : results.stream()
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        log.info("Dispatched {} queue entries: {}", batch.size(), summary);
        return summary;
    }

    int reactivateStandby() {
        int total = 0;
        for (Long userId : queueService.usersWithStandbyEntries()) {
            long remaining = quotaService.remainingToday(userId);
            if (remaining > 0) {
                total += queueService.reactivateStandby(userId, remaining);
            }
        }
        return total;
    }

    boolean dedupIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        LocalDate previous = lastDedupDay.get();
        if (today.equals(previous) || !lastDedupDay.compareAndSet(previous, today)) {
            return false;
        }
        try {
            int demoted = deduplicationService.deduplicateAll();
            log.info("Daily deduplication for {} demoted {} links", today, demoted);
        } catch (RuntimeException e) {
            // retried on the next tick
            lastDedupDay.set(previous);
            log.error("Daily deduplication failed: {}", e.getMessage(), e);
        }
        return true;
    }
}
