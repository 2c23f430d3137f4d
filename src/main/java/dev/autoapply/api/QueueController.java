package dev.autoapply.api;

import dev.autoapply.model.ApplicationStatus;
import dev.autoapply.model.QueueStats;
import dev.autoapply.service.ApplicationQueueService;
import dev.autoapply.service.LinkDeduplicationService;
import dev.autoapply.service.QueueEntryNotFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Read-only queue views plus the manual deduplication trigger.
 */
@RestController
public class QueueController {

    private final ApplicationQueueService queueService;
    private final LinkDeduplicationService deduplicationService;

    public QueueController(ApplicationQueueService queueService, LinkDeduplicationService deduplicationService) {
        this.queueService = queueService;
        this.deduplicationService = deduplicationService;
    }

    @GetMapping("/api/queue/{queueId}")
    public Mono<ApplicationStatus> status(@PathVariable Long queueId) {
        return blocking(() -> queueService.getStatus(queueId)
                .orElseThrow(() -> new QueueEntryNotFoundException(queueId)));
    }

    @GetMapping("/api/queue/stats")
    public Mono<QueueStats> stats() {
        return blocking(queueService::stats);
    }

    @GetMapping("/api/queue/stats/{userId}")
    public Mono<QueueStats> userStats(@PathVariable Long userId) {
        return blocking(() -> queueService.stats(userId));
    }

    /**
     * Run the deduplicator over every user's links now.
     */
    @PostMapping("/api/admin/dedup")
    public Mono<ResponseEntity<Map<String, Integer>>> dedup() {
        return blocking(deduplicationService::deduplicateAll)
                .map(demoted -> ResponseEntity.ok(Map.of("demoted", demoted)));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
