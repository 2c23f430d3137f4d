package dev.autoapply.metrics;

import dev.autoapply.model.DispatchResult;
import dev.autoapply.model.SubmissionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus metrics for the submission pipeline.
 */
@Component
public class QueueMetrics {

    private static final String TAG_RESULT = "result";
    private static final String TAG_OUTCOME = "outcome";
    private final MeterRegistry registry;

    private final Counter entriesEnqueuedCounter;
    private final Counter linksDiscoveredCounter;
    private final Counter linksDemotedCounter;
    private final Counter callbacksIgnoredCounter;
    private final Counter callbacksRejectedCounter;
    private final Counter probesCounter;

    private final Timer probeTimer;
    private final Timer handoffTimer;

    public QueueMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.entriesEnqueuedCounter = Counter.builder("auto_apply_entries_enqueued_total")
                .description("Total queue entries created")
                .register(registry);

        this.linksDiscoveredCounter = Counter.builder("auto_apply_links_discovered_total")
                .description("Total new job links stored from discovery")
                .register(registry);

        this.linksDemotedCounter = Counter.builder("auto_apply_links_demoted_total")
                .description("Total job links demoted as near-duplicates")
                .register(registry);

        this.callbacksIgnoredCounter = Counter.builder("auto_apply_callbacks_ignored_total")
                .description("Callbacks received for entries already in a terminal state")
                .register(registry);

        this.callbacksRejectedCounter = Counter.builder("auto_apply_callbacks_rejected_total")
                .description("Callbacks rejected for a bad secret or malformed body")
                .register(registry);

        this.probesCounter = Counter.builder("auto_apply_worker_probes_total")
                .description("Worker health probes sent")
                .register(registry);

        this.probeTimer = Timer.builder("auto_apply_worker_probe_duration")
                .description("Worker health probe latency")
                .register(registry);

        this.handoffTimer = Timer.builder("auto_apply_worker_handoff_duration")
                .description("Worker submission handoff latency")
                .register(registry);
    }

    public void recordEnqueued() {
        entriesEnqueuedCounter.increment();
    }

    public void recordLinksDiscovered(int count) {
        linksDiscoveredCounter.increment(count);
    }

    public void recordLinksDemoted(int count) {
        linksDemotedCounter.increment(count);
    }

    public void recordProbe() {
        probesCounter.increment();
    }

    public void recordProbeLatency(long latencyMs) {
        probeTimer.record(Duration.ofMillis(latencyMs));
    }

    public void recordHandoffLatency(long latencyMs) {
        handoffTimer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record the result of one dispatch attempt.
     */
    public void recordDispatch(DispatchResult result) {
        Counter.builder("auto_apply_dispatches_total")
                .tag(TAG_RESULT, result.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Record a callback that changed an entry's state.
     */
    public void recordCallback(SubmissionOutcome outcome) {
        Counter.builder("auto_apply_callbacks_total")
                .tag(TAG_OUTCOME, outcome.getValue())
                .register(registry)
                .increment();
    }

    public void recordCallbackIgnored() {
        callbacksIgnoredCounter.increment();
    }

    public void recordCallbackRejected() {
        callbacksRejectedCounter.increment();
    }
}
