package dev.autoapply.service;

import dev.autoapply.config.WorkerConfig;
import dev.autoapply.entity.JobLinkStatus;
import dev.autoapply.entity.JobTrackerRecord;
import dev.autoapply.entity.QueueEntry;
import dev.autoapply.entity.QueueStatus;
import dev.autoapply.metrics.QueueMetrics;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.ApplicationPayload.JobSnapshot;
import dev.autoapply.model.CallbackResult;
import dev.autoapply.model.SubmissionOutcome;
import dev.autoapply.model.WorkerCallbackRequest;
import dev.autoapply.repository.JobLinkRepository;
import dev.autoapply.repository.JobTrackerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the worker's completion notice to its queue entry.
 * <p>
 * This is the only place a submission outcome becomes durable. Delivery is
 * at-least-once, so a notice for an entry that is already terminal changes
 * nothing. The tracker record is created here, on success, and never earlier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerCallbackService {

    private static final String DEFAULT_SKIP_REASON = "Application skipped by worker";
    private static final String DEFAULT_FAILURE = "Application submission failed";

    private final ApplicationQueueService queueService;
    private final JobTrackerRepository jobTrackerRepository;
    private final JobLinkRepository jobLinkRepository;
    private final WorkerConfig workerConfig;
    private final QueueMetrics metrics;
    private final Clock clock;

    /**
     * Authenticate, validate and apply one callback.
     *
     * @param headerSecret value of the X-Worker-Secret header, may be null
     * @throws CallbackRejectedException    bad secret or malformed body
     * @throws QueueEntryNotFoundException  unknown queue id
     */
    @Transactional
    public CallbackResult handle(String headerSecret, WorkerCallbackRequest request) {
        authenticate(headerSecret != null ? headerSecret : request.getSecret());
        validate(request);

        QueueEntry entry = queueService.lockEntry(request.getQueueId());
        if (!Objects.equals(entry.getUserId(), request.getUserId())) {
            metrics.recordCallbackRejected();
            throw CallbackRejectedException.malformed(
                    "userId " + request.getUserId() + " does not own queue entry " + entry.getId());
        }

        if (entry.getStatus().isTerminal()) {
            log.info("Ignoring repeated callback for queue entry {} (already {})", entry.getId(), entry.getStatus());
            metrics.recordCallbackIgnored();
            return new CallbackResult(entry.getId(), entry.getStatus(), entry.getJobId(), false);
        }

        SubmissionOutcome outcome = request.getOutcome();
        log.info("Worker callback: queue entry {} user {} -> {}", entry.getId(), entry.getUserId(), outcome.getValue());

        switch (outcome) {
            case SUCCESS -> applySuccess(entry);
            case SKIPPED -> queueService.finish(entry, QueueStatus.SKIPPED,
                    defaultIfBlank(request.getMessage(), DEFAULT_SKIP_REASON));
            case FAILED -> queueService.finish(entry, QueueStatus.FAILED,
                    defaultIfBlank(request.getMessage(), DEFAULT_FAILURE));
        }

        metrics.recordCallback(outcome);
        return new CallbackResult(entry.getId(), entry.getStatus(), entry.getJobId(), true);
    }

    private void applySuccess(QueueEntry entry) {
        // read before finish() deletes it
        Optional<ApplicationPayload> payload = queueService.getPayload(entry.getId());
        JobSnapshot job = payload.map(ApplicationPayload::getJob).orElse(null);
        LocalDateTime now = LocalDateTime.now(clock);

        JobTrackerRecord record = entry.getJobId() != null
                ? jobTrackerRepository.findById(entry.getJobId()).orElse(null)
                : null;
        if (record == null) {
            record = newRecord(entry, job, payload.map(ApplicationPayload::getMatchScore).orElse(null), now);
        }
        record.setStatus(JobTrackerRecord.STATUS_APPLIED);
        record.setApplicationStatus(JobTrackerRecord.APPLICATION_STATUS_APPLIED);
        record.setAppliedAt(now);
        record.setSubmittedAt(now);
        record.setUpdatedAt(now);
        record = jobTrackerRepository.save(record);

        entry.setJobId(record.getId());
        queueService.finish(entry, QueueStatus.COMPLETED, null);

        if (job != null && job.getJobLinkId() != null) {
            jobLinkRepository.findById(job.getJobLinkId()).ifPresent(link -> {
                link.setStatus(JobLinkStatus.APPLIED);
                link.setProcessedAt(now);
            });
        }
        log.info("Application recorded for user {}: {} at {} (tracker id {})",
                entry.getUserId(), record.getJobTitle(), record.getCompany(), record.getId());
    }

    private JobTrackerRecord newRecord(QueueEntry entry, JobSnapshot job, Integer matchScore, LocalDateTime now) {
        return JobTrackerRecord.builder()
                .userId(entry.getUserId())
                .jobTitle(job != null ? defaultIfBlank(job.getJobTitle(), "Unknown Job") : "Unknown Job")
                .company(job != null ? defaultIfBlank(job.getCompany(), "Unknown Company") : "Unknown Company")
                .link(job != null ? job.getApplyUrl() : null)
                .source(job != null ? job.getSource() : null)
                .externalJobId(job != null ? job.getExternalJobId() : null)
                .matchScore(matchScore)
                .createdAt(now)
                .build();
    }

    private void authenticate(String providedSecret) {
        String expected = workerConfig.getSharedSecret();
        if (expected == null || expected.isBlank() || providedSecret == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                providedSecret.getBytes(StandardCharsets.UTF_8))) {
            log.error("Unauthorized worker callback - invalid secret");
            metrics.recordCallbackRejected();
            throw CallbackRejectedException.unauthorized();
        }
    }

    private void validate(WorkerCallbackRequest request) {
        if (request.getQueueId() == null || request.getUserId() == null || request.getOutcome() == null) {
            log.error("Missing required fields in worker callback: queueId={}, userId={}, outcome={}",
                    request.getQueueId(), request.getUserId(), request.getOutcome());
            metrics.recordCallbackRejected();
            throw CallbackRejectedException.malformed("Missing required fields: queueId, userId and outcome");
        }
    }

    private static String defaultIfBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
