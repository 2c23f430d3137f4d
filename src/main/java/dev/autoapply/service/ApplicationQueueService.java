package dev.autoapply.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.autoapply.entity.ApplicationPayloadRecord;
import dev.autoapply.entity.JobLink;
import dev.autoapply.entity.JobLinkStatus;
import dev.autoapply.entity.QueueEntry;
import dev.autoapply.entity.QueueStatus;
import dev.autoapply.metrics.QueueMetrics;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.ApplicationStatus;
import dev.autoapply.model.QueueStats;
import dev.autoapply.repository.ApplicationPayloadRepository;
import dev.autoapply.repository.JobLinkRepository;
import dev.autoapply.repository.QueueEntryRepository;
import dev.autoapply.repository.QueueEntryRepository.StatusCount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable submission queue. Owns every state change of a {@link QueueEntry}
 * and the lifetime of its payload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationQueueService {

    private final QueueEntryRepository queueEntryRepository;
    private final ApplicationPayloadRepository payloadRepository;
    private final JobLinkRepository jobLinkRepository;
    private final ObjectMapper objectMapper;
    private final QueueMetrics metrics;
    private final Clock clock;

    /**
     * Create a pending entry together with its payload.
     *
     * @param userId   owner of the submission
     * @param jobId    existing tracker record, or null to create one on success
     * @param priority dispatch hint, higher first
     * @param payload  data the worker needs for this submission
     * @return the new queue id
     */
    @Transactional
    public Long enqueue(Long userId, Long jobId, int priority, ApplicationPayload payload) {
        Objects.requireNonNull(userId, "userId is required for enqueuing a job");
        Objects.requireNonNull(payload, "payload is required for enqueuing a job");

        String payloadJson = serialize(payload);
        LocalDateTime now = LocalDateTime.now(clock);

        QueueEntry entry = queueEntryRepository.save(QueueEntry.builder()
                .userId(userId)
                .jobId(jobId)
                .priority(priority)
                .status(QueueStatus.PENDING)
                .attemptCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build());

        payloadRepository.save(ApplicationPayloadRecord.builder()
                .queueId(entry.getId())
                .payloadJson(payloadJson)
                .createdAt(now)
                .build());

        metrics.recordEnqueued();
        log.info("Queued application {} for user {} (priority {})", entry.getId(), userId, priority);
        return entry.getId();
    }

    /**
     * Enqueue a discovered link and mark it PROCESSED in the same transaction,
     * so a link never has a queue entry while still looking unprocessed.
     *
     * @return the new queue id
     */
    @Transactional
    public Long enqueueLink(JobLink link, int priority, ApplicationPayload payload) {
        Long queueId = enqueue(link.getUserId(), null, priority, payload);
        link.setStatus(JobLinkStatus.PROCESSED);
        link.setError(null);
        link.setProcessedAt(LocalDateTime.now(clock));
        jobLinkRepository.save(link);
        return queueId;
    }

    public Optional<ApplicationStatus> getStatus(Long queueId) {
        return queueEntryRepository.findById(queueId).map(ApplicationStatus::of);
    }

    public Optional<QueueEntry> findEntry(Long queueId) {
        return queueEntryRepository.findById(queueId);
    }

    public Optional<ApplicationPayload> getPayload(Long queueId) {
        return payloadRepository.findById(queueId).map(record -> deserialize(queueId, record.getPayloadJson()));
    }

    /**
     * Claim a pending entry for dispatch.
     *
     * @return the entry now in PROCESSING, or empty if it was not PENDING
     */
    @Transactional
    public Optional<QueueEntry> beginProcessing(Long queueId) {
        QueueEntry entry = lockEntry(queueId);
        if (entry.getStatus() != QueueStatus.PENDING) {
            log.debug("Queue entry {} is {}, not claiming it", queueId, entry.getStatus());
            return Optional.empty();
        }
        transition(entry, QueueStatus.PROCESSING);
        entry.setAttemptCount(entry.getAttemptCount() + 1);
        entry.setError(null);
        return Optional.of(entry);
    }

    /**
     * Park an entry until its user's daily cap resets.
     */
    @Transactional
    public void moveToStandby(Long queueId, String reason) {
        QueueEntry entry = lockEntry(queueId);
        transition(entry, QueueStatus.STANDBY);
        entry.setError(reason);
        log.info("Queue entry {} moved to standby: {}", queueId, reason);
    }

    /**
     * Return up to {@code slots} of a user's standby entries to PENDING, oldest first.
     *
     * @return number of entries reactivated
     */
    @Transactional
    public int reactivateStandby(Long userId, long slots) {
        if (slots <= 0) {
            return 0;
        }
        List<QueueEntry> standby = queueEntryRepository
                .findByUserIdAndStatusOrderByCreatedAtAsc(userId, QueueStatus.STANDBY);
        int reactivated = 0;
        for (QueueEntry entry : standby) {
            if (reactivated >= slots) {
                break;
            }
            transition(entry, QueueStatus.PENDING);
            entry.setError(null);
            reactivated++;
        }
        if (reactivated > 0) {
            log.info("Reactivated {} standby entries for user {} ({} slots left)", reactivated, userId, slots);
        }
        return reactivated;
    }

    /**
     * Record a dispatch-side failure. Terminal; the payload is removed.
     * An entry that already reached a terminal state is left alone.
     *
     * @return true if the entry was marked FAILED
     */
    @Transactional
    public boolean markFailed(Long queueId, String error) {
        QueueEntry entry = lockEntry(queueId);
        if (entry.getStatus().isTerminal()) {
            log.debug("Queue entry {} is already {}, not marking it failed", queueId, entry.getStatus());
            return false;
        }
        finish(entry, QueueStatus.FAILED, error);
        log.warn("Queue entry {} failed: {}", queueId, error);
        return true;
    }

    /**
     * Move an entry to a terminal state and drop its payload.
     * Joins the caller's transaction when there is one.
     */
    @Transactional
    public void finish(QueueEntry entry, QueueStatus terminal, String error) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        transition(entry, terminal);
        entry.setError(error);
        entry.setProcessedAt(entry.getUpdatedAt());
        payloadRepository.deleteById(entry.getId());
    }

    public List<QueueEntry> nextPending(int limit) {
        return queueEntryRepository.findByStatusOrderByPriorityDescCreatedAtAsc(
                QueueStatus.PENDING, PageRequest.of(0, limit));
    }

    public List<Long> usersWithStandbyEntries() {
        return queueEntryRepository.findUserIdsWithStatus(QueueStatus.STANDBY);
    }

    public QueueStats stats() {
        return toStats(queueEntryRepository.countByStatus());
    }

    public QueueStats stats(Long userId) {
        return toStats(queueEntryRepository.countByStatusForUser(userId));
    }

    /**
     * Load an entry under a row lock held until the caller's transaction ends.
     */
    public QueueEntry lockEntry(Long queueId) {
        return queueEntryRepository.findByIdForUpdate(queueId)
                .orElseThrow(() -> new QueueEntryNotFoundException(queueId));
    }

    private void transition(QueueEntry entry, QueueStatus target) {
        if (!entry.getStatus().canTransitionTo(target)) {
            throw new IllegalQueueTransitionException(entry.getId(), entry.getStatus(), target);
        }
        entry.setStatus(target);
        entry.setUpdatedAt(LocalDateTime.now(clock));
    }

    private QueueStats toStats(List<StatusCount> counts) {
        Map<QueueStatus, Long> byStatus = counts.stream()
                .collect(Collectors.toMap(StatusCount::getStatus, StatusCount::getTotal));
        return QueueStats.fromCounts(byStatus);
    }

    private String serialize(ApplicationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Application payload could not be serialized", e);
        }
    }

    private ApplicationPayload deserialize(Long queueId, String json) {
        try {
            return objectMapper.readValue(json, ApplicationPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload for queue entry " + queueId + " is unreadable", e);
        }
    }
}
