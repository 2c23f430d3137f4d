package dev.autoapply.service;

import dev.autoapply.entity.JobTrackerRecord;
import dev.autoapply.entity.QueueStatus;
import dev.autoapply.repository.JobTrackerRepository;
import dev.autoapply.repository.QueueEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Tracks each user's submissions against their daily cap.
 * The window is the current UTC calendar day.
 * <p>
 * Entries handed to the worker and still waiting for their callback count
 * against the cap, so a burst of dispatches cannot overshoot it.
 */
@Service
@RequiredArgsConstructor
public class DailyQuotaService {

    private final JobTrackerRepository jobTrackerRepository;
    private final QueueEntryRepository queueEntryRepository;
    private final PlanLimitService planLimitService;
    private final Clock clock;

    public long appliedToday(Long userId) {
        LocalDateTime start = startOfToday();
        return jobTrackerRepository.countAppliedBetween(
                userId, JobTrackerRecord.STATUS_APPLIED, start, start.plusDays(1));
    }

    /**
     * Entries claimed today that are still PROCESSING.
     */
    public long inFlightToday(Long userId) {
        LocalDateTime start = startOfToday();
        return queueEntryRepository.countByStatusUpdatedBetween(
                userId, QueueStatus.PROCESSING, start, start.plusDays(1));
    }

    /**
     * Remaining submissions for today; zero or negative once the cap is reached.
     */
    public long remainingToday(Long userId) {
        return planLimitService.dailyLimit(userId) - appliedToday(userId) - inFlightToday(userId);
    }

    public LocalDateTime nextReset() {
        return startOfToday().plusDays(1);
    }

    private LocalDateTime startOfToday() {
        return LocalDate.now(clock).atStartOfDay();
    }
}
