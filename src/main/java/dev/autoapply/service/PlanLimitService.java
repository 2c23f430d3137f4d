package dev.autoapply.service;

/**
 * Plan-derived limits for a user.
 */
public interface PlanLimitService {

    /**
     * Maximum number of applications the user may submit per UTC day.
     */
    int dailyLimit(Long userId);

    /**
     * Queue priority for the user's entries. Higher is dispatched first.
     */
    int queuePriority(Long userId);
}
