package dev.autoapply.service;

import dev.autoapply.config.QueueConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * {@link PlanLimitService} backed by the plan tables in application.yml.
 * Unknown plans fall back to the default plan.
 */
@Service
@RequiredArgsConstructor
public class ConfiguredPlanLimitService implements PlanLimitService {

    private static final int FALLBACK_LIMIT = 5;
    private static final int FALLBACK_PRIORITY = 10;

    private final QueueConfig queueConfig;

    @Override
    public int dailyLimit(Long userId) {
        String plan = planOf(userId);
        Integer limit = queueConfig.getDailyLimits().get(plan);
        if (limit == null) {
            limit = queueConfig.getDailyLimits().getOrDefault(queueConfig.getDefaultPlan(), FALLBACK_LIMIT);
        }
        return limit;
    }

    @Override
    public int queuePriority(Long userId) {
        String plan = planOf(userId);
        Integer priority = queueConfig.getPlanPriorities().get(plan);
        if (priority == null) {
            priority = queueConfig.getPlanPriorities().getOrDefault(queueConfig.getDefaultPlan(), FALLBACK_PRIORITY);
        }
        return priority;
    }

    private String planOf(Long userId) {
        return queueConfig.getUserPlans().getOrDefault(userId, queueConfig.getDefaultPlan());
    }
}
