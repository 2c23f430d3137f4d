package dev.autoapply.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for the submission queue, its dispatch loop and plan limits.
 * Loaded from application.yml under 'queue' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "queue")
public class QueueConfig {

    private Scheduler scheduler = new Scheduler();

    /**
     * Daily submission cap per plan name.
     */
    private Map<String, Integer> dailyLimits = new HashMap<>(Map.of(
            "GOLD", 100,
            "SILVER", 40,
            "TWO_WEEKS", 20,
            "FREE", 5));

    /**
     * Queue priority per plan name. Higher is dispatched first.
     */
    private Map<String, Integer> planPriorities = new HashMap<>(Map.of(
            "GOLD", 100,
            "SILVER", 50,
            "TWO_WEEKS", 50,
            "FREE", 10));

    private String defaultPlan = "FREE";

    /**
     * Plan assignment per user id.
     */
    private Map<Long, String> userPlans = new HashMap<>();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(10);
        private int batchSize = 5;
        private int concurrency = 3;
    }
}
