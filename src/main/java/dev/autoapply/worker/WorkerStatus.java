package dev.autoapply.worker;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Health and capacity as reported by {@code GET /status}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerStatus {

    @JsonAlias("isThrottled")
    private boolean throttled;

    @JsonAlias({"activeJobs", "active"})
    private int activeTasks;

    @JsonAlias({"maxConcurrentJobs", "maxConcurrency"})
    private int maxConcurrent;

    public boolean isReady() {
        return !throttled && activeTasks < maxConcurrent;
    }

    public static WorkerStatus unreachable() {
        return new WorkerStatus(true, 0, 0);
    }
}
