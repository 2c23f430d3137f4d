package dev.autoapply.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the remote browser-automation worker and the callback
 * it reports back to.
 * Loaded from application.yml under 'worker' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "worker")
public class WorkerConfig {

    /**
     * Base URL of the worker; "https://" is assumed when no scheme is given.
     */
    private String url = "";

    /**
     * Secret shared with the worker, echoed back on every callback.
     */
    private String sharedSecret = "";

    /**
     * Public base URL of this service, used to build the callback URL.
     */
    private String serverUrl = "http://localhost:8080";

    private String callbackPath = "/api/worker/update-job-status";

    private Duration probeTimeout = Duration.ofSeconds(10);

    private Duration handoffTimeout = Duration.ofSeconds(30);

    /**
     * Wait before each health probe. One probe follows each delay.
     */
    private List<Duration> wakeUpDelays = new ArrayList<>(List.of(
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            Duration.ofSeconds(15),
            Duration.ofSeconds(20),
            Duration.ofSeconds(30),
            Duration.ofSeconds(30)));

    public String getCompleteUrl() {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = url.trim();
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.startsWith("http") ? trimmed : "https://" + trimmed;
    }

    public String getCallbackUrl() {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        return base + callbackPath;
    }

    public int getMaxProbes() {
        return wakeUpDelays.size();
    }
}
