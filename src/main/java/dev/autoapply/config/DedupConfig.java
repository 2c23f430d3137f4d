package dev.autoapply.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for near-duplicate posting detection.
 * Loaded from application.yml under 'dedup' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "dedup")
public class DedupConfig {

    /**
     * Path marker preceding the listing id, e.g. "/view/" in
     * https://apply.workable.com/j/view/ABC123/senior-java-engineer.
     */
    private String listingMarker = "/view/";

    private double similarityThreshold = 0.8;

    private int minTokenLength = 3;

    /**
     * Ids per demote statement. All chunks share one transaction.
     */
    private int updateChunkSize = 500;
}
