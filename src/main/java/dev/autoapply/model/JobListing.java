package dev.autoapply.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Normalized posting as produced by a discovery source.
 */
@Data
@Builder
public class JobListing {
    private String jobTitle;
    private String company;
    private String description;
    private String applyUrl;
    private String location;
    private String source;
    private String externalJobId;
    private Integer matchScore;

    private Instant discoveredAt;
}
