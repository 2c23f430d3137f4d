package dev.autoapply.source;

import dev.autoapply.model.JobListing;
import reactor.core.publisher.Flux;

/**
 * A job search backend that yields normalized postings.
 */
public interface JobSource {

    /**
     * Get the name of this source (e.g., "Workable", "Adzuna")
     */
    String getName();

    /**
     * Search postings matching a free-text query.
     */
    Flux<JobListing> search(String query);

    /**
     * Check if this source is enabled.
     */
    default boolean isEnabled() {
        return true;
    }
}
