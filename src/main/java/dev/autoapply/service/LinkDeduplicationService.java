package dev.autoapply.service;

import dev.autoapply.config.DedupConfig;
import dev.autoapply.dedup.DedupException;
import dev.autoapply.dedup.LinkClusterer;
import dev.autoapply.dedup.LinkClusterer.SlugSource;
import dev.autoapply.dedup.SlugTokenizer;
import dev.autoapply.metrics.QueueMetrics;
import dev.autoapply.repository.JobLinkRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Demotes near-duplicate postings so that a job re-posted under several
 * URLs consumes a single submission slot.
 * <p>
 * Links are clustered per user. Nothing is deleted; duplicates get priority 0.
 */
@Slf4j
@Service
public class LinkDeduplicationService {

    private final JobLinkRepository jobLinkRepository;
    private final QueueMetrics metrics;
    private final LinkClusterer clusterer;
    private final int chunkSize;

    public LinkDeduplicationService(JobLinkRepository jobLinkRepository, DedupConfig dedupConfig,
                                    QueueMetrics metrics) {
        this.jobLinkRepository = jobLinkRepository;
        this.metrics = metrics;
        SlugTokenizer tokenizer = new SlugTokenizer(dedupConfig.getListingMarker(), dedupConfig.getMinTokenLength());
        this.clusterer = new LinkClusterer(tokenizer, dedupConfig.getSimilarityThreshold());
        this.chunkSize = Math.max(1, dedupConfig.getUpdateChunkSize());
    }

    /**
     * Deduplicate every user's links in one transaction.
     *
     * @return number of links whose priority changed
     */
    @Transactional
    public int deduplicateAll() {
        int demoted = 0;
        try {
            for (Long userId : jobLinkRepository.findDistinctUserIds()) {
                demoted += deduplicateLinks(userId);
            }
        } catch (DataAccessException e) {
            throw new DedupException("Deduplication aborted: " + e.getMessage(), e);
        }
        log.info("Deduplication complete: {} job links demoted to priority=0", demoted);
        metrics.recordLinksDemoted(demoted);
        return demoted;
    }

    /**
     * Deduplicate one user's links in one transaction.
     *
     * @return number of links whose priority changed
     */
    @Transactional
    public int deduplicateUser(Long userId) {
        int demoted;
        try {
            demoted = deduplicateLinks(userId);
        } catch (DataAccessException e) {
            throw new DedupException("Deduplication aborted for user " + userId + ": " + e.getMessage(), e);
        }
        metrics.recordLinksDemoted(demoted);
        return demoted;
    }

    private int deduplicateLinks(Long userId) {
        List<SlugSource> links = jobLinkRepository.findByUserIdOrderByIdAsc(userId).stream()
                .map(l -> new SlugSource(l.getId(), l.getUrl()))
                .toList();
        if (links.size() < 2) {
            return 0;
        }

        LinkClusterer.Result result = clusterer.cluster(links);
        log.debug("User {}: {} links, {} comparisons, {} duplicate clusters",
                userId, links.size(), result.comparisons(), result.clusters().size());

        List<Long> duplicates = result.duplicateIds();
        if (duplicates.isEmpty()) {
            return 0;
        }

        int demoted = 0;
        for (int from = 0; from < duplicates.size(); from += chunkSize) {
            List<Long> chunk = duplicates.subList(from, Math.min(from + chunkSize, duplicates.size()));
            demoted += jobLinkRepository.demote(chunk);
        }
        if (demoted > 0) {
            log.info("User {}: demoted {} job links across {} duplicate clusters",
                    userId, demoted, result.clusters().size());
        }
        return demoted;
    }
}
