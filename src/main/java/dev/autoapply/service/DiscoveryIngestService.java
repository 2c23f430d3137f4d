package dev.autoapply.service;

import dev.autoapply.entity.JobLink;
import dev.autoapply.entity.JobLinkStatus;
import dev.autoapply.metrics.QueueMetrics;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.ApplicationPayload.JobSnapshot;
import dev.autoapply.model.ApplicationPayload.UserSnapshot;
import dev.autoapply.model.JobListing;
import dev.autoapply.repository.JobLinkRepository;
import dev.autoapply.source.JobSource;
import dev.autoapply.source.ProfileStore;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Feeds the queue: stores postings found by the discovery sources as job links,
 * then turns the best pending links into queue entries.
 */
@Slf4j
@Service
public class DiscoveryIngestService {

    static final String NO_PROFILE_ERROR = "No user profile available";
    private static final List<JobLinkStatus> PROCESSABLE = List.of(JobLinkStatus.PENDING, JobLinkStatus.FAILED);

    private final ObjectProvider<JobSource> jobSources;
    private final ProfileStore profileStore;
    private final JobLinkRepository jobLinkRepository;
    private final ApplicationQueueService queueService;
    private final PlanLimitService planLimitService;
    private final QueueMetrics metrics;
    private final Clock clock;

    public DiscoveryIngestService(ObjectProvider<JobSource> jobSources, ProfileStore profileStore,
                                  JobLinkRepository jobLinkRepository, ApplicationQueueService queueService,
                                  PlanLimitService planLimitService, QueueMetrics metrics, Clock clock) {
        this.jobSources = jobSources;
        this.profileStore = profileStore;
        this.jobLinkRepository = jobLinkRepository;
        this.queueService = queueService;
        this.planLimitService = planLimitService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Search every enabled source and store the new postings for a user.
     * A failing source is logged and skipped.
     *
     * @return number of links stored
     */
    public Mono<Integer> ingest(Long userId, String query) {
        return Flux.fromStream(jobSources.orderedStream())
                .filter(JobSource::isEnabled)
                .flatMap(source -> source.search(query)
                        .onErrorResume(e -> {
                            log.warn("Source {} failed for query '{}': {}", source.getName(), query, e.getMessage());
                            return Flux.empty();
                        }))
                .collectList()
                .publishOn(Schedulers.boundedElastic())
                .map(listings -> storeLinks(userId, query, listings));
    }

    /**
     * Store postings as job links, skipping URLs the user already has.
     *
     * @return number of links stored
     */
    public int storeLinks(Long userId, String query, List<JobListing> listings) {
        Map<String, JobListing> byUrl = new LinkedHashMap<>();
        for (JobListing listing : listings) {
            String url = cleanUrl(listing.getApplyUrl());
            if (!url.isEmpty()) {
                byUrl.putIfAbsent(url, listing);
            }
        }
        if (byUrl.isEmpty()) {
            log.info("No postings with a usable URL for user {} (query '{}')", userId, query);
            return 0;
        }

        Set<String> existing = jobLinkRepository.findExistingUrls(userId, byUrl.keySet());
        LocalDateTime now = LocalDateTime.now(clock);
        int stored = 0;
        for (Map.Entry<String, JobListing> e : byUrl.entrySet()) {
            if (existing.contains(e.getKey())) {
                continue;
            }
            try {
                jobLinkRepository.save(toLink(userId, query, e.getKey(), e.getValue(), now));
                stored++;
            } catch (DataIntegrityViolationException ex) {
                // stored concurrently by another ingest
                log.debug("Link already stored for user {}: {}", userId, e.getKey());
            }
        }

        metrics.recordLinksDiscovered(stored);
        log.info("Stored {} new links for user {} ({} found, {} already known)",
                stored, userId, byUrl.size(), existing.size());
        return stored;
    }

    /**
     * Enqueue up to {@code limit} of the user's best pending links.
     * Demoted links are never picked.
     *
     * @return ids of the queue entries created
     */
    public List<Long> enqueueNextLinks(Long userId, int limit) {
        List<JobLink> links = jobLinkRepository.findNextToProcess(userId, PROCESSABLE, PageRequest.of(0, limit));
        if (links.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Optional<UserSnapshot> user = profileStore.findUser(userId);
        if (user.isEmpty()) {
            log.warn("No profile for user {}, skipping {} links", userId, links.size());
            for (JobLink link : links) {
                link.setStatus(JobLinkStatus.SKIPPED);
                link.setError(NO_PROFILE_ERROR);
                link.setProcessedAt(now);
            }
            jobLinkRepository.saveAll(links);
            return List.of();
        }

        int priority = planLimitService.queuePriority(userId);
        List<Long> queueIds = new ArrayList<>();
        for (JobLink link : links) {
            link.setAttemptCount(link.getAttemptCount() + 1);
            try {
                queueIds.add(queueService.enqueueLink(link, priority, buildPayload(user.get(), link)));
            } catch (RuntimeException e) {
                log.error("Failed to enqueue link {} for user {}: {}", link.getId(), userId, e.getMessage());
                link.setStatus(JobLinkStatus.FAILED);
                link.setError(e.getMessage());
                link.setProcessedAt(now);
                jobLinkRepository.save(link);
            }
        }
        log.info("Enqueued {} of {} links for user {}", queueIds.size(), links.size(), userId);
        return queueIds;
    }

    private ApplicationPayload buildPayload(UserSnapshot user, JobLink link) {
        return ApplicationPayload.builder()
                .user(user)
                .resume(profileStore.findResume(link.getUserId()).orElse(null))
                .profile(profileStore.findProfile(link.getUserId()).orElse(null))
                .job(JobSnapshot.builder()
                        .jobTitle(link.getTitle())
                        .company(link.getCompany())
                        .description(link.getDescription())
                        .applyUrl(link.getUrl())
                        .location(link.getLocation())
                        .source(link.getSource())
                        .externalJobId(link.getExternalJobId())
                        .jobLinkId(link.getId())
                        .build())
                .matchScore(link.getMatchScore())
                .formData(Map.of())
                .build();
    }

    private JobLink toLink(Long userId, String query, String url, JobListing listing, LocalDateTime now) {
        return JobLink.builder()
                .userId(userId)
                .url(url)
                .source(listing.getSource())
                .externalJobId(listing.getExternalJobId())
                .query(query)
                .title(listing.getJobTitle())
                .company(listing.getCompany())
                .location(listing.getLocation())
                .description(stripHtml(listing.getDescription()))
                .matchScore(listing.getMatchScore())
                .createdAt(now)
                .build();
    }

    static String cleanUrl(String url) {
        if (url == null) {
            return "";
        }
        String clean = url.trim()
                .replaceAll("\\s+", "") // Remove any white space
                .replaceAll("[\\u200B-\\u200D\\uFEFF]", ""); // Remove zero-width spaces
        if (!clean.isBlank() && !clean.startsWith("http")) {
            clean = "https://" + clean;
        }
        return clean;
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }
}
