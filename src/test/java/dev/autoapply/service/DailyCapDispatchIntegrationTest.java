package dev.autoapply.service;

import dev.autoapply.config.QueueConfig;
import dev.autoapply.entity.QueueStatus;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.ApplicationPayload.JobSnapshot;
import dev.autoapply.model.DispatchResult;
import dev.autoapply.model.QueueStats;
import dev.autoapply.repository.ApplicationPayloadRepository;
import dev.autoapply.repository.JobTrackerRepository;
import dev.autoapply.repository.QueueEntryRepository;
import dev.autoapply.worker.WorkerClient;
import dev.autoapply.worker.WorkerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = "queue.daily-limits.FREE=1")
@ActiveProfiles("test")
class DailyCapDispatchIntegrationTest {

    private static final Long USER_ID = 1L;

    @MockitoBean
    private WorkerClient workerClient;

    @Autowired
    private ApplicationQueueService queueService;

    @Autowired
    private SubmissionDispatcher dispatcher;

    @Autowired
    private DailyQuotaService quotaService;

    @Autowired
    private LinkDeduplicationService deduplicationService;

    @Autowired
    private Clock clock;

    @Autowired
    private QueueEntryRepository queueEntryRepository;

    @Autowired
    private ApplicationPayloadRepository payloadRepository;

    @Autowired
    private JobTrackerRepository jobTrackerRepository;

    @BeforeEach
    void setUp() {
        when(workerClient.fetchStatus()).thenReturn(Mono.just(new WorkerStatus(false, 0, 2)));
        when(workerClient.submit(any())).thenReturn(Mono.just(202));
    }

    @AfterEach
    void cleanUp() {
        payloadRepository.deleteAll();
        queueEntryRepository.deleteAll();
        jobTrackerRepository.deleteAll();
    }

    private List<Long> enqueue(int count) {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ApplicationPayload payload = ApplicationPayload.builder()
                    .job(JobSnapshot.builder().jobTitle("Java Engineer " + i).company("Acme")
                            .applyUrl("https://acme.io/view/" + i + "/java-engineer").build())
                    .build();
            ids.add(queueService.enqueue(USER_ID, null, 100, payload));
        }
        return ids;
    }

    @Test
    void entriesAwaitingCallbackUseUpTheCap() {
        List<DispatchResult> results = new ArrayList<>();
        for (Long queueId : enqueue(3)) {
            results.add(dispatcher.dispatch(queueId).block());
        }

        assertThat(results).containsExactly(DispatchResult.ACCEPTED, DispatchResult.STANDBY, DispatchResult.STANDBY);
        assertThat(quotaService.inFlightToday(USER_ID)).isEqualTo(1);
        QueueStats stats = queueService.stats(USER_ID);
        assertThat(stats.processing()).isEqualTo(1);
        assertThat(stats.standby()).isEqualTo(2);
        verify(workerClient, times(1)).submit(any());
    }

    @Test
    void concurrentBatchHandsOffNoMoreThanTheCap() {
        QueueConfig queueConfig = new QueueConfig();
        queueConfig.getScheduler().setBatchSize(5);
        queueConfig.getScheduler().setConcurrency(3);
        DispatchScheduler scheduler = new DispatchScheduler(queueService, dispatcher, quotaService,
                deduplicationService, queueConfig, clock);
        enqueue(3);

        Map<DispatchResult, Long> summary = scheduler.runOnce();

        assertThat(summary).containsEntry(DispatchResult.ACCEPTED, 1L).containsEntry(DispatchResult.STANDBY, 2L);
        assertThat(queueEntryRepository.findByUserIdAndStatusOrderByCreatedAtAsc(USER_ID, QueueStatus.STANDBY))
                .hasSize(2);
        verify(workerClient, times(1)).submit(any());
    }
}
