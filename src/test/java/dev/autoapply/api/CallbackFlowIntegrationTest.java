package dev.autoapply.api;

import dev.autoapply.entity.QueueStatus;
import dev.autoapply.model.ApplicationPayload;
import dev.autoapply.model.ApplicationPayload.JobSnapshot;
import dev.autoapply.repository.ApplicationPayloadRepository;
import dev.autoapply.repository.JobTrackerRepository;
import dev.autoapply.repository.QueueEntryRepository;
import dev.autoapply.service.ApplicationQueueService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class CallbackFlowIntegrationTest {

    private static final String PATH = "/api/worker/update-job-status";
    private static final String SECRET = "test-secret";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ApplicationQueueService queueService;

    @Autowired
    private QueueEntryRepository queueEntryRepository;

    @Autowired
    private ApplicationPayloadRepository payloadRepository;

    @Autowired
    private JobTrackerRepository jobTrackerRepository;

    @AfterEach
    void cleanUp() {
        payloadRepository.deleteAll();
        queueEntryRepository.deleteAll();
        jobTrackerRepository.deleteAll();
    }

    private Long enqueue() {
        ApplicationPayload payload = ApplicationPayload.builder()
                .job(JobSnapshot.builder().jobTitle("Java Engineer").company("Acme")
                        .applyUrl("https://acme.io/view/1/java-engineer").build())
                .build();
        return queueService.enqueue(1L, null, 100, payload);
    }

    private WebTestClient.ResponseSpec callback(Long queueId, String outcome) {
        return webTestClient.post().uri(PATH)
                .header("X-Worker-Secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{ \"queueId\": " + queueId + ", \"userId\": 1, \"outcome\": \"" + outcome + "\" }")
                .exchange();
    }

    @Test
    void skippedCallbackFinishesEntryWithoutTrackerRecord() {
        Long queueId = enqueue();
        assertThat(payloadRepository.existsById(queueId)).isTrue();

        callback(queueId, "skipped").expectStatus().isOk();

        assertThat(queueService.getStatus(queueId)).get()
                .satisfies(status -> assertThat(status.status()).isEqualTo(QueueStatus.SKIPPED));
        assertThat(payloadRepository.existsById(queueId)).isFalse();
        assertThat(jobTrackerRepository.count()).isZero();
    }

    @Test
    void repeatedSuccessCreatesOneTrackerRecord() {
        Long queueId = enqueue();

        callback(queueId, "success").expectStatus().isOk()
                .expectBody().jsonPath("$.applied").isEqualTo(true);
        callback(queueId, "success").expectStatus().isOk()
                .expectBody().jsonPath("$.applied").isEqualTo(false);

        assertThat(jobTrackerRepository.count()).isEqualTo(1);
        assertThat(queueService.findEntry(queueId)).get()
                .satisfies(entry -> {
                    assertThat(entry.getStatus()).isEqualTo(QueueStatus.COMPLETED);
                    assertThat(entry.getJobId()).isNotNull();
                });
    }

    @Test
    void lateFailureDoesNotOverwriteSuccess() {
        Long queueId = enqueue();

        callback(queueId, "success").expectStatus().isOk();
        callback(queueId, "failed").expectStatus().isOk()
                .expectBody().jsonPath("$.applied").isEqualTo(false);

        assertThat(queueService.findEntry(queueId)).get()
                .extracting(entry -> entry.getStatus())
                .isEqualTo(QueueStatus.COMPLETED);
    }

    @Test
    void unknownQueueIdIs404() {
        callback(999_999L, "success").expectStatus().isNotFound();
    }

    @Test
    void wrongSecretIs401AndChangesNothing() {
        Long queueId = enqueue();

        webTestClient.post().uri(PATH)
                .header("X-Worker-Secret", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{ \"queueId\": " + queueId + ", \"userId\": 1, \"outcome\": \"success\" }")
                .exchange()
                .expectStatus().isUnauthorized();

        assertThat(queueService.findEntry(queueId)).get()
                .extracting(entry -> entry.getStatus())
                .isEqualTo(QueueStatus.PENDING);
    }

    @Test
    void queueViewsReportStatusAndStats() {
        Long queueId = enqueue();

        webTestClient.get().uri("/api/queue/{id}", queueId)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("PENDING");

        webTestClient.get().uri("/api/queue/stats/{userId}", 1)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.pending").isEqualTo(1);

        webTestClient.get().uri("/api/queue/{id}", 999_999)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void adminDedupReportsDemotedCount() {
        webTestClient.post().uri("/api/admin/dedup")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.demoted").isEqualTo(0);
    }
}
