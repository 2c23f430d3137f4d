package dev.autoapply.api;

import dev.autoapply.entity.QueueStatus;
import dev.autoapply.model.CallbackResult;
import dev.autoapply.model.SubmissionOutcome;
import dev.autoapply.model.WorkerCallbackRequest;
import dev.autoapply.service.CallbackRejectedException;
import dev.autoapply.service.IllegalQueueTransitionException;
import dev.autoapply.service.QueueEntryNotFoundException;
import dev.autoapply.service.WorkerCallbackService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = WorkerCallbackController.class)
class WorkerCallbackControllerTest {

  private static final String PATH = "/api/worker/update-job-status";

  @Autowired
  private WebTestClient webTestClient;

  @MockitoBean
  private WorkerCallbackService callbackService;

  @Test
  void shouldApplyCallbackAndReturnResult() {
    when(callbackService.handle(eq("s3cret"), any()))
        .thenReturn(new CallbackResult(7L, QueueStatus.COMPLETED, 55L, true));

    webTestClient.post().uri(PATH)
        .header("X-Worker-Secret", "s3cret")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("""
            { "queueId": 7, "userId": 1, "finalStatus": "applied" }
            """)
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.queueId").isEqualTo(7)
        .jsonPath("$.queueStatus").isEqualTo("COMPLETED")
        .jsonPath("$.jobId").isEqualTo(55)
        .jsonPath("$.applied").isEqualTo(true);

    ArgumentCaptor<WorkerCallbackRequest> captor = ArgumentCaptor.forClass(WorkerCallbackRequest.class);
    verify(callbackService).handle(eq("s3cret"), captor.capture());
    assertThat(captor.getValue().getOutcome()).isEqualTo(SubmissionOutcome.SUCCESS);
    assertThat(captor.getValue().getQueueId()).isEqualTo(7L);
  }

  @Test
  void shouldPassBodySecretThroughWhenHeaderMissing() {
    when(callbackService.handle(isNull(), any()))
        .thenReturn(new CallbackResult(7L, QueueStatus.SKIPPED, null, true));

    webTestClient.post().uri(PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("""
            { "queueId": 7, "userId": 1, "status": "skipped", "reason": "Already applied", "secret": "s3cret" }
            """)
        .exchange()
        .expectStatus().isOk();

    ArgumentCaptor<WorkerCallbackRequest> captor = ArgumentCaptor.forClass(WorkerCallbackRequest.class);
    verify(callbackService).handle(isNull(), captor.capture());
    assertThat(captor.getValue().getSecret()).isEqualTo("s3cret");
    assertThat(captor.getValue().getMessage()).isEqualTo("Already applied");
  }

  @Test
  void shouldAnswer401ForBadSecret() {
    when(callbackService.handle(any(), any())).thenThrow(CallbackRejectedException.unauthorized());

    webTestClient.post().uri(PATH)
        .header("X-Worker-Secret", "wrong")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{ \"queueId\": 7, \"userId\": 1, \"outcome\": \"success\" }")
        .exchange()
        .expectStatus().isUnauthorized()
        .expectBody()
        .jsonPath("$.error").isEqualTo("unauthorized");
  }

  @Test
  void shouldAnswer400ForMalformedBody() {
    when(callbackService.handle(any(), any()))
        .thenThrow(CallbackRejectedException.malformed("Missing required fields: queueId, userId and outcome"));

    webTestClient.post().uri(PATH)
        .header("X-Worker-Secret", "s3cret")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{ \"queueId\": 7 }")
        .exchange()
        .expectStatus().isBadRequest();
  }

  @Test
  void shouldAnswer404ForUnknownEntry() {
    when(callbackService.handle(any(), any())).thenThrow(new QueueEntryNotFoundException(404L));

    webTestClient.post().uri(PATH)
        .header("X-Worker-Secret", "s3cret")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{ \"queueId\": 404, \"userId\": 1, \"outcome\": \"failed\" }")
        .exchange()
        .expectStatus().isNotFound()
        .expectBody()
        .jsonPath("$.error").isEqualTo("queue_entry_not_found");
  }

  @Test
  void shouldAnswer409ForIllegalTransition() {
    when(callbackService.handle(any(), any()))
        .thenThrow(new IllegalQueueTransitionException(7L, QueueStatus.FAILED, QueueStatus.COMPLETED));

    webTestClient.post().uri(PATH)
        .header("X-Worker-Secret", "s3cret")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{ \"queueId\": 7, \"userId\": 1, \"outcome\": \"success\" }")
        .exchange()
        .expectStatus().isEqualTo(409);
  }
}
