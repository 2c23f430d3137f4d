package dev.autoapply.api;

import dev.autoapply.model.CallbackResult;
import dev.autoapply.model.WorkerCallbackRequest;
import dev.autoapply.service.WorkerCallbackService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Receives completion notices from the remote worker.
 * A repeated notice for a finished entry is answered with 200 and {@code applied=false}.
 */
@RestController
@RequestMapping("/api/worker")
public class WorkerCallbackController {

    static final String SECRET_HEADER = "X-Worker-Secret";

    private final WorkerCallbackService callbackService;

    public WorkerCallbackController(WorkerCallbackService callbackService) {
        this.callbackService = callbackService;
    }

    @PostMapping("/update-job-status")
    public Mono<ResponseEntity<CallbackResult>> updateJobStatus(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody WorkerCallbackRequest request) {
        return Mono.fromCallable(() -> callbackService.handle(secret, request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
