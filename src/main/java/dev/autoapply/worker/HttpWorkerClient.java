package dev.autoapply.worker;

import dev.autoapply.config.WorkerConfig;
import dev.autoapply.metrics.QueueMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.Objects;

/**
 * {@link WorkerClient} over HTTP. Callers apply their own timeouts.
 */
@Slf4j
@Component
public class HttpWorkerClient implements WorkerClient {

    private final WebClient webClient;
    private final WorkerConfig workerConfig;
    private final QueueMetrics metrics;

    public HttpWorkerClient(WebClient.Builder webClientBuilder, WorkerConfig workerConfig, QueueMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("Accept", "application/json")
                .build();
        this.workerConfig = workerConfig;
        this.metrics = metrics;
    }

    @Override
    public Mono<WorkerStatus> fetchStatus() {
        String baseUrl = workerConfig.getCompleteUrl();
        if (baseUrl.isEmpty()) {
            return Mono.error(new IllegalStateException("No worker URL configured"));
        }
        long start = System.currentTimeMillis();
        return webClient.get()
                .uri(baseUrl + "/status")
                .retrieve()
                .bodyToMono(WorkerStatus.class)
                .doOnTerminate(() -> metrics.recordProbeLatency(System.currentTimeMillis() - start));
    }

    @Override
    public Mono<Integer> submit(WorkerSubmission submission) {
        String baseUrl = workerConfig.getCompleteUrl();
        if (baseUrl.isEmpty()) {
            return Mono.error(new IllegalStateException("No worker URL configured"));
        }
        long start = System.currentTimeMillis();
        return webClient.post()
                .uri(baseUrl + "/submit")
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(Objects.requireNonNull(submission))
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value()))
                .doOnNext(status -> log.debug("Worker /submit answered HTTP {}", status))
                .doOnTerminate(() -> metrics.recordHandoffLatency(System.currentTimeMillis() - start));
    }
}
