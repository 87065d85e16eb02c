package com.smartflow.voice.provider;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.model.ComputeHealthPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Probes {@code GET /health} on the Personaplex GPU server and wakes it.
 *
 * <p>Probe classification:
 * <ul>
 *   <li>200 with status healthy and the model loaded: HEALTHY</li>
 *   <li>200 reporting anything else, HTTP 502/503/504, or a probe timeout: SLEEPING</li>
 *   <li>any other failure: UNREACHABLE</li>
 * </ul>
 *
 * <p>Wake uses the RunPod serverless {@code /run} API when an endpoint id and key are set,
 * otherwise a long-timeout ping of {@code /health}, which starts auto-start pods.</p>
 */
@Slf4j
@Component
public class PersonaplexComputeClient extends AbstractBackendClient implements ComputeBackendClient {

    private static final Set<Integer> STARTING_STATUS_CODES = Set.of(502, 503, 504);

    private final SmartflowProperties.SecondaryConfig server;
    private final SmartflowProperties.ComputeConfig config;
    private final Clock clock;

    public PersonaplexComputeClient(WebClient webClient, SmartflowProperties properties, Clock clock) {
        super(webClient);
        this.server = properties.getSecondary();
        this.config = properties.getCompute();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "compute";
    }

    @Override
    public Mono<BackendHealthSnapshot> probe() {
        return Mono.defer(() -> {
            long start = clock.millis();
            return healthRequest()
                    .exchangeToMono(response -> {
                        int code = response.statusCode().value();
                        if (response.statusCode().is2xxSuccessful()) {
                            return response.bodyToMono(ComputeHealthPayload.class)
                                    .defaultIfEmpty(new ComputeHealthPayload())
                                    .map(payload -> fromPayload(payload, start));
                        }
                        BackendStatus status = STARTING_STATUS_CODES.contains(code)
                                ? BackendStatus.SLEEPING
                                : BackendStatus.UNREACHABLE;
                        return response.releaseBody()
                                .thenReturn(failed(status, "HTTP " + code, start));
                    })
                    .timeout(config.getHealthCheckTimeout())
                    .onErrorResume(TimeoutException.class,
                            e -> Mono.just(failed(BackendStatus.SLEEPING, "probe timed out", start)))
                    .onErrorResume(e -> Mono.just(failed(BackendStatus.UNREACHABLE, e.getMessage(), start)));
        });
    }

    @Override
    public Mono<Void> wake() {
        Duration deadline = config.effectiveWakeRequestTimeout();
        if (isRunpodConfigured()) {
            return withDeadline(wakeViaRunpod(), deadline);
        }
        return withDeadline(wakeViaPing(), deadline);
    }

    private boolean isRunpodConfigured() {
        return !isBlank(config.getRunpodEndpointId()) && !isBlank(config.getRunpodApiKey());
    }

    private Mono<Void> wakeViaRunpod() {
        log.info("Waking compute backend via RunPod serverless endpoint {}", config.getRunpodEndpointId());
        return webClient.post()
                .uri(config.getRunpodBaseUrl() + "/" + config.getRunpodEndpointId() + "/run")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getRunpodApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("input", Map.of("action", "health_check")))
                .retrieve()
                .toBodilessEntity()
                .then();
    }

    /**
     * Any HTTP answer means the request reached the pod; only transport errors fail the wake.
     */
    private Mono<Void> wakeViaPing() {
        log.info("Waking compute backend by pinging {}/health", server.getBaseUrl());
        return healthRequest()
                .exchangeToMono(response -> response.releaseBody());
    }

    private WebClient.RequestHeadersSpec<?> healthRequest() {
        return webClient.get()
                .uri(server.getBaseUrl() + "/health")
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (!isBlank(server.getApiKey())) {
                        headers.set(PersonaplexKeywordBackend.API_KEY_HEADER, server.getApiKey());
                    }
                });
    }

    private BackendHealthSnapshot fromPayload(ComputeHealthPayload payload, long start) {
        boolean ready = payload.isReady();
        return BackendHealthSnapshot.builder()
                .status(ready ? BackendStatus.HEALTHY : BackendStatus.SLEEPING)
                .observedAt(clock.instant())
                .modelLoaded(Boolean.TRUE.equals(payload.getModelLoaded()))
                .gpuName(payload.getGpuName())
                .activeSessions(payload.getActiveSessions())
                .maxSessions(payload.getMaxSessions())
                .latencyMs(clock.millis() - start)
                .detail(ready ? null : "backend reports status=" + payload.getStatus())
                .build();
    }

    private BackendHealthSnapshot failed(BackendStatus status, String detail, long start) {
        return BackendHealthSnapshot.builder()
                .status(status)
                .observedAt(clock.instant())
                .latencyMs(clock.millis() - start)
                .detail(detail)
                .build();
    }
}
