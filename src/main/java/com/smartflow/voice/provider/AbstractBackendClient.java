package com.smartflow.voice.provider;

import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.exception.BackendTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Base class for HTTP backend clients.
 *
 * <p>Calls are not retried here: every attempt is one breaker outcome, and retrying inside the
 * breaker would hide failures from it.</p>
 */
@Slf4j
public abstract class AbstractBackendClient {

    protected final WebClient webClient;

    protected AbstractBackendClient(WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Short backend name used in logs and exceptions.
     */
    public abstract String getName();

    /**
     * Bound a call by {@code timeout} and normalize its failures to {@link BackendCallException}.
     */
    protected <T> Mono<T> withDeadline(Mono<T> call, Duration timeout) {
        return call
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new BackendTimeoutException(getName(), timeout, e))
                .onErrorMap(e -> !(e instanceof BackendCallException),
                        e -> new BackendCallException(getName(), describe(e), e))
                .doOnSuccess(response -> log.debug("Request succeeded for backend: {}", getName()))
                .doOnError(error -> log.warn("Request failed for backend {}: {}", getName(), error.getMessage()));
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String describe(Throwable error) {
        if (error instanceof WebClientResponseException) {
            WebClientResponseException response = (WebClientResponseException) error;
            return getName() + " returned HTTP " + response.getStatusCode().value();
        }
        return getName() + " call failed: " + error.getMessage();
    }
}
