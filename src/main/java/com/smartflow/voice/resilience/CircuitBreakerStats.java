package com.smartflow.voice.resilience;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time statistics of a circuit breaker, exposed for observability
 * and attached to {@link com.smartflow.voice.exception.CircuitOpenException}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CircuitBreakerStats {

    @JsonProperty("name")
    String name;

    @JsonProperty("state")
    CircuitState state;

    /**
     * Failures since the last success or reset.
     */
    @JsonProperty("failures")
    int failures;

    /**
     * Successes since the last reset.
     */
    @JsonProperty("successes")
    int successes;

    @JsonProperty("last_failure_time")
    Instant lastFailureTime;

    @JsonProperty("last_success_time")
    Instant lastSuccessTime;

    @JsonProperty("total_requests")
    long totalRequests;

    @JsonProperty("total_failures")
    long totalFailures;

    @JsonProperty("total_successes")
    long totalSuccesses;

    @JsonProperty("open_transitions")
    long openTransitions;
}
