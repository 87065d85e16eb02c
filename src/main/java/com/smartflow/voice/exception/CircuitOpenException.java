package com.smartflow.voice.exception;

import com.smartflow.voice.resilience.CircuitBreakerStats;
import lombok.Getter;

/**
 * Raised when a circuit breaker rejects a call without invoking the backend.
 * Distinct from {@link BackendCallException}: nothing was attempted.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String breakerName;
    private final CircuitBreakerStats stats;

    public CircuitOpenException(String breakerName, CircuitBreakerStats stats) {
        super("Circuit breaker [" + breakerName + "] is " + stats.getState().getValue()
                + ", call rejected");
        this.breakerName = breakerName;
        this.stats = stats;
    }
}
