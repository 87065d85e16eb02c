package com.smartflow.voice.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable configuration of a single circuit breaker.
 */
@Value
@Builder
public class CircuitBreakerSettings {

    /**
     * Failures (inside the window, or consecutive when no window is set) that open the circuit.
     */
    int failureThreshold;

    /**
     * Time the circuit stays open after the last failure before a trial call is admitted.
     */
    Duration resetTimeout;

    /**
     * Sliding window for failure counting. Null means consecutive-failure counting.
     */
    Duration failureWindow;

    public CircuitBreakerSettings(int failureThreshold, Duration resetTimeout, Duration failureWindow) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeout == null || resetTimeout.isNegative()) {
            throw new IllegalArgumentException("resetTimeout must be a non-negative duration");
        }
        if (failureWindow != null && (failureWindow.isZero() || failureWindow.isNegative())) {
            throw new IllegalArgumentException("failureWindow must be positive when set");
        }
        this.failureThreshold = failureThreshold;
        this.resetTimeout = resetTimeout;
        this.failureWindow = failureWindow;
    }
}
