package com.smartflow.voice.resilience;

import lombok.Builder;
import lombok.Value;

/**
 * Published to {@link CircuitStateListener}s whenever a breaker changes state.
 */
@Value
@Builder
public class CircuitTransitionEvent {

    String breakerName;
    CircuitState previousState;
    CircuitState newState;

    /**
     * Error that triggered the transition, null for recoveries and resets.
     */
    Throwable error;

    CircuitBreakerStats stats;
}
