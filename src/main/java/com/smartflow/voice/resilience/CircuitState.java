package com.smartflow.voice.resilience;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Circuit breaker states.
 *
 * CLOSED -> OPEN when failures inside the window reach the threshold.
 * OPEN -> HALF_OPEN once the reset timeout has elapsed since the last failure.
 * HALF_OPEN -> CLOSED on a successful trial, back to OPEN on a failed one.
 */
public enum CircuitState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
