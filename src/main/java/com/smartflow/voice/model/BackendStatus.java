package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Availability of the sleep-capable compute backend.
 */
public enum BackendStatus {
    HEALTHY("healthy"),
    SLEEPING("sleeping"),
    UNREACHABLE("unreachable"),
    UNKNOWN("unknown");

    private final String value;

    BackendStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
