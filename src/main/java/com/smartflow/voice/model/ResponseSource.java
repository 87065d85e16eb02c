package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which step of the fallback chain produced a response.
 */
public enum ResponseSource {
    SHORTCUT("shortcut"),
    CACHE("cache"),
    PRIMARY("primary"),
    SECONDARY("secondary"),
    FALLBACK("fallback"),
    MOCK("mock");

    private final String value;

    ResponseSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
