package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent persona requested by the caller's tenant configuration.
 */
public enum Persona {
    DEFAULT("default"),
    SUPPORT("support"),
    SALES("sales"),
    RECEPTIONIST("receptionist");

    private final String value;

    Persona(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Persona fromValue(String value) {
        if (value == null) {
            return DEFAULT;
        }
        for (Persona persona : values()) {
            if (persona.value.equalsIgnoreCase(value.trim())) {
                return persona;
            }
        }
        throw new IllegalArgumentException("Unknown persona: " + value);
    }
}
