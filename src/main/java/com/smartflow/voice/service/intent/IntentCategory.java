package com.smartflow.voice.service.intent;

import java.util.Locale;

/**
 * Caller intents recognized by the classifiers and reported in responses.
 */
public enum IntentCategory {
    APPOINTMENT("appointment"),
    COMPLAINT("complaint"),
    PRICING("pricing"),
    CANCELLATION("cancellation"),
    GREETING("greeting"),
    FAREWELL("farewell"),
    ESCALATION("escalation"),
    THANKS("thanks"),
    INFO("info"),
    UNKNOWN("unknown");

    private final String value;

    IntentCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether a high-confidence match can be answered with a canned reply.
     */
    public boolean isShortcuttable() {
        return this == GREETING || this == FAREWELL || this == THANKS || this == ESCALATION;
    }

    /**
     * Lenient lookup for labels produced by models. Unrecognized labels map to {@link #UNKNOWN}.
     */
    public static IntentCategory fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("info_request")) {
            return INFO;
        }
        for (IntentCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
