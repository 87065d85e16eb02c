package com.smartflow.voice.service.intent;

import lombok.Builder;
import lombok.Value;

/**
 * Primary backend output split into the caller-facing text and its intent label.
 */
@Value
@Builder
public class ParsedReply {

    public enum Method {
        STRUCTURED,
        TAG,
        HEURISTIC
    }

    String text;
    IntentCategory intent;
    double confidence;
    Method method;
}
