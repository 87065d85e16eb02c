package com.smartflow.voice.service.intent;

import com.smartflow.voice.model.Language;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of the fast keyword classifier.
 */
@Value
@Builder
public class IntentResult {

    IntentCategory intent;
    ConfidenceLevel level;
    List<String> detectedKeywords;
    Language language;

    public double getConfidence() {
        return level.getScore();
    }

    static IntentResult unknown(Language language) {
        return IntentResult.builder()
                .intent(IntentCategory.UNKNOWN)
                .level(ConfidenceLevel.LOW)
                .detectedKeywords(List.of())
                .language(language)
                .build();
    }
}
