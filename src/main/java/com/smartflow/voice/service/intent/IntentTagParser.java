package com.smartflow.voice.service.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartflow.voice.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts intent and confidence from a chat model's reply.
 *
 * <p>Tried in order: a JSON object body ({@code response}/{@code response_text}, {@code intent},
 * {@code confidence}), the inline {@code [INTENT:x CONFIDENCE:y]} tag, and finally a keyword
 * heuristic over the reply text. The tag never reaches the caller.</p>
 */
@Slf4j
@Component
public class IntentTagParser {

    private static final Pattern TAG = Pattern.compile("\\s*\\[INTENT:(\\w+)\\s+CONFIDENCE:([\\d.]+)\\]");

    static final double HEURISTIC_MAX_CONFIDENCE = 0.7;
    static final double HEURISTIC_UNKNOWN_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;
    private final FastIntentClassifier classifier;

    public IntentTagParser(ObjectMapper objectMapper, FastIntentClassifier classifier) {
        this.objectMapper = objectMapper;
        this.classifier = classifier;
    }

    public ParsedReply parse(String raw, Language language) {
        String text = raw == null ? "" : raw.trim();

        Optional<ParsedReply> structured = parseStructured(text);
        if (structured.isPresent()) {
            return structured.get();
        }

        Matcher matcher = TAG.matcher(text);
        if (matcher.find()) {
            String clean = TAG.matcher(text).replaceAll("").trim();
            try {
                return ParsedReply.builder()
                        .text(clean)
                        .intent(IntentCategory.fromLabel(matcher.group(1)))
                        .confidence(normalizeConfidence(Double.parseDouble(matcher.group(2))))
                        .method(ParsedReply.Method.TAG)
                        .build();
            } catch (NumberFormatException e) {
                log.debug("Malformed confidence in intent tag: {}", matcher.group(2));
                return heuristic(clean, language);
            }
        }

        return heuristic(text, language);
    }

    private Optional<ParsedReply> parseStructured(String text) {
        if (!text.startsWith("{")) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(text);
            String response = node.hasNonNull("response_text")
                    ? node.get("response_text").asText()
                    : node.path("response").asText("");
            if (response.isBlank() || !node.hasNonNull("intent")) {
                return Optional.empty();
            }
            return Optional.of(ParsedReply.builder()
                    .text(response.trim())
                    .intent(IntentCategory.fromLabel(node.get("intent").asText()))
                    .confidence(normalizeConfidence(node.path("confidence").asDouble(HEURISTIC_UNKNOWN_CONFIDENCE)))
                    .method(ParsedReply.Method.STRUCTURED)
                    .build());
        } catch (JsonProcessingException e) {
            log.debug("Reply looks like JSON but does not parse: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private ParsedReply heuristic(String text, Language language) {
        IntentResult result = classifier.classify(text, language);
        double confidence = result.getIntent() == IntentCategory.UNKNOWN
                ? HEURISTIC_UNKNOWN_CONFIDENCE
                : Math.min(result.getConfidence(), HEURISTIC_MAX_CONFIDENCE);
        return ParsedReply.builder()
                .text(text)
                .intent(result.getIntent())
                .confidence(confidence)
                .method(ParsedReply.Method.HEURISTIC)
                .build();
    }

    /**
     * Clamp into [0, 1]; NaN is treated as no confidence given.
     */
    private static double normalizeConfidence(double value) {
        if (Double.isNaN(value)) {
            return HEURISTIC_UNKNOWN_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
