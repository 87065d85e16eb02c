package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One caller utterance handed over by the telephony or chat transport.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InferenceRequest {

    public static final int MAX_TEXT_LENGTH = 2000;

    @JsonProperty("text")
    private String text;

    @JsonProperty("persona")
    @Builder.Default
    private Persona persona = Persona.DEFAULT;

    @JsonProperty("language")
    @Builder.Default
    private Language language = Language.TR;

    @JsonProperty("session_id")
    private String sessionId;

    /**
     * Check the request against the accepted input shape.
     *
     * @throws IllegalArgumentException describing the first violation
     */
    public void validate() {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new IllegalArgumentException("text must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        if (persona == null) {
            persona = Persona.DEFAULT;
        }
        if (language == null) {
            language = Language.TR;
        }
    }
}
