package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body of the secondary backend's {@code POST /infer}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordInferRequest {

    @JsonProperty("text")
    private String text;

    @JsonProperty("persona")
    private Persona persona;

    @JsonProperty("language")
    private Language language;
}
