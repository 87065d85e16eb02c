package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured answer of the secondary keyword backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeywordInferResponse {

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("confidence")
    private Double confidence;

    @JsonProperty("response_text")
    private String responseText;
}
