package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartflow.voice.model.dto.DegradationDiagnostics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to one utterance. Always well-formed: failures show up in {@code source}
 * and {@code diagnostics}, never as an error status.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InferenceResponse {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("response_text")
    private String responseText;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("source")
    private ResponseSource source;

    @JsonProperty("cached")
    private boolean cached;

    /**
     * Session turn count after this exchange; absent when the session was not touched.
     */
    @JsonProperty("turn")
    private Integer turn;

    /**
     * Breaker and backend state, attached to degraded responses only.
     */
    @JsonProperty("diagnostics")
    private DegradationDiagnostics diagnostics;
}
