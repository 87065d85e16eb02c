package com.smartflow.voice.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.resilience.CircuitBreakerStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Observability block attached to a graceful-degradation response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DegradationDiagnostics {

    /**
     * Why the last attempted path gave up (never shown to the caller).
     */
    @JsonProperty("reason")
    private String reason;

    @JsonProperty("breakers")
    private Map<String, CircuitBreakerStats> breakers;

    @JsonProperty("compute_status")
    private BackendStatus computeStatus;
}
