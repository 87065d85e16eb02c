package com.smartflow.voice.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.resilience.CircuitBreakerStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of the voice health endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoiceHealthReport {

    /**
     * healthy, degraded or mock.
     */
    @JsonProperty("status")
    private String status;

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("compute")
    private BackendHealthSnapshot compute;

    @JsonProperty("compute_metrics")
    private ComputeStatus computeMetrics;

    @JsonProperty("circuit_breakers")
    private Map<String, CircuitBreakerStats> circuitBreakers;

    @JsonProperty("response_cache")
    private CacheStatistics responseCache;

    @JsonProperty("active_sessions")
    private int activeSessions;
}
