package com.smartflow.voice.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.model.BackendStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard view of the compute backend health cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComputeStatus {

    @JsonProperty("status")
    private BackendStatus status;

    @JsonProperty("total_health_checks")
    private long totalHealthChecks;

    @JsonProperty("cache_hit_rate")
    private double cacheHitRate;

    @JsonProperty("wake_attempts")
    private long wakeAttempts;

    @JsonProperty("wake_success_rate")
    private double wakeSuccessRate;

    @JsonProperty("last_health")
    private BackendHealthSnapshot lastHealth;
}
