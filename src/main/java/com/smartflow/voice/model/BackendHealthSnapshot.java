package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of one health probe of the compute backend, possibly served from cache.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BackendHealthSnapshot {

    @JsonProperty("status")
    BackendStatus status;

    @JsonProperty("observed_at")
    Instant observedAt;

    @JsonProperty("cached")
    boolean cached;

    @JsonProperty("model_loaded")
    boolean modelLoaded;

    @JsonProperty("gpu_name")
    String gpuName;

    @JsonProperty("active_sessions")
    Integer activeSessions;

    @JsonProperty("max_sessions")
    Integer maxSessions;

    @JsonProperty("latency_ms")
    long latencyMs;

    /**
     * Probe failure reason, when the probe did not report healthy.
     */
    @JsonProperty("detail")
    String detail;

    public static BackendHealthSnapshot unknown() {
        return BackendHealthSnapshot.builder()
                .status(BackendStatus.UNKNOWN)
                .build();
    }

    public boolean isHealthy() {
        return status == BackendStatus.HEALTHY;
    }
}
