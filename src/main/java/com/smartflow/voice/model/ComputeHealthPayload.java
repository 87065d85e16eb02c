package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the compute backend's {@code GET /health}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputeHealthPayload {

    @JsonProperty("status")
    private String status;

    @JsonProperty("model_loaded")
    private Boolean modelLoaded;

    @JsonProperty("gpu_name")
    private String gpuName;

    @JsonProperty("active_sessions")
    private Integer activeSessions;

    @JsonProperty("max_sessions")
    private Integer maxSessions;

    public boolean isReady() {
        return "healthy".equalsIgnoreCase(status) && Boolean.TRUE.equals(modelLoaded);
    }
}
