package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Memoized inference result stored in the response cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedInference {

    @JsonProperty("intent")
    private String intent;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("response_text")
    private String responseText;

    /**
     * Backend that produced the answer (primary or secondary).
     */
    @JsonProperty("provenance")
    private ResponseSource provenance;

    @JsonProperty("created_at")
    private Instant createdAt;

    /**
     * Absolute expiry, used by the shared Redis tier to honour the remaining TTL.
     */
    @JsonProperty("expires_at")
    private Instant expiresAt;
}
