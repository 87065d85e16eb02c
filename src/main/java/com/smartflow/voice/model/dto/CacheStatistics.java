package com.smartflow.voice.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hit/miss statistics of a TTL cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    @JsonProperty("name")
    private String name;

    /**
     * Approximate number of live entries.
     */
    @JsonProperty("size")
    private long size;

    @JsonProperty("max_size")
    private long maxSize;

    @JsonProperty("hits")
    private long hits;

    @JsonProperty("misses")
    private long misses;

    /**
     * Cache hit rate (0.0-1.0).
     */
    @JsonProperty("hit_rate")
    private double hitRate;

    /**
     * Entries removed because they expired or the cache was full.
     */
    @JsonProperty("evictions")
    private long evictions;
}
