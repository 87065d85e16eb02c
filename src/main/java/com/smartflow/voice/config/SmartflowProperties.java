package com.smartflow.voice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the voice inference core.
 * Every value can be overridden from the environment, e.g. {@code SMARTFLOW_PRIMARY_API_KEY}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "smartflow")
public class SmartflowProperties {

    /**
     * Bypass caches, breakers and backends and answer with deterministic canned responses.
     */
    private boolean mockMode = false;

    private PrimaryConfig primary = new PrimaryConfig();
    private SecondaryConfig secondary = new SecondaryConfig();
    private ComputeConfig compute = new ComputeConfig();
    private Map<String, BreakerConfig> breakers = new HashMap<>();
    private CacheConfig cache = new CacheConfig();
    private SessionConfig session = new SessionConfig();
    private ShortcutConfig shortcut = new ShortcutConfig();

    @Data
    public static class PrimaryConfig {
        private boolean enabled = true;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private int maxTokens = 150;
        private double temperature = 0.7;
        private double topP = 0.9;
        private Duration timeout = Duration.ofSeconds(8);
    }

    @Data
    public static class SecondaryConfig {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:8998";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ComputeConfig {
        private Duration healthCacheTtl = Duration.ofSeconds(10);
        private Duration healthCheckTimeout = Duration.ofSeconds(5);
        private Duration wakeTimeout = Duration.ofSeconds(30);
        /**
         * Deadline of the wake request itself. Must be shorter than {@code wakeTimeout}, which
         * also covers the readiness polls; otherwise half of {@code wakeTimeout} is used.
         */
        private Duration wakeRequestTimeout = Duration.ofSeconds(10);
        private Duration wakePollInterval = Duration.ofSeconds(2);
        private int maxWakePolls = 5;
        private String runpodBaseUrl = "https://api.runpod.ai/v2";
        private String runpodEndpointId;
        private String runpodApiKey;

        public Duration effectiveWakeRequestTimeout() {
            if (wakeRequestTimeout == null || wakeRequestTimeout.compareTo(wakeTimeout) >= 0) {
                return wakeTimeout.dividedBy(2);
            }
            return wakeRequestTimeout;
        }
    }

    @Data
    public static class BreakerConfig {
        private int failureThreshold = 3;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private Duration failureWindow = Duration.ofSeconds(60);
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private int maxSize = 500;
        private Duration purgeInterval = Duration.ofMinutes(1);
        private RedisConfig redis = new RedisConfig();
    }

    @Data
    public static class RedisConfig {
        private boolean enabled = false;
        private String keyPrefix = "voice:cache:";
    }

    @Data
    public static class SessionConfig {
        private Duration ttl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private int maxHistory = 20;
        private String systemPrompt = "You are the SmartFlow AI receptionist. Greet callers warmly, "
                + "take appointment requests, listen to complaints and answer information requests. "
                + "Keep every answer to at most two sentences and reply in the caller's language. "
                + "End every answer with a single tag of the form "
                + "[INTENT:appointment|complaint|pricing|cancellation|greeting|farewell|escalation|thanks|info|unknown "
                + "CONFIDENCE:0.0-1.0].";
    }

    @Data
    public static class ShortcutConfig {
        private boolean enabled = true;
        private double confidenceThreshold = 0.9;
    }
}
