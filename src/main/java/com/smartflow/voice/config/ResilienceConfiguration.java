package com.smartflow.voice.config;

import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.resilience.CircuitBreakerSettings;
import com.smartflow.voice.resilience.CircuitStateListener;
import com.smartflow.voice.resilience.LoggingCircuitStateListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Circuit breakers for the primary, secondary and wake paths, plus the shared clock.
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {

    private static final Map<String, CircuitBreakerSettings> DEFAULTS = Map.of(
            CircuitBreakerRegistry.PRIMARY, new CircuitBreakerSettings(5, Duration.ofSeconds(15), Duration.ofSeconds(120)),
            CircuitBreakerRegistry.SECONDARY, new CircuitBreakerSettings(3, Duration.ofSeconds(30), Duration.ofSeconds(60)),
            CircuitBreakerRegistry.WAKE, new CircuitBreakerSettings(3, Duration.ofSeconds(30), Duration.ofSeconds(60))
    );

    private final SmartflowProperties properties;

    public ResilienceConfiguration(SmartflowProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LoggingCircuitStateListener loggingCircuitStateListener() {
        return new LoggingCircuitStateListener();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(Clock clock, List<CircuitStateListener> listeners) {
        Map<String, CircuitBreakerSettings> settings = new LinkedHashMap<>();
        for (String name : List.of(CircuitBreakerRegistry.PRIMARY, CircuitBreakerRegistry.SECONDARY, CircuitBreakerRegistry.WAKE)) {
            SmartflowProperties.BreakerConfig configured = properties.getBreakers().get(name);
            settings.put(name, configured != null ? toSettings(configured) : DEFAULTS.get(name));
        }

        properties.getBreakers().forEach((name, configured) -> {
            if (!settings.containsKey(name)) {
                log.warn("Ignoring circuit breaker config for unknown backend: {}", name);
            }
        });

        return new CircuitBreakerRegistry(settings, clock, listeners);
    }

    private CircuitBreakerSettings toSettings(SmartflowProperties.BreakerConfig config) {
        return new CircuitBreakerSettings(
                config.getFailureThreshold(),
                config.getResetTimeout(),
                config.getFailureWindow());
    }
}
