package com.smartflow.voice.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Process-wide set of circuit breakers, one per backend name.
 * Breakers are created up front and live for the lifetime of the registry; they are never
 * removed, only reset.
 */
@Slf4j
public class CircuitBreakerRegistry {

    public static final String PRIMARY = "primary";
    public static final String SECONDARY = "secondary";
    public static final String WAKE = "wake";

    private final Map<String, CircuitBreaker> breakers;

    public CircuitBreakerRegistry(Map<String, CircuitBreakerSettings> settings,
                                  Clock clock,
                                  List<CircuitStateListener> listeners) {
        Map<String, CircuitBreaker> created = new LinkedHashMap<>();
        settings.forEach((name, config) -> {
            CircuitBreaker breaker = new CircuitBreaker(name, config, clock);
            listeners.forEach(breaker::addListener);
            created.put(name, breaker);
            log.info("Registered circuit breaker [{}]: threshold={}, resetTimeout={}, window={}",
                    name, config.getFailureThreshold(), config.getResetTimeout(), config.getFailureWindow());
        });
        this.breakers = Collections.unmodifiableMap(created);
    }

    /**
     * Get a breaker that must exist.
     *
     * @throws IllegalStateException when no breaker is configured under that name
     */
    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new IllegalStateException("No circuit breaker configured for backend: " + name);
        }
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> all() {
        return breakers.values();
    }

    /**
     * Stats of every breaker keyed by name, in registration order.
     */
    public Map<String, CircuitBreakerStats> statistics() {
        return breakers.values().stream()
                .collect(Collectors.toMap(
                        CircuitBreaker::getName,
                        CircuitBreaker::getStats,
                        (a, b) -> a,
                        LinkedHashMap::new));
    }

    /**
     * Reset one breaker.
     *
     * @return false when no breaker has that name
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }
}
