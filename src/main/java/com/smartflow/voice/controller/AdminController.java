package com.smartflow.voice.controller;

import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.resilience.CircuitBreakerStats;
import com.smartflow.voice.service.cache.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator actions on breakers and the response cache.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final CircuitBreakerRegistry breakers;
    private final ResponseCache responseCache;

    public AdminController(CircuitBreakerRegistry breakers, ResponseCache responseCache) {
        this.breakers = breakers;
        this.responseCache = responseCache;
    }

    @GetMapping("/breakers")
    public Map<String, CircuitBreakerStats> getBreakers() {
        return breakers.statistics();
    }

    /**
     * Force a breaker back to CLOSED.
     *
     * @return the breaker's stats after the reset, or 404 for an unknown name
     */
    @PostMapping("/breakers/{name}/reset")
    public ResponseEntity<CircuitBreakerStats> resetBreaker(@PathVariable String name) {
        if (!breakers.reset(name)) {
            return ResponseEntity.notFound().build();
        }
        log.warn("Admin: circuit breaker [{}] reset", name);
        return ResponseEntity.ok(breakers.get(name).getStats());
    }

    /**
     * Clear the response cache (local and shared tiers).
     *
     * @param confirm must be "yes" to proceed
     */
    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache(@RequestParam(required = false) String confirm) {
        if (!"yes".equals(confirm)) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Must provide confirm=yes to clear cache"));
        }

        log.warn("Admin: clearing response cache");
        responseCache.clear();
        return ResponseEntity.noContent().build();
    }
}
