package com.smartflow.voice.controller;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.model.dto.VoiceHealthReport;
import com.smartflow.voice.provider.ChatBackend;
import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.service.cache.ResponseCache;
import com.smartflow.voice.service.health.BackendHealthCache;
import com.smartflow.voice.service.session.SessionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Health of the inference core: compute backend, breakers, cache and sessions.
 */
@RestController
@RequestMapping("/v1/voice")
public class VoiceHealthController {

    private final SmartflowProperties properties;
    private final BackendHealthCache healthCache;
    private final CircuitBreakerRegistry breakers;
    private final ResponseCache responseCache;
    private final SessionStore sessionStore;
    private final ChatBackend chatBackend;

    public VoiceHealthController(SmartflowProperties properties,
                                 BackendHealthCache healthCache,
                                 CircuitBreakerRegistry breakers,
                                 ResponseCache responseCache,
                                 SessionStore sessionStore,
                                 ChatBackend chatBackend) {
        this.properties = properties;
        this.healthCache = healthCache;
        this.breakers = breakers;
        this.responseCache = responseCache;
        this.sessionStore = sessionStore;
        this.chatBackend = chatBackend;
    }

    /**
     * @param refresh bypass the health cache and probe the compute backend now
     */
    @GetMapping("/health")
    public Mono<VoiceHealthReport> health(@RequestParam(defaultValue = "false") boolean refresh) {
        if (properties.isMockMode()) {
            return Mono.just(report("mock", "mock", null));
        }
        return healthCache.checkHealth(refresh)
                .map(snapshot -> report(overallStatus(snapshot), chatBackend.isEnabled() ? "primary" : "secondary", snapshot));
    }

    private String overallStatus(BackendHealthSnapshot snapshot) {
        boolean primaryUp = chatBackend.isEnabled()
                && !breakers.get(CircuitBreakerRegistry.PRIMARY).isOpen();
        return primaryUp || snapshot.isHealthy() ? "healthy" : "degraded";
    }

    private VoiceHealthReport report(String status, String mode, BackendHealthSnapshot snapshot) {
        return VoiceHealthReport.builder()
                .status(status)
                .mode(mode)
                .compute(snapshot)
                .computeMetrics(healthCache.status())
                .circuitBreakers(breakers.statistics())
                .responseCache(responseCache.stats())
                .activeSessions(sessionStore.size())
                .build();
    }
}
