package com.smartflow.voice.controller;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.resilience.CircuitBreakerSettings;
import com.smartflow.voice.service.cache.ResponseCache;
import com.smartflow.voice.service.health.BackendHealthCache;
import com.smartflow.voice.service.session.SessionStore;
import com.smartflow.voice.support.FakeChatBackend;
import com.smartflow.voice.support.FakeComputeClient;
import com.smartflow.voice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class VoiceHealthControllerTest {

    private MutableClock clock;
    private SmartflowProperties properties;
    private CircuitBreakerRegistry breakers;
    private FakeComputeClient compute;
    private FakeChatBackend chat;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new SmartflowProperties();
        Map<String, CircuitBreakerSettings> settings = new LinkedHashMap<>();
        settings.put(CircuitBreakerRegistry.PRIMARY, new CircuitBreakerSettings(5, Duration.ofSeconds(15), Duration.ofSeconds(120)));
        settings.put(CircuitBreakerRegistry.WAKE, new CircuitBreakerSettings(3, Duration.ofSeconds(30), Duration.ofSeconds(60)));
        breakers = new CircuitBreakerRegistry(settings, clock, List.of());
        compute = new FakeComputeClient(clock, BackendStatus.HEALTHY);
        chat = new FakeChatBackend();
    }

    private WebTestClient client() {
        VoiceHealthController controller = new VoiceHealthController(
                properties,
                new BackendHealthCache(compute, breakers, properties, clock),
                breakers,
                new ResponseCache(properties, clock, Optional.empty()),
                new SessionStore(properties, clock),
                chat);
        return WebTestClient.bindToController(controller).build();
    }

    @Test
    void testHealthyWithPrimary() {
        client().get().uri("/v1/voice/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.mode").isEqualTo("primary")
                .jsonPath("$.compute.status").isEqualTo("healthy")
                .jsonPath("$.circuit_breakers.primary.state").isEqualTo("closed")
                .jsonPath("$.response_cache.size").isEqualTo(0)
                .jsonPath("$.active_sessions").isEqualTo(0);
    }

    @Test
    void testSecondaryModeDegradedWhenComputeUnreachable() {
        chat.disabled();
        compute.status(BackendStatus.UNREACHABLE);

        client().get().uri("/v1/voice/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.mode").isEqualTo("secondary")
                .jsonPath("$.compute.status").isEqualTo("unreachable");
    }

    @Test
    void testRefreshBypassesHealthCache() {
        WebTestClient client = client();

        client.get().uri("/v1/voice/health").exchange().expectStatus().isOk();
        client.get().uri("/v1/voice/health").exchange()
                .expectBody().jsonPath("$.compute.cached").isEqualTo(true);
        client.get().uri("/v1/voice/health?refresh=true").exchange()
                .expectBody().jsonPath("$.compute.cached").isEqualTo(false);

        assertEquals(2, compute.probes.get());
    }

    @Test
    void testMockMode() {
        properties.setMockMode(true);

        client().get().uri("/v1/voice/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("mock")
                .jsonPath("$.compute").doesNotExist();

        assertEquals(0, compute.probes.get());
    }
}
