package com.smartflow.voice.service;

import com.smartflow.voice.config.JacksonConfiguration;
import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.model.InferenceRequest;
import com.smartflow.voice.model.InferenceResponse;
import com.smartflow.voice.model.KeywordInferResponse;
import com.smartflow.voice.model.Language;
import com.smartflow.voice.model.MessageRole;
import com.smartflow.voice.model.ResponseSource;
import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.resilience.CircuitBreakerSettings;
import com.smartflow.voice.resilience.CircuitState;
import com.smartflow.voice.service.cache.ResponseCache;
import com.smartflow.voice.service.health.BackendHealthCache;
import com.smartflow.voice.service.intent.FastIntentClassifier;
import com.smartflow.voice.service.intent.IntentCategory;
import com.smartflow.voice.service.intent.IntentTagParser;
import com.smartflow.voice.service.intent.LocalizedResponses;
import com.smartflow.voice.service.session.ConversationSession;
import com.smartflow.voice.service.session.SessionStore;
import com.smartflow.voice.support.FakeChatBackend;
import com.smartflow.voice.support.FakeComputeClient;
import com.smartflow.voice.support.FakeKeywordBackend;
import com.smartflow.voice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InferenceOrchestratorTest {

    private MutableClock clock;
    private SmartflowProperties properties;
    private CircuitBreakerRegistry breakers;
    private SessionStore sessions;
    private ResponseCache cache;
    private FakeChatBackend chat;
    private FakeKeywordBackend keyword;
    private FakeComputeClient compute;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        properties = new SmartflowProperties();
        properties.getCompute().setWakePollInterval(Duration.ofMillis(5));
        properties.getCompute().setMaxWakePolls(3);
        properties.getCompute().setWakeTimeout(Duration.ofSeconds(5));

        Map<String, CircuitBreakerSettings> settings = new LinkedHashMap<>();
        settings.put(CircuitBreakerRegistry.PRIMARY, new CircuitBreakerSettings(2, Duration.ofSeconds(30), Duration.ofSeconds(60)));
        settings.put(CircuitBreakerRegistry.SECONDARY, new CircuitBreakerSettings(3, Duration.ofSeconds(30), Duration.ofSeconds(60)));
        settings.put(CircuitBreakerRegistry.WAKE, new CircuitBreakerSettings(3, Duration.ofSeconds(30), Duration.ofSeconds(60)));
        breakers = new CircuitBreakerRegistry(settings, clock, List.of());

        sessions = new SessionStore(properties, clock);
        cache = new ResponseCache(properties, clock, Optional.empty());
        chat = new FakeChatBackend();
        keyword = new FakeKeywordBackend();
        compute = new FakeComputeClient(clock, BackendStatus.HEALTHY);
    }

    private InferenceOrchestrator orchestrator() {
        FastIntentClassifier classifier = new FastIntentClassifier();
        return new InferenceOrchestrator(
                properties,
                classifier,
                new IntentTagParser(JacksonConfiguration.newObjectMapper(), classifier),
                cache,
                sessions,
                new BackendHealthCache(compute, breakers, properties, clock),
                breakers,
                chat,
                keyword,
                new MockInferenceResponder(),
                clock);
    }

    private static InferenceRequest request(String text, String sessionId) {
        return InferenceRequest.builder()
                .text(text)
                .language(Language.TR)
                .sessionId(sessionId)
                .build();
    }

    @Test
    void testGreetingShortcutSkipsBackendsAndSession() {
        InferenceResponse response = orchestrator().infer(request("Merhaba", "call-1")).block();

        assertEquals(ResponseSource.SHORTCUT, response.getSource());
        assertEquals("greeting", response.getIntent());
        assertEquals(0.95, response.getConfidence());
        assertEquals(LocalizedResponses.shortcut(
                IntentCategory.GREETING, Language.TR), response.getResponseText());
        assertFalse(response.isCached());
        assertEquals(0, chat.calls.get());
        assertEquals(0, keyword.calls.get());
        assertTrue(sessions.find("call-1").isEmpty());
    }

    @Test
    void testShortcutDisabledGoesToPrimary() {
        properties.getShortcut().setEnabled(false);
        chat.reply("Merhaba, buyrun. [INTENT:greeting CONFIDENCE:0.9]");

        InferenceResponse response = orchestrator().infer(request("Merhaba", "call-1")).block();

        assertEquals(ResponseSource.PRIMARY, response.getSource());
        assertEquals(1, chat.calls.get());
    }

    @Test
    void testPrimaryAnswerIsCachedAcrossSessions() {
        chat.reply("Randevunuzu oluşturuyorum. [INTENT:appointment CONFIDENCE:0.9]");
        InferenceOrchestrator orchestrator = orchestrator();

        InferenceResponse first = orchestrator.infer(request("Randevu almak istiyorum", "call-1")).block();
        InferenceResponse second = orchestrator.infer(request("  randevu   almak istiyorum ", "call-2")).block();

        assertEquals(ResponseSource.PRIMARY, first.getSource());
        assertEquals("Randevunuzu oluşturuyorum.", first.getResponseText());
        assertEquals("appointment", first.getIntent());
        assertEquals(0.9, first.getConfidence());
        assertEquals(1, first.getTurn());
        assertFalse(first.isCached());

        assertEquals(ResponseSource.CACHE, second.getSource());
        assertTrue(second.isCached());
        assertEquals("call-2", second.getSessionId());
        assertEquals(first.getResponseText(), second.getResponseText());
        assertNull(second.getTurn());
        assertEquals(1, chat.calls.get());
    }

    @Test
    void testPrimarySeesConversationHistory() {
        InferenceOrchestrator orchestrator = orchestrator();

        orchestrator.infer(request("Fiyatlarınız nedir", "call-1")).block();
        InferenceResponse second = orchestrator.infer(request("Kampanya var mı", "call-1")).block();

        assertEquals(2, second.getTurn());
        // system prompt, two user turns, first assistant turn
        assertEquals(4, chat.getLastMessages().size());
        assertEquals(MessageRole.SYSTEM, chat.getLastMessages().get(0).getRole());
        assertEquals("Kampanya var mı", chat.getLastMessages().get(3).getContent());
        assertEquals(5, sessions.find("call-1").orElseThrow().getMessages().size());
    }

    @Test
    void testPrimaryFailureFallsBackToSecondary() {
        chat.failing();
        keyword.respond(KeywordInferResponse.builder()
                .intent("pricing")
                .confidence(0.8)
                .responseText("Paketlerimiz aylık 100 TL'den başlıyor.")
                .build());

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(ResponseSource.SECONDARY, response.getSource());
        assertEquals("pricing", response.getIntent());
        assertEquals(0.8, response.getConfidence());
        assertEquals(1, response.getTurn());

        ConversationSession session = sessions.find("call-1").orElseThrow();
        assertEquals(3, session.getMessages().size());
        assertEquals(MessageRole.USER, session.getMessages().get(1).getRole());
        assertEquals(MessageRole.ASSISTANT, session.getMessages().get(2).getRole());
        assertEquals(1, breakers.get(CircuitBreakerRegistry.PRIMARY).getStats().getTotalFailures());
    }

    @Test
    void testPrimaryTimeoutCountsAsFailure() {
        chat.hanging(Duration.ofMillis(50));

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1"))
                .block(Duration.ofSeconds(5));

        assertEquals(ResponseSource.SECONDARY, response.getSource());
        assertEquals(1, breakers.get(CircuitBreakerRegistry.PRIMARY).getStats().getTotalFailures());
    }

    @Test
    void testRepeatedPrimaryTimeoutsOpenBreaker() {
        chat.hanging(Duration.ofMillis(50));
        InferenceOrchestrator orchestrator = orchestrator();

        orchestrator.infer(request("Bir sorum var", "call-1")).block(Duration.ofSeconds(5));
        orchestrator.infer(request("Bilgi almak istiyorum", "call-1")).block(Duration.ofSeconds(5));

        assertEquals(CircuitState.OPEN, breakers.get(CircuitBreakerRegistry.PRIMARY).getState());
        assertEquals(2, chat.calls.get());
    }

    @Test
    void testSecondaryNanConfidenceFallsBackToDefault() {
        chat.disabled();
        keyword.respond(KeywordInferResponse.builder()
                .intent("pricing")
                .confidence(Double.NaN)
                .responseText("Paketlerimiz aylık 100 TL'den başlıyor.")
                .build());

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(InferenceOrchestrator.SECONDARY_DEFAULT_CONFIDENCE, response.getConfidence());
    }

    @Test
    void testOpenPrimaryBreakerIsNotCalled() {
        chat.failing();
        InferenceOrchestrator orchestrator = orchestrator();

        orchestrator.infer(request("Bir sorum var", "call-1")).block();
        orchestrator.infer(request("Bilgi almak istiyorum", "call-1")).block();
        assertEquals(CircuitState.OPEN, breakers.get(CircuitBreakerRegistry.PRIMARY).getState());

        InferenceResponse third = orchestrator.infer(request("Çalışma saatleriniz nedir", "call-1")).block();

        assertEquals(ResponseSource.SECONDARY, third.getSource());
        assertEquals(2, chat.calls.get());
        assertEquals(3, keyword.calls.get());
    }

    @Test
    void testSecondaryWithoutPrimaryRecordsBothTurns() {
        chat.disabled();

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(ResponseSource.SECONDARY, response.getSource());
        assertEquals(0, chat.calls.get());
        ConversationSession session = sessions.find("call-1").orElseThrow();
        assertEquals(3, session.getMessages().size());
        assertEquals(1, session.getTurnCount());
    }

    @Test
    void testSecondaryUnknownLabelAndMissingConfidence() {
        chat.disabled();
        keyword.respond(KeywordInferResponse.builder()
                .intent("weather")
                .responseText("Anladım.")
                .build());

        InferenceResponse response = orchestrator().infer(request("Yarın hava nasıl olacak", "call-1")).block();

        assertEquals("unknown", response.getIntent());
        assertEquals(InferenceOrchestrator.SECONDARY_DEFAULT_CONFIDENCE, response.getConfidence());
    }

    @Test
    void testSleepingComputeIsWokenForSecondary() {
        chat.disabled();
        compute.status(BackendStatus.SLEEPING).statusAfterWake(BackendStatus.HEALTHY);

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(ResponseSource.SECONDARY, response.getSource());
        assertEquals(1, compute.wakes.get());
    }

    @Test
    void testUnreachableComputeDegrades() {
        chat.disabled();
        compute.status(BackendStatus.UNREACHABLE);

        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(ResponseSource.FALLBACK, response.getSource());
        assertEquals(0, keyword.calls.get());
        assertEquals(0, compute.wakes.get());
        assertTrue(response.getDiagnostics().getReason().contains("primary not configured"));
        assertTrue(response.getDiagnostics().getReason().contains("compute backend not ready"));
        assertEquals(BackendStatus.UNREACHABLE, response.getDiagnostics().getComputeStatus());
    }

    @Test
    void testAllBackendsDownDegradesAndIsNotCached() {
        chat.failing();
        keyword.failing();
        InferenceOrchestrator orchestrator = orchestrator();

        InferenceResponse first = orchestrator.infer(request("Fiyatlarınız nedir", "call-1")).block();
        InferenceResponse second = orchestrator.infer(request("Fiyatlarınız nedir", "call-1")).block();

        assertEquals(ResponseSource.FALLBACK, first.getSource());
        assertEquals("escalation", first.getIntent());
        assertEquals(0.0, first.getConfidence());
        assertEquals(LocalizedResponses.degraded(Language.TR), first.getResponseText());
        assertFalse(first.isCached());
        assertTrue(first.getDiagnostics().getReason().contains("primary failed"));
        assertTrue(first.getDiagnostics().getReason().contains("secondary failed"));
        assertTrue(first.getDiagnostics().getBreakers().containsKey(CircuitBreakerRegistry.PRIMARY));

        assertEquals(ResponseSource.FALLBACK, second.getSource());
        assertEquals(2, chat.calls.get());
    }

    @Test
    void testDegradedReplyFollowsLanguage() {
        chat.disabled();
        keyword.disabled();

        InferenceResponse response = orchestrator().infer(InferenceRequest.builder()
                .text("What are your prices")
                .language(Language.EN)
                .build()).block();

        assertEquals(ResponseSource.FALLBACK, response.getSource());
        assertEquals(LocalizedResponses.degraded(Language.EN), response.getResponseText());
    }

    @Test
    void testMockModeBypassesEverything() {
        properties.setMockMode(true);

        InferenceResponse response = orchestrator().infer(request("Randevu almak istiyorum", "call-1")).block();

        assertEquals(ResponseSource.MOCK, response.getSource());
        assertEquals("appointment", response.getIntent());
        assertEquals(0, chat.calls.get());
        assertEquals(0, keyword.calls.get());
        assertEquals(0, compute.probes.get());
    }

    @Test
    void testMissingSessionIdGetsAnonymousId() {
        InferenceResponse response = orchestrator().infer(request("Fiyatlarınız nedir", null)).block();

        assertTrue(response.getSessionId().startsWith("anon-"));
        assertTrue(sessions.find(response.getSessionId()).isPresent());
    }

    @Test
    void testInvalidRequestErrors() {
        InferenceOrchestrator orchestrator = orchestrator();

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.infer(request("  ", "call-1")).block());
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.infer(request("a".repeat(InferenceRequest.MAX_TEXT_LENGTH + 1), "call-1")).block());
        assertEquals(0, chat.calls.get());
    }
}
