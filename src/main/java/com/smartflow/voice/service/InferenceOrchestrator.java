package com.smartflow.voice.service;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.exception.CircuitOpenException;
import com.smartflow.voice.exception.DegradedServiceException;
import com.smartflow.voice.model.BackendHealthSnapshot;
import com.smartflow.voice.model.BackendStatus;
import com.smartflow.voice.model.CachedInference;
import com.smartflow.voice.model.InferenceRequest;
import com.smartflow.voice.model.InferenceResponse;
import com.smartflow.voice.model.KeywordInferRequest;
import com.smartflow.voice.model.KeywordInferResponse;
import com.smartflow.voice.model.MessageRole;
import com.smartflow.voice.model.ResponseSource;
import com.smartflow.voice.model.dto.DegradationDiagnostics;
import com.smartflow.voice.provider.ChatBackend;
import com.smartflow.voice.provider.KeywordBackend;
import com.smartflow.voice.resilience.CircuitBreaker;
import com.smartflow.voice.resilience.CircuitBreakerRegistry;
import com.smartflow.voice.service.cache.ResponseCache;
import com.smartflow.voice.service.cache.ResponseCacheKeys;
import com.smartflow.voice.service.health.BackendHealthCache;
import com.smartflow.voice.service.intent.FastIntentClassifier;
import com.smartflow.voice.service.intent.IntentCategory;
import com.smartflow.voice.service.intent.IntentResult;
import com.smartflow.voice.service.intent.IntentTagParser;
import com.smartflow.voice.service.intent.LocalizedResponses;
import com.smartflow.voice.service.intent.ParsedReply;
import com.smartflow.voice.service.session.ConversationSession;
import com.smartflow.voice.service.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one caller utterance into a response.
 *
 * Order:
 * 1. Mock mode, when configured
 * 2. Fast intent shortcut for trivial high-confidence intents (free, no state touched)
 * 3. Response cache
 * 4. Primary chat backend, when its breaker allows
 * 5. Secondary keyword backend, when its breaker allows and the compute backend is ready
 * 6. Localized handoff message with diagnostics, never cached
 *
 * A valid request always yields a response; backend failures only change {@code source}.
 */
@Slf4j
@Service
public class InferenceOrchestrator {

    static final double SECONDARY_DEFAULT_CONFIDENCE = 0.5;

    private final SmartflowProperties properties;
    private final FastIntentClassifier classifier;
    private final IntentTagParser tagParser;
    private final ResponseCache cache;
    private final SessionStore sessions;
    private final BackendHealthCache healthCache;
    private final CircuitBreakerRegistry breakers;
    private final ChatBackend chatBackend;
    private final KeywordBackend keywordBackend;
    private final MockInferenceResponder mockResponder;
    private final Clock clock;

    public InferenceOrchestrator(SmartflowProperties properties,
                                 FastIntentClassifier classifier,
                                 IntentTagParser tagParser,
                                 ResponseCache cache,
                                 SessionStore sessions,
                                 BackendHealthCache healthCache,
                                 CircuitBreakerRegistry breakers,
                                 ChatBackend chatBackend,
                                 KeywordBackend keywordBackend,
                                 MockInferenceResponder mockResponder,
                                 Clock clock) {
        this.properties = properties;
        this.classifier = classifier;
        this.tagParser = tagParser;
        this.cache = cache;
        this.sessions = sessions;
        this.healthCache = healthCache;
        this.breakers = breakers;
        this.chatBackend = chatBackend;
        this.keywordBackend = keywordBackend;
        this.mockResponder = mockResponder;
        this.clock = clock;
    }

    /**
     * Answer one utterance.
     *
     * @return the response; errors only with {@link IllegalArgumentException} for invalid input
     */
    public Mono<InferenceResponse> infer(InferenceRequest request) {
        try {
            request.validate();
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }

        return Mono.defer(() -> {
            long start = clock.millis();
            Attempt attempt = new Attempt(request, resolveSessionId(request.getSessionId()));

            return route(attempt)
                    .onErrorResume(DegradedServiceException.class, e -> Mono.just(degraded(attempt, e.getMessage())))
                    .onErrorResume(e -> {
                        log.error("Unexpected error while answering session {}", attempt.sessionId, e);
                        return Mono.just(degraded(attempt, "internal error: " + e.getMessage()));
                    })
                    .map(response -> {
                        response.setLatencyMs(clock.millis() - start);
                        log.info("Answered session={} source={} intent={} latency={}ms",
                                response.getSessionId(), response.getSource().getValue(),
                                response.getIntent(), response.getLatencyMs());
                        return response;
                    });
        });
    }

    private Mono<InferenceResponse> route(Attempt attempt) {
        InferenceRequest request = attempt.request;

        if (properties.isMockMode()) {
            return Mono.just(mock(attempt));
        }

        SmartflowProperties.ShortcutConfig shortcut = properties.getShortcut();
        if (shortcut.isEnabled()) {
            IntentResult fast = classifier.classify(request.getText(), request.getLanguage());
            if (classifier.isShortcut(fast, shortcut.getConfidenceThreshold())) {
                log.debug("Shortcut {} for session {} (keywords {})",
                        fast.getIntent().getValue(), attempt.sessionId, fast.getDetectedKeywords());
                return Mono.just(InferenceResponse.builder()
                        .sessionId(attempt.sessionId)
                        .intent(fast.getIntent().getValue())
                        .confidence(fast.getConfidence())
                        .responseText(LocalizedResponses.shortcut(fast.getIntent(), request.getLanguage()))
                        .source(ResponseSource.SHORTCUT)
                        .cached(false)
                        .build());
            }
        }

        Optional<CachedInference> hit = cache.get(attempt.cacheKey);
        if (hit.isPresent()) {
            CachedInference cached = hit.get();
            return Mono.just(InferenceResponse.builder()
                    .sessionId(attempt.sessionId)
                    .intent(cached.getIntent())
                    .confidence(cached.getConfidence())
                    .responseText(cached.getResponseText())
                    .source(ResponseSource.CACHE)
                    .cached(true)
                    .build());
        }

        return attemptPrimary(attempt)
                .switchIfEmpty(Mono.defer(() -> attemptSecondary(attempt)))
                .switchIfEmpty(Mono.defer(() -> Mono.error(
                        new DegradedServiceException(String.join("; ", attempt.reasons)))));
    }

    /**
     * Completes empty when the primary path was skipped or failed; the reason is recorded.
     */
    private Mono<InferenceResponse> attemptPrimary(Attempt attempt) {
        if (!chatBackend.isEnabled()) {
            attempt.reasons.add("primary not configured");
            return Mono.empty();
        }
        CircuitBreaker breaker = breakers.get(CircuitBreakerRegistry.PRIMARY);
        if (!breaker.allowsRequests()) {
            attempt.reasons.add("primary circuit open");
            return Mono.empty();
        }

        InferenceRequest request = attempt.request;
        ConversationSession session = sessions.appendTurn(attempt.sessionId, MessageRole.USER, request.getText());
        attempt.userTurnRecorded = true;

        return breaker.<ParsedReply>execute(() -> chatBackend.complete(session.getMessages())
                        .map(raw -> tagParser.parse(raw, request.getLanguage()))
                        .flatMap(reply -> reply.getText().isEmpty()
                                ? Mono.<ParsedReply>error(new BackendCallException(chatBackend.getName(), "reply has no text"))
                                : Mono.just(reply)))
                .map(reply -> {
                    ConversationSession updated = sessions.appendTurn(
                            attempt.sessionId, MessageRole.ASSISTANT, reply.getText());
                    remember(attempt, reply.getIntent().getValue(), reply.getConfidence(), reply.getText(),
                            ResponseSource.PRIMARY);
                    return InferenceResponse.builder()
                            .sessionId(attempt.sessionId)
                            .intent(reply.getIntent().getValue())
                            .confidence(reply.getConfidence())
                            .responseText(reply.getText())
                            .source(ResponseSource.PRIMARY)
                            .cached(false)
                            .turn(updated.getTurnCount())
                            .build();
                })
                .onErrorResume(e -> {
                    attempt.failed("primary", e);
                    return Mono.empty();
                });
    }

    /**
     * Completes empty when the secondary path was skipped or failed; the reason is recorded.
     */
    private Mono<InferenceResponse> attemptSecondary(Attempt attempt) {
        if (!keywordBackend.isEnabled()) {
            attempt.reasons.add("secondary not configured");
            return Mono.empty();
        }
        CircuitBreaker breaker = breakers.get(CircuitBreakerRegistry.SECONDARY);
        if (!breaker.allowsRequests()) {
            attempt.reasons.add("secondary circuit open");
            return Mono.empty();
        }

        InferenceRequest request = attempt.request;
        KeywordInferRequest keywordRequest = KeywordInferRequest.builder()
                .text(request.getText())
                .persona(request.getPersona())
                .language(request.getLanguage())
                .build();

        return healthCache.ensureReady()
                .flatMap(ready -> {
                    if (!ready) {
                        attempt.reasons.add("compute backend not ready");
                        return Mono.<InferenceResponse>empty();
                    }
                    return breaker.<KeywordInferResponse>execute(() -> keywordBackend.infer(keywordRequest))
                            .map(result -> answerFromSecondary(attempt, result));
                })
                .onErrorResume(e -> {
                    attempt.failed("secondary", e);
                    return Mono.empty();
                });
    }

    private InferenceResponse answerFromSecondary(Attempt attempt, KeywordInferResponse result) {
        if (!attempt.userTurnRecorded) {
            sessions.appendTurn(attempt.sessionId, MessageRole.USER, attempt.request.getText());
            attempt.userTurnRecorded = true;
        }
        ConversationSession updated = sessions.appendTurn(
                attempt.sessionId, MessageRole.ASSISTANT, result.getResponseText());

        String intent = IntentCategory.fromLabel(result.getIntent()).getValue();
        Double reported = result.getConfidence();
        double confidence = reported != null && !reported.isNaN()
                ? Math.max(0.0, Math.min(1.0, reported))
                : SECONDARY_DEFAULT_CONFIDENCE;
        remember(attempt, intent, confidence, result.getResponseText(), ResponseSource.SECONDARY);

        return InferenceResponse.builder()
                .sessionId(attempt.sessionId)
                .intent(intent)
                .confidence(confidence)
                .responseText(result.getResponseText())
                .source(ResponseSource.SECONDARY)
                .cached(false)
                .turn(updated.getTurnCount())
                .build();
    }

    private void remember(Attempt attempt, String intent, double confidence, String text, ResponseSource provenance) {
        cache.put(attempt.cacheKey, CachedInference.builder()
                .intent(intent)
                .confidence(confidence)
                .responseText(text)
                .provenance(provenance)
                .build());
    }

    private InferenceResponse mock(Attempt attempt) {
        MockInferenceResponder.MockReply reply = mockResponder.respond(
                attempt.request.getText(), attempt.request.getLanguage());
        return InferenceResponse.builder()
                .sessionId(attempt.sessionId)
                .intent(reply.getIntent().getValue())
                .confidence(reply.getConfidence())
                .responseText(reply.getText())
                .source(ResponseSource.MOCK)
                .cached(false)
                .build();
    }

    private InferenceResponse degraded(Attempt attempt, String reason) {
        log.warn("All inference paths exhausted for session {}: {}", attempt.sessionId, reason);

        BackendStatus computeStatus = healthCache.getLastSnapshot()
                .map(BackendHealthSnapshot::getStatus)
                .orElse(BackendStatus.UNKNOWN);

        return InferenceResponse.builder()
                .sessionId(attempt.sessionId)
                .intent(IntentCategory.ESCALATION.getValue())
                .confidence(0.0)
                .responseText(LocalizedResponses.degraded(attempt.request.getLanguage()))
                .source(ResponseSource.FALLBACK)
                .cached(false)
                .diagnostics(DegradationDiagnostics.builder()
                        .reason(reason)
                        .breakers(breakers.statistics())
                        .computeStatus(computeStatus)
                        .build())
                .build();
    }

    private static String resolveSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return "anon-" + UUID.randomUUID();
        }
        return sessionId;
    }

    /**
     * Per-request state carried through the fallback chain.
     */
    private static final class Attempt {
        private final InferenceRequest request;
        private final String sessionId;
        private final String cacheKey;
        private final List<String> reasons = new ArrayList<>();
        private boolean userTurnRecorded;

        private Attempt(InferenceRequest request, String sessionId) {
            this.request = request;
            this.sessionId = sessionId;
            this.cacheKey = ResponseCacheKeys.build(request.getText(), request.getPersona(), request.getLanguage());
        }

        private void failed(String path, Throwable error) {
            if (error instanceof CircuitOpenException) {
                reasons.add(path + " circuit open");
            } else {
                reasons.add(path + " failed: " + error.getMessage());
            }
            log.debug("{} path gave up: {}", path, error.getMessage());
        }
    }
}
