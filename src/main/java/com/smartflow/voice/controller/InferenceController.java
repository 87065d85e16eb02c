package com.smartflow.voice.controller;

import com.smartflow.voice.model.InferenceRequest;
import com.smartflow.voice.model.InferenceResponse;
import com.smartflow.voice.service.InferenceOrchestrator;
import com.smartflow.voice.service.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Voice inference API used by the telephony and chat transports.
 */
@Slf4j
@RestController
@RequestMapping("/v1/voice")
public class InferenceController {

    private final InferenceOrchestrator orchestrator;
    private final SessionStore sessionStore;

    public InferenceController(InferenceOrchestrator orchestrator, SessionStore sessionStore) {
        this.orchestrator = orchestrator;
        this.sessionStore = sessionStore;
    }

    /**
     * Answer one utterance. Backend outages never change the status code; only invalid
     * input is rejected (400).
     */
    @PostMapping(value = "/infer",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<InferenceResponse> infer(@RequestBody InferenceRequest request) {
        log.debug("Received inference request: session={}, language={}, persona={}",
                request.getSessionId(), request.getLanguage(), request.getPersona());
        return orchestrator.infer(request);
    }

    /**
     * End a conversation explicitly.
     *
     * @return 204 when a session was removed, 404 otherwise
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
        if (sessionStore.end(sessionId)) {
            log.info("Session ended by caller: {}", sessionId);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }
}
