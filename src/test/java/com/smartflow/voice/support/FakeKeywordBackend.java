package com.smartflow.voice.support;

import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.model.KeywordInferRequest;
import com.smartflow.voice.model.KeywordInferResponse;
import com.smartflow.voice.provider.KeywordBackend;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicInteger;

public class FakeKeywordBackend implements KeywordBackend {

    private volatile boolean enabled = true;
    private volatile boolean fails;
    private volatile KeywordInferResponse response = KeywordInferResponse.builder()
            .intent("info")
            .confidence(0.8)
            .responseText("Size yardımcı olabilirim.")
            .build();

    public final AtomicInteger calls = new AtomicInteger();

    public FakeKeywordBackend disabled() {
        this.enabled = false;
        return this;
    }

    public FakeKeywordBackend respond(KeywordInferResponse response) {
        this.response = response;
        this.fails = false;
        return this;
    }

    public FakeKeywordBackend failing() {
        this.fails = true;
        return this;
    }

    @Override
    public String getName() {
        return "fake-keyword";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<KeywordInferResponse> infer(KeywordInferRequest request) {
        return Mono.defer(() -> {
            calls.incrementAndGet();
            if (fails) {
                return Mono.error(new BackendCallException(getName(), "fake-keyword returned HTTP 503"));
            }
            return Mono.just(response);
        });
    }
}
