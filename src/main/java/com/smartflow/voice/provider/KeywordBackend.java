package com.smartflow.voice.provider;

import com.smartflow.voice.model.KeywordInferRequest;
import com.smartflow.voice.model.KeywordInferResponse;
import reactor.core.publisher.Mono;

/**
 * Secondary inference backend: a keyword/intent model on the compute backend.
 */
public interface KeywordBackend {

    String getName();

    boolean isEnabled();

    Mono<KeywordInferResponse> infer(KeywordInferRequest request);
}
