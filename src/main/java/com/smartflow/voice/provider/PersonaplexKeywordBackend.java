package com.smartflow.voice.provider;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.model.KeywordInferRequest;
import com.smartflow.voice.model.KeywordInferResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Personaplex {@code POST /infer}, authenticated with an optional {@code X-API-Key} header.
 */
@Slf4j
@Component
public class PersonaplexKeywordBackend extends AbstractBackendClient implements KeywordBackend {

    static final String API_KEY_HEADER = "X-API-Key";

    private final SmartflowProperties.SecondaryConfig config;

    public PersonaplexKeywordBackend(WebClient webClient, SmartflowProperties properties) {
        super(webClient);
        this.config = properties.getSecondary();
    }

    @Override
    public String getName() {
        return "personaplex";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && !isBlank(config.getBaseUrl());
    }

    @Override
    public Mono<KeywordInferResponse> infer(KeywordInferRequest request) {
        Mono<KeywordInferResponse> call = webClient.post()
                .uri(config.getBaseUrl() + "/infer")
                .headers(headers -> {
                    if (!isBlank(config.getApiKey())) {
                        headers.set(API_KEY_HEADER, config.getApiKey());
                    }
                })
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(KeywordInferResponse.class)
                .filter(response -> !isBlank(response.getResponseText()))
                .switchIfEmpty(Mono.error(() -> new BackendCallException(getName(), "Personaplex returned no response text")));

        return withDeadline(call, config.getTimeout());
    }
}
