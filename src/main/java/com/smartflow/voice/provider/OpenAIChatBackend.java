package com.smartflow.voice.provider;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.model.ChatCompletionRequest;
import com.smartflow.voice.model.ChatCompletionResponse;
import com.smartflow.voice.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * OpenAI chat completion backend (gpt-4o-mini by default).
 */
@Slf4j
@Component
public class OpenAIChatBackend extends AbstractBackendClient implements ChatBackend {

    private final SmartflowProperties.PrimaryConfig config;

    public OpenAIChatBackend(WebClient webClient, SmartflowProperties properties) {
        super(webClient);
        this.config = properties.getPrimary();
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && !isBlank(config.getApiKey());
    }

    @Override
    public Mono<String> complete(List<ChatMessage> messages) {
        if (!isEnabled()) {
            return Mono.error(new BackendCallException(getName(), "OpenAI backend is not enabled"));
        }

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(config.getModel())
                .messages(messages)
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .build();

        log.debug("Forwarding {} messages to OpenAI: model={}", messages.size(), request.getModel());

        Mono<String> call = webClient.post()
                .uri(config.getBaseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .flatMap(response -> {
                    String content = response.firstContent();
                    if (isBlank(content)) {
                        return Mono.error(new BackendCallException(getName(), "OpenAI returned no content"));
                    }
                    return Mono.just(content);
                })
                .switchIfEmpty(Mono.error(() -> new BackendCallException(getName(), "OpenAI returned an empty body")));

        return withDeadline(call, config.getTimeout());
    }
}
