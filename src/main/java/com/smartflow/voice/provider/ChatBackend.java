package com.smartflow.voice.provider;

import com.smartflow.voice.model.ChatMessage;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Primary inference backend: a conversational chat-completion model.
 */
public interface ChatBackend {

    String getName();

    /**
     * Whether the backend is configured well enough to be called (enabled, credentials set).
     */
    boolean isEnabled();

    /**
     * Complete the conversation.
     *
     * @param messages full message list, system prompt first
     * @return raw assistant text; errors with {@code BackendCallException} on failure, timeout or
     * empty content
     */
    Mono<String> complete(List<ChatMessage> messages);
}
