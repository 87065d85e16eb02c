package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a conversation, both in session memory and on the chat-completion wire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatMessage {

    @JsonProperty("role")
    private MessageRole role;

    @JsonProperty("content")
    private String content;

    public static ChatMessage of(MessageRole role, String content) {
        return new ChatMessage(role, content);
    }
}
