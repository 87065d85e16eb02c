package com.smartflow.voice.service.session;

import com.smartflow.voice.model.ChatMessage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one caller's conversation. The first message is always the system prompt.
 */
@Value
@Builder(toBuilder = true)
public class ConversationSession {

    String sessionId;
    List<ChatMessage> messages;
    Instant createdAt;
    Instant lastActivityAt;
    int turnCount;
}
