package com.smartflow.voice.service.session;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.ChatMessage;
import com.smartflow.voice.model.MessageRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded per-caller conversation memory.
 *
 * <p>Each session holds the system prompt plus at most {@code maxHistory} recent messages.
 * Sessions idle longer than the TTL are dead: they are replaced on access and removed by
 * {@link #sweep(Instant, Duration)}. Mutations are atomic per session id.</p>
 */
@Slf4j
@Service
public class SessionStore {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final String systemPrompt;
    private final int maxHistory;
    private final Duration ttl;
    private final Clock clock;

    public SessionStore(SmartflowProperties properties, Clock clock) {
        SmartflowProperties.SessionConfig config = properties.getSession();
        this.systemPrompt = config.getSystemPrompt();
        this.maxHistory = config.getMaxHistory();
        this.ttl = config.getTtl();
        this.clock = clock;
        if (config.getSweepInterval().compareTo(ttl) >= 0) {
            log.warn("Session sweep interval {} is not shorter than session TTL {}; idle sessions will outlive their TTL",
                    config.getSweepInterval(), ttl);
        }
    }

    /**
     * Live session for the id, creating a fresh one (seeded with the system prompt) when
     * absent or dead.
     */
    public ConversationSession getOrCreate(String sessionId) {
        Instant now = clock.instant();
        return sessions.compute(sessionId, (id, existing) -> liveOrNew(id, existing, now));
    }

    /**
     * Append one message, creating the session if needed. User turns advance the turn count.
     *
     * @return snapshot after the append
     */
    public ConversationSession appendTurn(String sessionId, MessageRole role, String content) {
        Instant now = clock.instant();
        return sessions.compute(sessionId, (id, existing) -> {
            ConversationSession session = liveOrNew(id, existing, now);

            List<ChatMessage> messages = new ArrayList<>(session.getMessages());
            messages.add(ChatMessage.of(role, content));
            if (messages.size() > maxHistory + 1) {
                List<ChatMessage> truncated = new ArrayList<>(maxHistory + 1);
                truncated.add(messages.get(0));
                truncated.addAll(messages.subList(messages.size() - maxHistory, messages.size()));
                messages = truncated;
            }

            return session.toBuilder()
                    .messages(List.copyOf(messages))
                    .lastActivityAt(now)
                    .turnCount(role == MessageRole.USER ? session.getTurnCount() + 1 : session.getTurnCount())
                    .build();
        });
    }

    public Optional<ConversationSession> find(String sessionId) {
        ConversationSession session = sessions.get(sessionId);
        if (session == null || isDead(session, clock.instant(), ttl)) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * Explicit session end.
     *
     * @return whether a session was removed
     */
    public boolean end(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.debug("Session ended: {}", sessionId);
        }
        return removed;
    }

    /**
     * Remove every session idle for longer than {@code ttl} at {@code now}.
     *
     * @return number of sessions removed
     */
    public int sweep(Instant now, Duration ttl) {
        AtomicInteger removed = new AtomicInteger();
        for (String sessionId : sessions.keySet()) {
            sessions.computeIfPresent(sessionId, (id, session) -> {
                if (isDead(session, now, ttl)) {
                    removed.incrementAndGet();
                    return null;
                }
                return session;
            });
        }
        return removed.get();
    }

    /**
     * Sweep with the configured TTL at the current time.
     */
    public int sweep() {
        return sweep(clock.instant(), ttl);
    }

    public int size() {
        return sessions.size();
    }

    private ConversationSession liveOrNew(String sessionId, ConversationSession existing, Instant now) {
        if (existing != null && !isDead(existing, now, ttl)) {
            return existing;
        }
        if (existing != null) {
            log.debug("Session {} expired after {} idle, starting over", sessionId,
                    Duration.between(existing.getLastActivityAt(), now));
        }
        return ConversationSession.builder()
                .sessionId(sessionId)
                .messages(List.of(ChatMessage.of(MessageRole.SYSTEM, systemPrompt)))
                .createdAt(now)
                .lastActivityAt(now)
                .turnCount(0)
                .build();
    }

    private static boolean isDead(ConversationSession session, Instant now, Duration ttl) {
        return Duration.between(session.getLastActivityAt(), now).compareTo(ttl) > 0;
    }
}
