package com.smartflow.voice.provider;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.exception.BackendCallException;
import com.smartflow.voice.exception.BackendTimeoutException;
import com.smartflow.voice.model.ChatMessage;
import com.smartflow.voice.model.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAIChatBackendTest {

    private static final List<ChatMessage> MESSAGES = List.of(
            ChatMessage.of(MessageRole.SYSTEM, "You are a receptionist."),
            ChatMessage.of(MessageRole.USER, "Randevu almak istiyorum"));

    private SmartflowProperties properties;
    private StubExchange exchange;

    @BeforeEach
    void setUp() {
        properties = new SmartflowProperties();
        properties.getPrimary().setApiKey("sk-test");
        properties.getPrimary().setBaseUrl("http://openai.test/v1");
        exchange = new StubExchange();
    }

    private OpenAIChatBackend backend() {
        return new OpenAIChatBackend(exchange.webClient(), properties);
    }

    @Test
    void testReturnsFirstChoiceContent() {
        exchange.respond(HttpStatus.OK, "{\"id\":\"c1\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"Tabii. [INTENT:appointment CONFIDENCE:0.9]\"},"
                + "\"finish_reason\":\"stop\"}]}");

        String content = backend().complete(MESSAGES).block();

        assertEquals("Tabii. [INTENT:appointment CONFIDENCE:0.9]", content);
        assertEquals(HttpMethod.POST, exchange.lastRequest().method());
        assertEquals("http://openai.test/v1/chat/completions", exchange.lastRequest().url().toString());
        assertEquals("Bearer sk-test", exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testEmptyChoicesFail() {
        exchange.respond(HttpStatus.OK, "{\"id\":\"c1\",\"choices\":[]}");

        BackendCallException error = assertThrows(BackendCallException.class,
                () -> backend().complete(MESSAGES).block());
        assertEquals("openai", error.getBackend());
    }

    @Test
    void testHttpErrorIsNormalized() {
        exchange.respond(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":{\"message\":\"rate limited\"}}");

        BackendCallException error = assertThrows(BackendCallException.class,
                () -> backend().complete(MESSAGES).block());
        assertEquals("openai returned HTTP 429", error.getMessage());
    }

    @Test
    void testSlowResponseTimesOut() {
        properties.getPrimary().setTimeout(Duration.ofMillis(50));
        exchange.respond(HttpStatus.OK, "{\"choices\":[]}").delay(Duration.ofSeconds(2));

        assertThrows(BackendTimeoutException.class, () -> backend().complete(MESSAGES).block());
    }

    @Test
    void testDisabledWithoutApiKey() {
        properties.getPrimary().setApiKey(" ");

        OpenAIChatBackend backend = backend();

        assertFalse(backend.isEnabled());
        assertThrows(BackendCallException.class, () -> backend.complete(MESSAGES).block());
        assertTrue(exchange.requests().isEmpty());
    }
}
