package com.smartflow.voice.service.intent;

import com.smartflow.voice.model.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocalizedResponsesTest {

    @Test
    void testShortcutRepliesExistForEveryShortcuttableIntent() {
        for (IntentCategory intent : IntentCategory.values()) {
            if (!intent.isShortcuttable()) {
                continue;
            }
            for (Language language : Language.values()) {
                assertFalse(LocalizedResponses.shortcut(intent, language).isBlank());
            }
        }
    }

    @Test
    void testNoShortcutForRegularIntent() {
        assertThrows(IllegalArgumentException.class,
                () -> LocalizedResponses.shortcut(IntentCategory.APPOINTMENT, Language.TR));
    }

    @Test
    void testDegradedReplyIsLocalized() {
        assertTrue(LocalizedResponses.degraded(Language.TR).startsWith("Şu anda teknik bir sorun"));
        assertTrue(LocalizedResponses.degraded(Language.EN).startsWith("We're sorry"));
    }

    @Test
    void testLabelLookup() {
        assertEquals(IntentCategory.INFO, IntentCategory.fromLabel("info_request"));
        assertEquals(IntentCategory.CANCELLATION, IntentCategory.fromLabel(" Cancellation "));
        assertEquals(IntentCategory.UNKNOWN, IntentCategory.fromLabel("weather"));
        assertEquals(IntentCategory.UNKNOWN, IntentCategory.fromLabel(null));
    }
}
