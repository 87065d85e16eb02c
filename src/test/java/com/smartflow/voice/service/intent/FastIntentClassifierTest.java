package com.smartflow.voice.service.intent;

import com.smartflow.voice.model.Language;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FastIntentClassifierTest {

    private final FastIntentClassifier classifier = new FastIntentClassifier();

    @Test
    void testTurkishGreeting() {
        IntentResult result = classifier.classify("Merhaba", Language.TR);

        assertEquals(IntentCategory.GREETING, result.getIntent());
        assertEquals(ConfidenceLevel.HIGH, result.getLevel());
        assertEquals(0.95, result.getConfidence());
        assertTrue(result.getDetectedKeywords().contains("merhaba"));
    }

    @Test
    void testStrongerRuleBeatsGreeting() {
        IntentResult result = classifier.classify("Merhaba, randevu almak istiyorum", Language.TR);

        assertEquals(IntentCategory.APPOINTMENT, result.getIntent());
        assertEquals(ConfidenceLevel.HIGH, result.getLevel());
    }

    @Test
    void testTieKeepsEarlierRule() {
        // "iyi günler" is both a greeting and a farewell phrase
        IntentResult result = classifier.classify("iyi günler", Language.TR);

        assertEquals(IntentCategory.GREETING, result.getIntent());
    }

    @Test
    void testTurkishThanks() {
        IntentResult result = classifier.classify("Teşekkürler", Language.TR);

        assertEquals(IntentCategory.THANKS, result.getIntent());
        assertEquals(ConfidenceLevel.HIGH, result.getLevel());
    }

    @Test
    void testEnglishRules() {
        assertEquals(IntentCategory.GREETING, classifier.classify("Hello", Language.EN).getIntent());
        assertEquals(IntentCategory.APPOINTMENT,
                classifier.classify("hi there, I want to book an appointment", Language.EN).getIntent());
    }

    @Test
    void testPhraseNeedsWholeWords() {
        IntentResult result = classifier.classify("this is great", Language.EN);

        assertEquals(IntentCategory.UNKNOWN, result.getIntent());
        assertEquals(ConfidenceLevel.LOW, result.getLevel());
    }

    @Test
    void testStemOnlyMatchIsMedium() {
        IntentResult result = classifier.classify("my screen is broken", Language.EN);

        assertEquals(IntentCategory.COMPLAINT, result.getIntent());
        assertEquals(ConfidenceLevel.MEDIUM, result.getLevel());
        assertEquals(0.75, result.getConfidence());
    }

    @Test
    void testRulesFollowRequestLanguage() {
        assertEquals(IntentCategory.UNKNOWN, classifier.classify("merhaba", Language.EN).getIntent());
    }

    @Test
    void testBlankInputIsUnknown() {
        IntentResult result = classifier.classify("   ", Language.TR);

        assertEquals(IntentCategory.UNKNOWN, result.getIntent());
        assertEquals(0.0, result.getConfidence());
        assertTrue(result.getDetectedKeywords().isEmpty());
    }

    @Test
    void testShortcutNeedsShortcuttableIntentAndThreshold() {
        IntentResult greeting = classifier.classify("Merhaba", Language.TR);
        IntentResult complaint = classifier.classify("şikayet etmek istiyorum", Language.TR);

        assertTrue(classifier.isShortcut(greeting, 0.9));
        assertFalse(classifier.isShortcut(greeting, 0.99));
        assertEquals(IntentCategory.COMPLAINT, complaint.getIntent());
        assertFalse(classifier.isShortcut(complaint, 0.5));
    }
}
