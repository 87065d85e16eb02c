package com.smartflow.voice.service;

import com.smartflow.voice.model.Language;
import com.smartflow.voice.service.intent.IntentCategory;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic canned answers for demo and test deployments running in mock mode.
 * The first keyword contained in the utterance selects the answer.
 */
@Component
public class MockInferenceResponder {

    private final Map<Language, Map<String, MockReply>> replies = new EnumMap<>(Language.class);
    private final Map<Language, MockReply> defaults = new EnumMap<>(Language.class);

    public MockInferenceResponder() {
        Map<String, MockReply> tr = new LinkedHashMap<>();
        tr.put("randevu", reply(IntentCategory.APPOINTMENT, 0.92,
                "Tabii, randevu oluşturabilirim. Hangi gün ve saat uygun olur?"));
        tr.put("şikayet", reply(IntentCategory.COMPLAINT, 0.88,
                "Yaşadığınız sorun için üzgünüm. Detayları alabilir miyim?"));
        tr.put("fiyat", reply(IntentCategory.PRICING, 0.85,
                "Fiyat bilgisi için size yardımcı olabilirim. Hangi ürün veya hizmet ile ilgileniyorsunuz?"));
        tr.put("merhaba", reply(IntentCategory.GREETING, 0.95,
                "Merhaba! SmartFlow'a hoş geldiniz. Size nasıl yardımcı olabilirim?"));
        tr.put("teşekkür", reply(IntentCategory.THANKS, 0.90,
                "Rica ederim! Başka bir konuda yardımcı olabilir miyim?"));
        replies.put(Language.TR, tr);
        defaults.put(Language.TR, reply(IntentCategory.UNKNOWN, 0.60,
                "Anladım. Bu konuda size nasıl yardımcı olabilirim?"));

        Map<String, MockReply> en = new LinkedHashMap<>();
        en.put("appointment", reply(IntentCategory.APPOINTMENT, 0.92,
                "Sure, I can book an appointment. Which day and time suit you?"));
        en.put("complain", reply(IntentCategory.COMPLAINT, 0.88,
                "I'm sorry about the trouble. Could you give me the details?"));
        en.put("price", reply(IntentCategory.PRICING, 0.85,
                "I can help with pricing. Which product or service are you interested in?"));
        en.put("hello", reply(IntentCategory.GREETING, 0.95,
                "Hello! Welcome to SmartFlow. How can I help you?"));
        en.put("thank", reply(IntentCategory.THANKS, 0.90,
                "You're welcome! Is there anything else I can help you with?"));
        replies.put(Language.EN, en);
        defaults.put(Language.EN, reply(IntentCategory.UNKNOWN, 0.60,
                "I see. How can I help you with that?"));
    }

    public MockReply respond(String text, Language language) {
        String lower = text == null ? "" : text.toLowerCase(language.getLocale());
        for (Map.Entry<String, MockReply> entry : replies.get(language).entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return defaults.get(language);
    }

    private static MockReply reply(IntentCategory intent, double confidence, String text) {
        return MockReply.builder()
                .intent(intent)
                .confidence(confidence)
                .text(text)
                .build();
    }

    @Value
    @Builder
    public static class MockReply {
        IntentCategory intent;
        double confidence;
        String text;
    }
}
