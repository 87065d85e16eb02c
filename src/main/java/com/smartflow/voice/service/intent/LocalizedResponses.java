package com.smartflow.voice.service.intent;

import com.smartflow.voice.model.Language;

import java.util.EnumMap;
import java.util.Map;

/**
 * Canned replies: shortcut answers for trivial intents and the degraded-service handoff message.
 */
public final class LocalizedResponses {

    private static final Map<Language, Map<IntentCategory, String>> SHORTCUTS = new EnumMap<>(Language.class);
    private static final Map<Language, String> DEGRADED = new EnumMap<>(Language.class);

    static {
        Map<IntentCategory, String> tr = new EnumMap<>(IntentCategory.class);
        tr.put(IntentCategory.GREETING, "Merhaba! Size nasıl yardımcı olabilirim?");
        tr.put(IntentCategory.FAREWELL, "İyi günler dilerim! Tekrar ihtiyacınız olursa bizi arayabilirsiniz.");
        tr.put(IntentCategory.THANKS, "Rica ederim! Başka bir konuda yardımcı olabilir miyim?");
        tr.put(IntentCategory.ESCALATION, "Sizi hemen yetkili bir temsilciye bağlıyorum. Lütfen hatta kalın.");
        SHORTCUTS.put(Language.TR, tr);

        Map<IntentCategory, String> en = new EnumMap<>(IntentCategory.class);
        en.put(IntentCategory.GREETING, "Hello! How can I help you today?");
        en.put(IntentCategory.FAREWELL, "Have a great day! Feel free to call us again anytime.");
        en.put(IntentCategory.THANKS, "You're welcome! Is there anything else I can help you with?");
        en.put(IntentCategory.ESCALATION, "Let me connect you with a supervisor right away. Please hold.");
        SHORTCUTS.put(Language.EN, en);

        DEGRADED.put(Language.TR, "Şu anda teknik bir sorun yaşıyoruz, özür dileriz. "
                + "Sizi hemen bir müşteri temsilcisine aktarıyorum.");
        DEGRADED.put(Language.EN, "We're sorry, we are experiencing a technical difficulty right now. "
                + "Let me transfer you to a member of our team.");
    }

    private LocalizedResponses() {
    }

    /**
     * @throws IllegalArgumentException for an intent that has no canned reply
     */
    public static String shortcut(IntentCategory intent, Language language) {
        String reply = SHORTCUTS.get(language).get(intent);
        if (reply == null) {
            throw new IllegalArgumentException("No shortcut reply for intent: " + intent.getValue());
        }
        return reply;
    }

    public static String degraded(Language language) {
        return DEGRADED.get(language);
    }
}
