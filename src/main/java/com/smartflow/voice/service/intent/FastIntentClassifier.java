package com.smartflow.voice.service.intent;

import com.smartflow.voice.model.Language;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic keyword classifier that runs before any model is consulted.
 *
 * <p>Each rule scores 3 per matched phrase (whole-word match) and 2 per word starting with one
 * of its stems. The best-scoring rule wins; on a tie the earlier rule is kept, so the broad
 * {@code info} rule comes last.</p>
 */
@Component
public class FastIntentClassifier {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final Map<Language, List<KeywordRule>> rules = new EnumMap<>(Language.class);

    public FastIntentClassifier() {
        rules.put(Language.TR, List.of(
                rule(Language.TR, IntentCategory.APPOINTMENT,
                        List.of("randev", "rezerv", "görüşm"),
                        List.of("randevu almak", "randevu istiyorum", "görüşme ayarla", "ne zaman müsait", "saat kaçta")),
                rule(Language.TR, IntentCategory.COMPLAINT,
                        List.of("şikay", "problem", "sorun", "arıza", "bozul", "çalışm", "memnun"),
                        List.of("şikayet etmek", "sorun yaşıyorum", "problem var", "çalışmıyor",
                                "memnun değilim", "arıza var", "bozuldu", "düzeltilmedi")),
                rule(Language.TR, IntentCategory.PRICING,
                        List.of("fiyat", "ücret", "maliyet", "tarife", "paket", "kampanya", "indirim", "teklif"),
                        List.of("ne kadar", "fiyatı nedir", "ücret ne", "kaç lira", "kaç tl", "teklif ver")),
                rule(Language.TR, IntentCategory.CANCELLATION,
                        List.of("iptal", "vazgeç", "sonlandır", "bitir", "kapat"),
                        List.of("iptal etmek istiyorum", "vazgeçtim", "sonlandırmak istiyorum", "aboneliği iptal")),
                rule(Language.TR, IntentCategory.GREETING,
                        List.of(),
                        List.of("merhaba", "selam", "iyi günler", "günaydın", "iyi akşamlar",
                                "hayırlı günler", "nasılsınız", "nasılsın")),
                rule(Language.TR, IntentCategory.FAREWELL,
                        List.of(),
                        List.of("hoşça kal", "güle güle", "görüşürüz", "iyi günler",
                                "iyi akşamlar", "teşekkürler görüşürüz", "kapatabiliriz")),
                rule(Language.TR, IntentCategory.ESCALATION,
                        List.of("yönetici", "müdür", "amir", "yetkili"),
                        List.of("yöneticiyle görüşmek", "müdürle konuşmak", "yetkili birini",
                                "üst birime", "gerçek birisi", "insanla konuşmak")),
                rule(Language.TR, IntentCategory.THANKS,
                        List.of("teşekkür", "sağol"),
                        List.of("teşekkür ederim", "sağ olun", "çok teşekkürler", "teşekkürler")),
                rule(Language.TR, IntentCategory.INFO,
                        List.of("bilgi", "öğren", "soru", "merak"),
                        List.of("bilgi almak", "öğrenmek istiyorum", "sorum var", "nasıl yapılır", "ne yapmalıyım"))
        ));

        rules.put(Language.EN, List.of(
                rule(Language.EN, IntentCategory.APPOINTMENT,
                        List.of("appoint", "book", "reserv", "schedul", "meet"),
                        List.of("book an appointment", "schedule a meeting", "when are you available")),
                rule(Language.EN, IntentCategory.COMPLAINT,
                        List.of("complain", "problem", "issue", "broken", "fault", "dissatisf"),
                        List.of("file a complaint", "not working", "having issues", "not satisfied")),
                rule(Language.EN, IntentCategory.PRICING,
                        List.of("price", "cost", "rate", "fee", "discount", "offer"),
                        List.of("how much", "what is the price", "pricing info")),
                rule(Language.EN, IntentCategory.CANCELLATION,
                        List.of("cancel", "terminat", "end", "stop"),
                        List.of("cancel my", "want to cancel", "terminate my")),
                rule(Language.EN, IntentCategory.GREETING,
                        List.of(),
                        List.of("hello", "hi", "good morning", "good afternoon", "good evening", "hey")),
                rule(Language.EN, IntentCategory.FAREWELL,
                        List.of(),
                        List.of("goodbye", "bye", "see you", "thank you goodbye", "have a nice day")),
                rule(Language.EN, IntentCategory.ESCALATION,
                        List.of("manager", "supervis", "escalat"),
                        List.of("speak to a manager", "talk to someone", "real person", "human agent")),
                rule(Language.EN, IntentCategory.THANKS,
                        List.of("thank"),
                        List.of("thank you", "thanks", "appreciate it")),
                rule(Language.EN, IntentCategory.INFO,
                        List.of("info", "learn", "question", "wonder", "know"),
                        List.of("i want to know", "can you tell me", "information about"))
        ));
    }

    /**
     * Classify an utterance with the rules of its language. Pure and allocation-light.
     */
    public IntentResult classify(String text, Language language) {
        if (text == null || text.isBlank()) {
            return IntentResult.unknown(language);
        }

        String normalized = text.trim().toLowerCase(language.getLocale());
        String[] words = NON_WORD.split(normalized);

        IntentResult best = IntentResult.unknown(language);
        int bestScore = 0;

        for (KeywordRule rule : rules.get(language)) {
            Set<String> matched = new LinkedHashSet<>();
            int score = 0;

            for (int i = 0; i < rule.phrases.size(); i++) {
                if (rule.phrasePatterns.get(i).matcher(normalized).find()) {
                    matched.add(rule.phrases.get(i));
                    score += 3;
                }
            }
            for (String word : words) {
                for (String stem : rule.stems) {
                    if (!word.isEmpty() && word.startsWith(stem)) {
                        matched.add(word);
                        score += 2;
                    }
                }
            }

            if (score > bestScore) {
                bestScore = score;
                best = IntentResult.builder()
                        .intent(rule.intent)
                        .level(ConfidenceLevel.fromMatchScore(score))
                        .detectedKeywords(List.copyOf(matched))
                        .language(language)
                        .build();
            }
        }
        return best;
    }

    /**
     * Whether the result may bypass every backend with a canned reply.
     */
    public boolean isShortcut(IntentResult result, double confidenceThreshold) {
        return result.getIntent().isShortcuttable() && result.getConfidence() >= confidenceThreshold;
    }

    private static KeywordRule rule(Language language, IntentCategory intent, List<String> stems, List<String> phrases) {
        List<String> lowerPhrases = new ArrayList<>(phrases.size());
        List<Pattern> patterns = new ArrayList<>(phrases.size());
        for (String phrase : phrases) {
            String lower = phrase.toLowerCase(language.getLocale());
            lowerPhrases.add(lower);
            patterns.add(Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(lower) + "(?![\\p{L}\\p{N}])"));
        }
        return new KeywordRule(intent, List.copyOf(stems), List.copyOf(lowerPhrases), List.copyOf(patterns));
    }

    private static final class KeywordRule {
        private final IntentCategory intent;
        private final List<String> stems;
        private final List<String> phrases;
        private final List<Pattern> phrasePatterns;

        private KeywordRule(IntentCategory intent, List<String> stems, List<String> phrases, List<Pattern> phrasePatterns) {
            this.intent = intent;
            this.stems = stems;
            this.phrases = phrases;
            this.phrasePatterns = phrasePatterns;
        }
    }
}
