package com.smartflow.voice.service.cache;

import com.smartflow.voice.model.Language;
import com.smartflow.voice.model.Persona;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.regex.Pattern;

/**
 * Builds response-cache keys.
 *
 * <p>The key depends only on the normalized text, the persona and the language, so the same
 * utterance from different sessions or at different times maps to the same entry.</p>
 */
public final class ResponseCacheKeys {

    private static final String KEY_PREFIX = "voice:";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ResponseCacheKeys() {
    }

    /**
     * @return {@code voice:} followed by the SHA-256 of {@code language|persona|normalizedText}
     */
    public static String build(String text, Persona persona, Language language) {
        return KEY_PREFIX + DigestUtils.sha256Hex(
                language.getCode() + "|" + persona.getValue() + "|" + normalize(text, language));
    }

    /**
     * Lower-case in the language's locale, trim, and collapse inner whitespace runs.
     */
    public static String normalize(String text, Language language) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ").toLowerCase(language.getLocale());
    }
}
