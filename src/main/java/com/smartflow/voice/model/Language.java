package com.smartflow.voice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Language {
    TR("tr", Locale.forLanguageTag("tr")),
    EN("en", Locale.ENGLISH);

    private final String code;
    private final Locale locale;

    Language(String code, Locale locale) {
        this.code = code;
        this.locale = locale;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Locale used for case folding of this language's text (Turkish dotted/dotless i).
     */
    public Locale getLocale() {
        return locale;
    }

    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null) {
            return TR;
        }
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(code.trim())) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + code);
    }
}
