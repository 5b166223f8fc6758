package com.linguabot.model;

import java.util.Locale;

/**
 * Target languages supported by the tutor.
 */
public enum Language {
    KOREAN("ko"),
    JAPANESE("ja");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Resolves a user-supplied language name or ISO code (e.g. "korean", "ko", "ja").
     *
     * @param value The raw value typed by the user.
     * @return The matching language.
     * @throws IllegalArgumentException if the value names no supported language.
     */
    public static Language fromUserInput(String value) {
        if (value != null) {
            var key = value.trim().toLowerCase(Locale.ROOT);
            for (Language language : values()) {
                if (language.code.equals(key) || language.name().toLowerCase(Locale.ROOT).equals(key)) {
                    return language;
                }
            }
        }
        throw new IllegalArgumentException("Language '" + value + "' is not supported. Use 'korean' or 'japanese'.");
    }
}
