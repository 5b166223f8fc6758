package com.linguabot.model;

/**
 * Proficiency exam formats. Each exam draws its questions from one language of the corpus.
 */
public enum ExamType {
    TOPIK(Language.KOREAN),
    JLPT(Language.JAPANESE);

    private final Language language;

    ExamType(Language language) {
        this.language = language;
    }

    public Language language() {
        return language;
    }

    public static ExamType forLanguage(Language language) {
        return language == Language.KOREAN ? TOPIK : JLPT;
    }

    public static ExamType fromUserInput(String value) {
        if (value != null) {
            for (ExamType type : values()) {
                if (type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Exam type '" + value + "' is not supported. Use 'topik' or 'jlpt'.");
    }
}
