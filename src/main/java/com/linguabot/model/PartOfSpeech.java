package com.linguabot.model;

public enum PartOfSpeech {
    NOUN,
    PRONOUN,
    VERB,
    ADJECTIVE,
    ADVERB,
    PARTICLE,
    EXPRESSION;

    /**
     * Predicates close a Korean or Japanese clause.
     */
    public boolean isPredicate() {
        return this == VERB || this == ADJECTIVE;
    }
}
