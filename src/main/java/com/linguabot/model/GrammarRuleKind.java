package com.linguabot.model;

/**
 * The structural check a {@link GrammarRule} performs.
 */
public enum GrammarRuleKind {

    /** Regular expression over the raw text; the suggestion may reference groups ($1). */
    PATTERN,

    /** Korean particle allomorph must agree with the final consonant of the preceding word. */
    PARTICLE_AGREEMENT,

    /** A Korean noun in a multi-word sentence must carry a particle. */
    PARTICLE_REQUIRED,

    /** Predicates close the clause (subject-object-verb order). */
    VERB_FINAL
}
