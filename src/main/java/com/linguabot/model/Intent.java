package com.linguabot.model;

/**
 * Coarse classification of a learner utterance.
 */
public enum Intent {

    // "안녕하세요", "こんにちは", "hi"
    GREETING,

    // Anything ending in a question marker or asking for a meaning.
    QUESTION,

    // Default when no rule fires.
    STATEMENT,

    // The learner explicitly asks the tutor to check or fix a sentence.
    CORRECTION_REQUEST
}
