package com.linguabot.model;

import java.util.Optional;

/**
 * Outcome of matching a learner utterance against the corpus.
 * <p>
 * A result without an entry is the "no match" outcome. It is not an error: it routes the turn
 * to a clarification prompt instead of a guessed reply.
 * </p>
 *
 * @param intent The classified intent of the utterance.
 * @param entry  The best-scoring entry, or {@code null} for no match.
 * @param score  The winning score, 0 for no match.
 */
public record MatchResult(Intent intent, VocabularyEntry entry, double score) {

    public static MatchResult noMatch(Intent intent) {
        return new MatchResult(intent, null, 0.0);
    }

    public boolean matched() {
        return entry != null;
    }

    public Optional<VocabularyEntry> bestEntry() {
        return Optional.ofNullable(entry);
    }
}
