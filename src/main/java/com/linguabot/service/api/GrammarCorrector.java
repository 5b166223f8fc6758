package com.linguabot.service.api;

import com.linguabot.corpus.RuleBook;
import com.linguabot.model.Correction;
import com.linguabot.model.Language;
import com.linguabot.model.VocabularyEntry;

import java.util.List;

/**
 * Rule-based grammar checker for learner utterances.
 */
public interface GrammarCorrector {

    /**
     * Runs the rule book's grammar rules for the language and the matched entry's part of speech.
     * <p>
     * Never throws for malformed input: unparseable text yields an empty list, and a rule that fails
     * is skipped.
     * </p>
     *
     * @param text         The raw learner text.
     * @param matchedEntry The matched entry, or {@code null} when nothing matched.
     * @param language     The learner's language.
     * @param rules        The rule book of the current snapshot.
     * @return Issues ordered by position; empty when none were found.
     */
    List<Correction> check(String text, VocabularyEntry matchedEntry, Language language, RuleBook rules);
}
