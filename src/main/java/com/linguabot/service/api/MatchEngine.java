package com.linguabot.service.api;

import com.linguabot.corpus.ContentSnapshot;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.Language;
import com.linguabot.model.Level;
import com.linguabot.model.MatchResult;

/**
 * Maps free-text learner input onto the vocabulary corpus and classifies its intent.
 * <p>
 * Matching is corpus- and rule-driven and fully deterministic: the same text, snapshot, context
 * and level always produce the same result.
 * </p>
 */
public interface MatchEngine {

    /**
     * Finds the corpus entry that best explains the learner's utterance.
     * <p>
     * Candidates are scored by how much of the input they cover, how close their tier is to the
     * learner's level and whether they continue the recent conversation. Ties go to the easier tier,
     * then to the earlier corpus entry. Below the configured minimum score the result is a no-match.
     * </p>
     * <p>
     * Side effect: the turn is recorded on {@code context} (intent appended, turn count incremented,
     * last matched entry updated on a match).
     * </p>
     *
     * @param text     The raw learner text.
     * @param language The language the learner is practising.
     * @param context  The learner's conversation context; mutated.
     * @param level    The learner's current level, used for tier proximity.
     * @param snapshot The content snapshot to match against.
     * @return The match result; never {@code null}.
     */
    MatchResult match(String text, Language language, ConversationContext context, Level level,
                      ContentSnapshot snapshot);
}
