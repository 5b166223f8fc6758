package com.linguabot.service.api;

import com.linguabot.corpus.RuleBook;
import com.linguabot.model.ComposedReply;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.Correction;
import com.linguabot.model.MatchResult;

import java.util.List;

/**
 * Turns a match result and its corrections into the tutor's natural-language reply.
 */
public interface ResponseComposer {

    /**
     * Composes the reply for one turn.
     * <ul>
     *   <li>Corrections, when present, lead the reply.</li>
     *   <li>A match is explained through the rule book's template for the intent, followed by the
     *       entry's cultural note and a follow-up prompt.</li>
     *   <li>A no-match yields a clarification prompt that rotates between turns.</li>
     * </ul>
     * Corpus-internal identifiers never appear in the text.
     *
     * @param result      The match result.
     * @param corrections Grammar issues found in the utterance.
     * @param context     The learner's context after the turn was recorded.
     * @param rules       The rule book of the current snapshot.
     * @return The composed reply; never {@code null}.
     */
    ComposedReply compose(MatchResult result, List<Correction> corrections, ConversationContext context,
                          RuleBook rules);
}
