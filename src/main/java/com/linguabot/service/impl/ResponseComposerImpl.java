package com.linguabot.service.impl;

import com.linguabot.corpus.RuleBook;
import com.linguabot.model.ComposedReply;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.Correction;
import com.linguabot.model.Intent;
import com.linguabot.model.MatchResult;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.ResponseComposer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Template-based {@link ResponseComposer}. Only learner-facing entry fields are substituted into
 * templates, so corpus ids cannot leak into replies.
 */
@Service
public class ResponseComposerImpl implements ResponseComposer {

    private static final String NO_EXAMPLE_FOLLOW_UP = "Can you use it in a sentence of your own?";

    @Override
    public ComposedReply compose(MatchResult result, List<Correction> corrections, ConversationContext context,
                                 RuleBook rules) {
        var safeCorrections = corrections == null ? List.<Correction>of() : corrections;
        var lines = new StringJoiner("\n");
        if (!safeCorrections.isEmpty()) {
            lines.add(correctionBlock(safeCorrections));
        }

        if (result.matched()) {
            var entry = result.entry();
            lines.add(fill(rules.replyTemplate(result.intent()), entry));
            entry.culturalNoteText().ifPresent(note -> lines.add("Culture note: " + note));
            lines.add(entry.firstExample()
                    .map(example -> "Try it in a sentence, for example: " + example)
                    .orElse(NO_EXAMPLE_FOLLOW_UP));
        } else {
            lines.add(clarification(context, rules));
        }
        return new ComposedReply(lines.toString(), safeCorrections, result.intent(), result.matched());
    }

    private String correctionBlock(List<Correction> corrections) {
        var block = new StringJoiner("\n");
        block.add(corrections.size() == 1 ? "One thing to fix first:" : "A few things to fix first:");
        for (Correction correction : corrections) {
            block.add("  * \"%s\" -> \"%s\" (%s)".formatted(
                    correction.span().text(), correction.suggestion(), correction.issueKind().label()));
        }
        return block.toString();
    }

    /**
     * Picks a clarification prompt for the intent of the turn before this one, rotating by turn count
     * so two consecutive unmatched turns get different wording.
     */
    private String clarification(ConversationContext context, RuleBook rules) {
        var prompts = rules.clarificationPrompts(previousIntent(context));
        int turn = context == null ? 0 : context.getTurnCount();
        return prompts.get(Math.floorMod(turn, prompts.size()));
    }

    private static Intent previousIntent(ConversationContext context) {
        if (context == null || context.getRecentIntents().size() < 2) {
            return null;
        }
        var intents = context.getRecentIntents();
        return intents.get(intents.size() - 2);
    }

    private static String fill(String template, VocabularyEntry entry) {
        var reading = entry.details() != null && entry.details().pronunciation() != null
                ? entry.details().pronunciation()
                : entry.surfaceForm();
        return template
                .replace("{surface}", entry.surfaceForm())
                .replace("{canonical}", entry.canonicalForm())
                .replace("{translation}", entry.translation())
                .replace("{reading}", reading)
                .replace("{partOfSpeech}", entry.partOfSpeech().name().toLowerCase(Locale.ROOT))
                .replace("{tier}", entry.difficultyTier().name().toLowerCase(Locale.ROOT));
    }
}
