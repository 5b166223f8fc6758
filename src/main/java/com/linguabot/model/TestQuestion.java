package com.linguabot.model;

import java.util.List;

/**
 * One multiple-choice question of a test.
 * <p>
 * The prompt and choices are frozen at generation time, so a test stays answerable even if the
 * corpus is reloaded while it is in progress.
 * </p>
 *
 * @param entryId            The corpus entry the question is about.
 * @param promptVariant      Direction of the question.
 * @param prompt             The text shown to the learner.
 * @param choices            Answer options, in display order.
 * @param correctAnswerIndex Index into {@code choices} of the right answer.
 * @param tier               Difficulty tier of the entry, used for scoring.
 */
public record TestQuestion(
        String entryId,
        PromptVariant promptVariant,
        String prompt,
        List<String> choices,
        int correctAnswerIndex,
        DifficultyTier tier) {

    public TestQuestion {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
