package com.linguabot.model;

import java.util.List;

/**
 * Read-only snapshot of a {@link ProficiencyRecord} for the transport layer.
 *
 * @param nextLevelScore Score needed for the next level, or {@code null} at the top level.
 */
public record ProficiencyView(String userId, long score, Level level, Long nextLevelScore,
                              List<TestSummary> testHistory, long conversationActivityCount,
                              int wordsLearned, int quizAttempts, long quizCorrectTotal) {

    public ProficiencyView {
        testHistory = testHistory == null ? List.of() : List.copyOf(testHistory);
    }
}
