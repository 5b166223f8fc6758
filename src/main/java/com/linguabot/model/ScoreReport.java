package com.linguabot.model;

import java.time.Instant;
import java.util.Map;

/**
 * Result of finalizing a test.
 *
 * @param testId           The scored test.
 * @param examType         TOPIK or JLPT.
 * @param correctCount     Number of correctly answered questions.
 * @param total            Number of questions.
 * @param passed           Whether the correct ratio reached the exam's pass threshold.
 * @param derivedLevelDelta How many levels the learner moved because of this test.
 * @param scoreDelta       Proficiency points awarded (0 for a failed test).
 * @param correctByTier    Correct answers per difficulty tier.
 * @param completedAt      When the test was finalized.
 */
public record ScoreReport(
        String testId,
        ExamType examType,
        int correctCount,
        int total,
        boolean passed,
        int derivedLevelDelta,
        long scoreDelta,
        Map<DifficultyTier, Integer> correctByTier,
        Instant completedAt) {

    public ScoreReport {
        correctByTier = correctByTier == null ? Map.of() : Map.copyOf(correctByTier);
    }

    public ScoreReport withRating(long awardedPoints, int levelDelta) {
        return new ScoreReport(testId, examType, correctCount, total, passed, levelDelta, awardedPoints,
                correctByTier, completedAt);
    }

    public int percentage() {
        return total == 0 ? 0 : (int) Math.round(correctCount * 100.0 / total);
    }
}
