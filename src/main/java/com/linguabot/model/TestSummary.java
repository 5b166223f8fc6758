package com.linguabot.model;

import java.time.Instant;

/**
 * Compact history line of a completed test, kept in the learner's {@link ProficiencyRecord}.
 */
public record TestSummary(String testId, ExamType examType, int correctCount, int total, boolean passed,
                          long scoreDelta, Instant completedAt) {

    public static TestSummary of(ScoreReport report, long awardedPoints) {
        return new TestSummary(report.testId(), report.examType(), report.correctCount(), report.total(),
                report.passed(), awardedPoints, report.completedAt());
    }
}
