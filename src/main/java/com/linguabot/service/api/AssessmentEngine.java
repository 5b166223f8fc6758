package com.linguabot.service.api;

import com.linguabot.model.ExamType;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestInstance;

import java.util.Optional;

/**
 * Generates, runs and scores TOPIK/JLPT-style multiple-choice tests.
 * <p>
 * Each {@link TestInstance} follows {@code CREATED -> IN_PROGRESS -> (COMPLETED | EXPIRED)}.
 * Expiry is evaluated lazily whenever an instance is accessed after its deadline.
 * </p>
 */
public interface AssessmentEngine {

    /**
     * Samples a new test for a learner and starts it.
     * <p>
     * The number of questions per difficulty tier follows the tier mix configured for the learner's
     * level, so higher levels receive a larger share of advanced items. No entry appears twice.
     * </p>
     *
     * @param userId        The learner.
     * @param examType      TOPIK (Korean) or JLPT (Japanese).
     * @param questionCount Number of questions, at least 1.
     * @return The started, persisted instance.
     * @throws com.linguabot.exception.InsufficientDataException if a tier has too few entries.
     */
    TestInstance generate(String userId, ExamType examType, int questionCount);

    /**
     * Records (or overwrites) the answer to one question.
     *
     * @param testId        The test.
     * @param questionIndex 0-based question index.
     * @param choiceIndex   0-based index into the question's choices.
     * @return The updated instance.
     * @throws com.linguabot.exception.InvalidStateException if the test is not in progress or has expired;
     *                                                       the recorded answers are left untouched.
     * @throws IllegalArgumentException if the test is unknown or an index is out of range.
     */
    TestInstance submitAnswer(String testId, int questionIndex, int choiceIndex);

    /**
     * Scores a test, applies the result to the learner's rating and completes the instance.
     * <p>
     * Idempotent: finalizing a completed test returns the stored report without touching the rating again.
     * </p>
     *
     * @param testId The test.
     * @return The score report.
     * @throws com.linguabot.exception.InvalidStateException if the test expired or was never started.
     */
    ScoreReport finalize(String testId);

    /**
     * Loads a test, applying lazy expiry.
     */
    Optional<TestInstance> findTest(String testId);
}
