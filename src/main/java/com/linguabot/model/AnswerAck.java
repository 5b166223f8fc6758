package com.linguabot.model;

import java.util.Optional;

/**
 * Acknowledgement of a recorded answer. When the answer closed the last open question the test
 * has been finalized and the report is attached.
 */
public record AnswerAck(String testId, int questionIndex, int answeredCount, int total, ScoreReport report) {

    public Optional<ScoreReport> finalReport() {
        return Optional.ofNullable(report);
    }
}
