package com.linguabot.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Learner-facing view of a test: prompts and choices, without answer keys or corpus ids.
 */
public record TestView(String testId, ExamType examType, TestStatus status, List<QuestionView> questions,
                       int answeredCount, Instant expiresAt) {

    /**
     * @param number        1-based question number.
     * @param prompt        The question text.
     * @param choices       Answer options.
     * @param answeredIndex The learner's current answer, or {@code null}.
     */
    public record QuestionView(int number, String prompt, List<String> choices, Integer answeredIndex) {
    }

    public static TestView of(TestInstance instance) {
        List<QuestionView> views = new ArrayList<>();
        for (int i = 0; i < instance.getQuestions().size(); i++) {
            var question = instance.getQuestions().get(i);
            views.add(new QuestionView(i + 1, question.prompt(), question.choices(), instance.getAnswers().get(i)));
        }
        return new TestView(instance.getTestId(), instance.getExamType(), instance.getStatus(), List.copyOf(views),
                instance.answeredCount(), instance.getExpiresAt());
    }
}
