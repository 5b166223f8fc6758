package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One generated, time-boxed exam session with a fixed question set.
 * <p>
 * Only answer submission and finalization mutate an instance. Expiry is detected lazily when the
 * instance is accessed after {@code expiresAt}; there is no background timer.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
public class TestInstance {

    private String testId;
    private String userId;
    private ExamType examType;
    private TestStatus status = TestStatus.CREATED;
    private List<TestQuestion> questions = new ArrayList<>();
    private Map<Integer, Integer> answers = new TreeMap<>();
    private Instant startedAt;
    private Instant expiresAt;
    private ScoreReport report;

    public TestInstance(String testId, String userId, ExamType examType, List<TestQuestion> questions) {
        this.testId = testId;
        this.userId = userId;
        this.examType = examType;
        this.questions = new ArrayList<>(questions);
    }

    public void begin(Instant now, Duration timeLimit) {
        if (status != TestStatus.CREATED) {
            throw new IllegalStateException("Test " + testId + " has already been started.");
        }
        this.startedAt = now;
        this.expiresAt = now.plus(timeLimit);
        this.status = TestStatus.IN_PROGRESS;
    }

    /**
     * Moves an in-progress instance to {@code EXPIRED} if {@code now} is at or past its deadline.
     *
     * @return {@code true} if the instance transitioned.
     */
    public boolean expireIfDue(Instant now) {
        if (status == TestStatus.IN_PROGRESS && expiresAt != null && !now.isBefore(expiresAt)) {
            status = TestStatus.EXPIRED;
            return true;
        }
        return false;
    }

    public void recordAnswer(int questionIndex, int choiceIndex) {
        answers.put(questionIndex, choiceIndex);
    }

    public void complete(ScoreReport finalReport) {
        this.report = finalReport;
        this.status = TestStatus.COMPLETED;
    }

    @JsonIgnore
    public int answeredCount() {
        return answers.size();
    }

    @JsonIgnore
    public boolean allAnswered() {
        return answers.size() == questions.size();
    }
}
