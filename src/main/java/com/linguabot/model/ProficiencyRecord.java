package com.linguabot.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-user proficiency state. Owned by the rating engine: every mutation goes through it.
 * <p>
 * {@code score} never decreases except through an explicit administrative reset.
 * {@code scoreSequence} orders users that reached the same score: lower means earlier.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
public class ProficiencyRecord {

    private String userId;
    private long score;
    private Level level = Level.NOVICE;
    private List<TestSummary> testHistory = new ArrayList<>();
    private long conversationActivityCount;
    private Set<String> learnedEntryIds = new LinkedHashSet<>();
    private int quizAttempts;
    private long quizCorrectTotal;
    private LocalDate dailyTurnDate;
    private int dailyTurnAwards;
    private long scoreSequence;

    public ProficiencyRecord(String userId) {
        this.userId = userId;
    }

    public int wordsLearned() {
        return learnedEntryIds.size();
    }

    public boolean hasTest(String testId) {
        return testHistory.stream().anyMatch(summary -> summary.testId().equals(testId));
    }
}
