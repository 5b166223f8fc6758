package com.linguabot.model;

import java.util.Map;

/**
 * Administrative totals across all learners and the loaded corpus.
 */
public record TutorStatistics(int totalUsers, Map<Language, Integer> entriesByLanguage, long completedTests,
                              long conversationTurns, long wordsLearned, int activeLeaders) {

    public TutorStatistics {
        entriesByLanguage = entriesByLanguage == null ? Map.of() : Map.copyOf(entriesByLanguage);
    }
}
