package com.linguabot.model;

/**
 * Learner level, derived from the proficiency score. Declaration order is the level order; the
 * score thresholds live in configuration.
 */
public enum Level {
    NOVICE(DifficultyTier.BEGINNER),
    ELEMENTARY(DifficultyTier.BEGINNER),
    INTERMEDIATE(DifficultyTier.INTERMEDIATE),
    UPPER_INTERMEDIATE(DifficultyTier.INTERMEDIATE),
    ADVANCED(DifficultyTier.ADVANCED),
    MASTER(DifficultyTier.ADVANCED);

    private final DifficultyTier preferredTier;

    Level(DifficultyTier preferredTier) {
        this.preferredTier = preferredTier;
    }

    /**
     * The vocabulary tier the tutor favours for learners at this level.
     */
    public DifficultyTier preferredTier() {
        return preferredTier;
    }
}
