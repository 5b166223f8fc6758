package com.linguabot.model;

/**
 * Ordered proficiency bucket attached to vocabulary entries and test questions.
 * Declaration order is the difficulty order.
 */
public enum DifficultyTier {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    /**
     * Distance between two tiers, 0 for the same tier and 2 for BEGINNER vs ADVANCED.
     */
    public int distanceTo(DifficultyTier other) {
        return Math.abs(ordinal() - other.ordinal());
    }
}
