package com.linguabot.model;

/**
 * Score movement caused by one rating operation.
 */
public record RatingChange(String userId, long oldScore, long newScore, Level oldLevel, Level newLevel) {

    public long delta() {
        return newScore - oldScore;
    }

    public int levelDelta() {
        return newLevel.ordinal() - oldLevel.ordinal();
    }

    public boolean changed() {
        return oldScore != newScore;
    }
}
