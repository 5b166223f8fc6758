package com.linguabot.model;

import java.time.Instant;

/**
 * Notification emitted whenever a learner's score changes, for leaderboard and broadcast consumers.
 *
 * @param reason What caused the change: {@code TEST}, {@code CONVERSATION} or {@code RESET}.
 */
public record RatingChangeEvent(String userId, long oldScore, long newScore, Level oldLevel, Level newLevel,
                                String reason, Instant occurredAt) {

    public static RatingChangeEvent of(RatingChange change, String reason, Instant occurredAt) {
        return new RatingChangeEvent(change.userId(), change.oldScore(), change.newScore(), change.oldLevel(),
                change.newLevel(), reason, occurredAt);
    }
}
