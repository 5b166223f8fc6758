package com.linguabot.service.api;

import com.linguabot.model.RatingChangeEvent;

/**
 * Outbound port for rating-change notifications. Consumers (leaderboard broadcasts, reminders)
 * live outside the tutoring core; the core only emits.
 */
public interface RatingEventPublisher {

    /**
     * Hands an event to the notification collaborator. Must not block on network I/O.
     */
    void publish(RatingChangeEvent event);
}
