package com.linguabot.model;

/**
 * Lifecycle of a {@link TestInstance}: {@code CREATED -> IN_PROGRESS -> (COMPLETED | EXPIRED)}.
 */
public enum TestStatus {
    CREATED,
    IN_PROGRESS,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }
}
