package com.linguabot.exception;

import com.linguabot.model.DifficultyTier;
import com.linguabot.model.Language;
import lombok.Getter;

/**
 * The corpus holds fewer entries of a tier than a sample requires.
 */
@Getter
public class InsufficientDataException extends TutorException {

    private final Language language;
    private final DifficultyTier tier;
    private final int requested;
    private final int available;

    public InsufficientDataException(Language language, DifficultyTier tier, int requested, int available) {
        super("Not enough %s %s entries: requested %d, available %d."
                .formatted(tier, language, requested, available));
        this.language = language;
        this.tier = tier;
        this.requested = requested;
        this.available = available;
    }
}
