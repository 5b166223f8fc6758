package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-user conversational state for one language.
 * <p>
 * The context is created on the first message a user sends in a language and mutated once per
 * turn. {@code lastMatchedEntryId} is a lookup key into the current corpus snapshot, not an owned
 * reference: it is cleared when a corpus reload removes the entry.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
public class ConversationContext {

    private String userId;
    private Language language;
    private String lastMatchedEntryId;
    private int turnCount;
    private List<Intent> recentIntents = new ArrayList<>();
    private Instant lastActiveAt;

    public ConversationContext(String userId, Language language) {
        this.userId = userId;
        this.language = language;
    }

    /**
     * Records one learner turn.
     *
     * @param intent         The classified intent; appended most-recent-last.
     * @param matchedEntryId The matched entry id, or {@code null} to keep the previous one.
     * @param capacity       Maximum number of intents retained.
     * @param now            The turn timestamp.
     */
    public void recordTurn(Intent intent, String matchedEntryId, int capacity, Instant now) {
        recentIntents.add(intent);
        while (recentIntents.size() > Math.max(1, capacity)) {
            recentIntents.remove(0);
        }
        if (matchedEntryId != null) {
            lastMatchedEntryId = matchedEntryId;
        }
        turnCount++;
        lastActiveAt = now;
    }

    @JsonIgnore
    public Optional<Intent> lastIntent() {
        return recentIntents.isEmpty() ? Optional.empty() : Optional.of(recentIntents.get(recentIntents.size() - 1));
    }

    /**
     * Structural sanity check used when a stored context is read back.
     */
    @JsonIgnore
    public boolean isUsableFor(String expectedUserId, Language expectedLanguage) {
        return expectedUserId.equals(userId)
                && language == expectedLanguage
                && turnCount >= 0
                && recentIntents != null
                && !recentIntents.contains(null);
    }

    public ConversationContext copy() {
        var copy = new ConversationContext(userId, language);
        copy.lastMatchedEntryId = lastMatchedEntryId;
        copy.turnCount = turnCount;
        copy.recentIntents = new ArrayList<>(recentIntents);
        copy.lastActiveAt = lastActiveAt;
        return copy;
    }
}
