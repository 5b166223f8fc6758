package com.linguabot.service.api;

import com.linguabot.model.LeaderboardEntry;
import com.linguabot.model.Level;
import com.linguabot.model.ProficiencyRecord;
import com.linguabot.model.RatingChange;
import com.linguabot.model.ScoreReport;

import java.util.List;

/**
 * Owns every learner's {@link ProficiencyRecord} and the leaderboard derived from them.
 * <p>
 * All mutations are serialized per user. Outside {@link #resetScore(String)} a score never
 * decreases. Every score change is published as a rating-change event.
 * </p>
 */
public interface RatingEngine {

    /**
     * Applies a finalized test to the learner's record.
     * <p>
     * A passed test earns points per correct answer, weighted by tier, plus a pass bonus. A failed
     * test earns nothing but is still recorded in the history. Applying the same test twice has no effect.
     * </p>
     *
     * @return The score movement (possibly zero).
     */
    RatingChange recordTestResult(String userId, ScoreReport report);

    /**
     * Counts one conversational turn, awarding the turn increment while the daily cap allows it.
     */
    RatingChange recordConversationTurn(String userId);

    /**
     * Like {@link #recordConversationTurn(String)}, also remembering the matched entry as a learned word.
     *
     * @param entryId The matched entry, or {@code null}.
     */
    RatingChange recordConversationTurn(String userId, String entryId);

    /**
     * Counts a turn that practised nothing (blank or unmatched input). The activity counter moves,
     * the score and the daily award count do not.
     */
    RatingChange recordConversationActivity(String userId);

    /**
     * Top learners by score, descending. Users who reached the same score are ordered by who got there first.
     *
     * @param topN Maximum number of rows.
     */
    List<LeaderboardEntry> leaderboard(int topN);

    Level levelOf(long score);

    /**
     * Returns the learner's record, or a fresh zero record if the learner is unknown.
     */
    ProficiencyRecord getRecord(String userId);

    List<ProficiencyRecord> allRecords();

    /**
     * Administrative reset of a learner's score to zero. History and counters are kept.
     */
    RatingChange resetScore(String userId);
}
