package com.linguabot.service.impl;

import com.linguabot.config.TutorProperties;
import com.linguabot.model.DifficultyTier;
import com.linguabot.model.LeaderboardEntry;
import com.linguabot.model.Level;
import com.linguabot.model.ProficiencyRecord;
import com.linguabot.model.RatingChange;
import com.linguabot.model.RatingChangeEvent;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestSummary;
import com.linguabot.service.api.RatingEngine;
import com.linguabot.service.api.RatingEventPublisher;
import com.linguabot.service.api.TutorStorage;
import com.linguabot.support.LevelScale;
import com.linguabot.support.UserLockRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link RatingEngine}.
 * <p>
 * Every read-modify-write of a record happens under the user's lock from {@link UserLockRegistry}.
 * Each score increase draws a number from a global sequence; the leaderboard uses it to rank users
 * with equal scores by who reached that score first.
 * </p>
 */
@Service
public class RatingEngineImpl implements RatingEngine {

    private static final Logger log = LoggerFactory.getLogger(RatingEngineImpl.class);

    static final String REASON_TEST = "TEST";
    static final String REASON_CONVERSATION = "CONVERSATION";
    static final String REASON_RESET = "RESET";

    private final TutorStorage storage;
    private final UserLockRegistry locks;
    private final LevelScale levelScale;
    private final RatingEventPublisher publisher;
    private final TutorProperties.Rating settings;
    private final Clock clock;
    private final AtomicLong scoreSequence = new AtomicLong();

    public RatingEngineImpl(TutorStorage storage, UserLockRegistry locks, LevelScale levelScale,
                            RatingEventPublisher publisher, TutorProperties properties, Clock clock) {
        this.storage = storage;
        this.locks = locks;
        this.levelScale = levelScale;
        this.publisher = publisher;
        this.settings = properties.getRating();
        this.clock = clock;
    }

    /**
     * Continues the score sequence after the highest value already stored.
     */
    @PostConstruct
    public void resumeScoreSequence() {
        long highest = storage.loadAllProficiency().stream()
                .mapToLong(ProficiencyRecord::getScoreSequence)
                .max()
                .orElse(0L);
        scoreSequence.set(highest);
    }

    @Override
    public RatingChange recordTestResult(String userId, ScoreReport report) {
        return locks.callAs(userId, () -> {
            var record = loadOrCreate(userId);
            var oldScore = record.getScore();
            var oldLevel = record.getLevel();
            if (record.hasTest(report.testId())) {
                log.debug("Test {} already applied to {}", report.testId(), userId);
                return new RatingChange(userId, oldScore, oldScore, oldLevel, oldLevel);
            }

            long points = report.passed() ? testPoints(report.correctByTier()) + settings.getPassBonus() : 0L;
            record.getTestHistory().add(TestSummary.of(report, points));
            record.setQuizAttempts(record.getQuizAttempts() + 1);
            record.setQuizCorrectTotal(record.getQuizCorrectTotal() + report.correctCount());
            var change = award(record, points);
            storage.saveProficiency(userId, record);

            log.info("Test {} for {}: {}/{} {}, +{} points (score {} -> {})", report.testId(), userId,
                    report.correctCount(), report.total(), report.passed() ? "passed" : "failed",
                    points, oldScore, record.getScore());
            notifyChange(change, REASON_TEST);
            return change;
        });
    }

    @Override
    public RatingChange recordConversationTurn(String userId) {
        return recordConversationTurn(userId, null);
    }

    @Override
    public RatingChange recordConversationTurn(String userId, String entryId) {
        return locks.callAs(userId, () -> {
            var record = loadOrCreate(userId);
            record.setConversationActivityCount(record.getConversationActivityCount() + 1);
            if (entryId != null) {
                record.getLearnedEntryIds().add(entryId);
            }

            var today = LocalDate.now(clock);
            if (!today.equals(record.getDailyTurnDate())) {
                record.setDailyTurnDate(today);
                record.setDailyTurnAwards(0);
            }
            long points = 0;
            if (record.getDailyTurnAwards() < settings.getDailyConversationCap()) {
                points = Math.max(0, settings.getConversationTurnPoints());
                record.setDailyTurnAwards(record.getDailyTurnAwards() + 1);
            }
            var change = award(record, points);
            storage.saveProficiency(userId, record);
            notifyChange(change, REASON_CONVERSATION);
            return change;
        });
    }

    @Override
    public RatingChange recordConversationActivity(String userId) {
        return locks.callAs(userId, () -> {
            var record = loadOrCreate(userId);
            record.setConversationActivityCount(record.getConversationActivityCount() + 1);
            storage.saveProficiency(userId, record);
            return award(record, 0);
        });
    }

    @Override
    public List<LeaderboardEntry> leaderboard(int topN) {
        if (topN <= 0) {
            return List.of();
        }
        var ranked = storage.loadAllProficiency().stream()
                .filter(record -> record.getScore() > 0)
                .sorted(Comparator.comparingLong(ProficiencyRecord::getScore).reversed()
                        .thenComparingLong(ProficiencyRecord::getScoreSequence)
                        .thenComparing(ProficiencyRecord::getUserId))
                .limit(topN)
                .toList();
        List<LeaderboardEntry> rows = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            var record = ranked.get(i);
            rows.add(new LeaderboardEntry(i + 1, record.getUserId(), record.getScore(), record.getLevel()));
        }
        return rows;
    }

    @Override
    public Level levelOf(long score) {
        return levelScale.levelOf(score);
    }

    @Override
    public ProficiencyRecord getRecord(String userId) {
        return storage.loadProficiency(userId).orElseGet(() -> new ProficiencyRecord(userId));
    }

    @Override
    public List<ProficiencyRecord> allRecords() {
        return storage.loadAllProficiency();
    }

    @Override
    public RatingChange resetScore(String userId) {
        return locks.callAs(userId, () -> {
            var record = loadOrCreate(userId);
            var change = new RatingChange(userId, record.getScore(), 0L, record.getLevel(), levelOf(0L));
            record.setScore(0L);
            record.setLevel(change.newLevel());
            record.setScoreSequence(0L);
            storage.saveProficiency(userId, record);
            log.info("Score of {} reset from {}", userId, change.oldScore());
            notifyChange(change, REASON_RESET);
            return change;
        });
    }

    private long testPoints(Map<DifficultyTier, Integer> correctByTier) {
        long points = 0;
        for (var tierCount : correctByTier.entrySet()) {
            points += (long) tierCount.getValue() * settings.getPointsPerCorrect().getOrDefault(tierCount.getKey(), 0);
        }
        return points;
    }

    private RatingChange award(ProficiencyRecord record, long points) {
        var oldScore = record.getScore();
        var oldLevel = record.getLevel();
        if (points > 0) {
            record.setScore(oldScore + points);
            record.setLevel(levelOf(record.getScore()));
            record.setScoreSequence(scoreSequence.incrementAndGet());
        }
        return new RatingChange(record.getUserId(), oldScore, record.getScore(), oldLevel, record.getLevel());
    }

    private ProficiencyRecord loadOrCreate(String userId) {
        return storage.loadProficiency(userId).orElseGet(() -> new ProficiencyRecord(userId));
    }

    private void notifyChange(RatingChange change, String reason) {
        if (!change.changed()) {
            return;
        }
        try {
            publisher.publish(RatingChangeEvent.of(change, reason, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Rating change for {} could not be published: {}", change.userId(), e.getMessage());
        }
    }
}
