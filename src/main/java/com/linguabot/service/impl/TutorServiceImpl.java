package com.linguabot.service.impl;

import com.linguabot.config.TutorProperties;
import com.linguabot.corpus.ContentSnapshot;
import com.linguabot.exception.InvalidStateException;
import com.linguabot.model.AnswerAck;
import com.linguabot.model.ComposedReply;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.ExamType;
import com.linguabot.model.Language;
import com.linguabot.model.LeaderboardEntry;
import com.linguabot.model.ProficiencyRecord;
import com.linguabot.model.ProficiencyView;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestInstance;
import com.linguabot.model.TestView;
import com.linguabot.model.TutorStatistics;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.AssessmentEngine;
import com.linguabot.service.api.CorpusService;
import com.linguabot.service.api.GrammarCorrector;
import com.linguabot.service.api.MatchEngine;
import com.linguabot.service.api.RatingEngine;
import com.linguabot.service.api.ResponseComposer;
import com.linguabot.service.api.TutorService;
import com.linguabot.service.api.TutorStorage;
import com.linguabot.support.LevelScale;
import com.linguabot.support.UserLockRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Default {@link TutorService}: wires the engines together for each inbound request.
 * <p>
 * A conversational turn reads one corpus snapshot for its whole duration, so a concurrent reload
 * never mixes two generations within a turn.
 * </p>
 */
@Service
@RequiredArgsConstructor
public class TutorServiceImpl implements TutorService {

    private static final Logger log = LoggerFactory.getLogger(TutorServiceImpl.class);

    private final CorpusService corpusService;
    private final MatchEngine matchEngine;
    private final GrammarCorrector grammarCorrector;
    private final ResponseComposer responseComposer;
    private final AssessmentEngine assessmentEngine;
    private final RatingEngine ratingEngine;
    private final TutorStorage storage;
    private final UserLockRegistry locks;
    private final LevelScale levelScale;
    private final TutorProperties properties;

    @Override
    public ComposedReply handleMessage(String userId, Language language, String text) {
        requireUser(userId);
        if (language == null) {
            throw new IllegalArgumentException("A language is required.");
        }
        return locks.callAs(userId, () -> {
            var snapshot = corpusService.current();
            var context = recoverContext(userId, language, snapshot);
            var level = ratingEngine.getRecord(userId).getLevel();

            var result = matchEngine.match(text, language, context, level, snapshot);
            var corrections = grammarCorrector.check(text, result.entry(), language, snapshot.rules());
            var reply = responseComposer.compose(result, corrections, context, snapshot.rules());

            storage.saveContext(userId, context);
            if (result.matched()) {
                ratingEngine.recordConversationTurn(userId, result.entry().id());
            } else {
                ratingEngine.recordConversationActivity(userId);
            }
            return reply;
        });
    }

    @Override
    public TestView requestTest(String userId, ExamType examType) {
        return requestTest(userId, examType, properties.getAssessment().getDefaultQuestionCount());
    }

    @Override
    public TestView requestTest(String userId, ExamType examType, int questionCount) {
        requireUser(userId);
        return TestView.of(assessmentEngine.generate(userId, examType, questionCount));
    }

    @Override
    public AnswerAck submitTestAnswer(String userId, String testId, int questionIndex, int choiceIndex) {
        requireUser(userId);
        return locks.callAs(userId, () -> {
            requireOwnTest(userId, testId);
            var updated = assessmentEngine.submitAnswer(testId, questionIndex, choiceIndex);
            ScoreReport report = null;
            if (updated.allAnswered()) {
                log.debug("Last question of test {} answered, finalizing", testId);
                report = assessmentEngine.finalize(testId);
            }
            return new AnswerAck(testId, questionIndex, updated.answeredCount(), updated.getQuestions().size(), report);
        });
    }

    @Override
    public ScoreReport finishTest(String userId, String testId) {
        requireUser(userId);
        return locks.callAs(userId, () -> {
            requireOwnTest(userId, testId);
            return assessmentEngine.finalize(testId);
        });
    }

    @Override
    public TestView viewTest(String userId, String testId) {
        requireUser(userId);
        return TestView.of(requireOwnTest(userId, testId));
    }

    @Override
    public ProficiencyView getProficiency(String userId) {
        requireUser(userId);
        return toView(ratingEngine.getRecord(userId));
    }

    @Override
    public List<LeaderboardEntry> leaderboard(int topN) {
        return ratingEngine.leaderboard(topN);
    }

    @Override
    public List<VocabularyEntry> lookup(String token, Language language) {
        return corpusService.current().vocabulary().lookupByToken(token, language);
    }

    @Override
    public int reloadCorpus() {
        var snapshot = corpusService.reload();
        return snapshot.vocabulary().size();
    }

    @Override
    public ProficiencyView resetScore(String userId) {
        requireUser(userId);
        ratingEngine.resetScore(userId);
        return getProficiency(userId);
    }

    @Override
    public TutorStatistics statistics() {
        var records = ratingEngine.allRecords();
        long completedTests = 0;
        long turns = 0;
        long words = 0;
        int leaders = 0;
        for (ProficiencyRecord record : records) {
            completedTests += record.getTestHistory().size();
            turns += record.getConversationActivityCount();
            words += record.wordsLearned();
            if (record.getScore() > 0) {
                leaders++;
            }
        }
        return new TutorStatistics(records.size(), corpusService.current().vocabulary().countByLanguage(),
                completedTests, turns, words, leaders);
    }

    /**
     * Returns the stored context if it is intact and for the same language; otherwise a fresh one.
     * A reference to an entry the current snapshot no longer has is dropped.
     */
    private ConversationContext recoverContext(String userId, Language language, ContentSnapshot snapshot) {
        var stored = storage.loadContext(userId);
        ConversationContext context;
        if (stored.isEmpty()) {
            context = new ConversationContext(userId, language);
        } else if (stored.get().getLanguage() != language) {
            log.debug("{} switched to {}, starting a new conversation", userId, language);
            context = new ConversationContext(userId, language);
        } else if (!stored.get().isUsableFor(userId, language)) {
            log.warn("Stored conversation context of {} is unusable, starting a new one", userId);
            context = new ConversationContext(userId, language);
        } else {
            context = stored.get();
        }
        if (context.getLastMatchedEntryId() != null && !snapshot.vocabulary().contains(context.getLastMatchedEntryId())) {
            log.debug("Entry {} is gone from the corpus, clearing it from the context of {}",
                    context.getLastMatchedEntryId(), userId);
            context.setLastMatchedEntryId(null);
        }
        return context;
    }

    private TestInstance requireOwnTest(String userId, String testId) {
        var instance = assessmentEngine.findTest(testId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown test '" + testId + "'."));
        if (!userId.equals(instance.getUserId())) {
            throw new InvalidStateException("Test " + testId + " belongs to another learner.");
        }
        return instance;
    }

    private ProficiencyView toView(ProficiencyRecord record) {
        var next = levelScale.nextThreshold(record.getLevel()).orElse(null);
        return new ProficiencyView(record.getUserId(), record.getScore(), record.getLevel(), next,
                record.getTestHistory(), record.getConversationActivityCount(), record.wordsLearned(),
                record.getQuizAttempts(), record.getQuizCorrectTotal());
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("A user id is required.");
        }
    }
}
