package com.linguabot.service.impl;

import com.linguabot.TestFixtures;
import com.linguabot.config.TutorProperties;
import com.linguabot.exception.InvalidStateException;
import com.linguabot.model.AnswerAck;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.ExamType;
import com.linguabot.model.Intent;
import com.linguabot.model.IssueKind;
import com.linguabot.model.Language;
import com.linguabot.model.LeaderboardEntry;
import com.linguabot.model.Level;
import com.linguabot.model.RatingChangeEvent;
import com.linguabot.model.TestStatus;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.support.LevelScale;
import com.linguabot.support.UserLockRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the facade against the real engines, the in-memory storage and the test corpus.
 */
class TutorServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final List<RatingChangeEvent> events = Collections.synchronizedList(new ArrayList<>());

    private JsonTutorStorage storage;
    private TutorServiceImpl service;

    @BeforeEach
    void setUp() {
        var properties = new TutorProperties();
        var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        var locks = new UserLockRegistry();
        var levelScale = new LevelScale(properties);
        storage = TestFixtures.memoryStorage();

        var corpusService = new CorpusServiceImpl(storage, clock);
        corpusService.loadInitialCorpus();
        var ratingEngine = new RatingEngineImpl(storage, locks, levelScale, events::add, properties, clock);
        var assessmentEngine = new AssessmentEngineImpl(corpusService, storage, ratingEngine, locks, properties, clock);

        service = new TutorServiceImpl(corpusService, new MatchEngineImpl(properties, clock),
                new GrammarCorrectorImpl(), new ResponseComposerImpl(), assessmentEngine, ratingEngine, storage,
                locks, levelScale, properties);
    }

    @Test
    @DisplayName("A greeting should be answered and counted as a conversation turn")
    void testGreetingTurn() {
        var reply = service.handleMessage("mina", Language.KOREAN, "안녕");

        assertThat(reply.matched()).isTrue();
        assertThat(reply.intent()).isEqualTo(Intent.GREETING);
        assertThat(reply.text()).contains("안녕 (annyeong)").contains("Culture note:");

        var context = storage.loadContext("mina").orElseThrow();
        assertThat(context.getTurnCount()).isEqualTo(1);
        assertThat(context.getLastMatchedEntryId()).isEqualTo("ko-annyeong");

        var profile = service.getProficiency("mina");
        assertThat(profile.score()).isEqualTo(1L);
        assertThat(profile.conversationActivityCount()).isEqualTo(1L);
        assertThat(profile.wordsLearned()).isEqualTo(1);
        assertThat(profile.nextLevelScore()).isEqualTo(100L);
        assertThat(events).singleElement().extracting(RatingChangeEvent::reason).isEqualTo("CONVERSATION");
    }

    @Test
    @DisplayName("A grammar slip should be corrected before the explanation")
    void testCorrectionInReply() {
        var reply = service.handleMessage("mina", Language.KOREAN, "학교은 커요");

        assertThat(reply.corrections()).extracting(correction -> correction.issueKind())
                .containsExactly(IssueKind.PARTICLE_FORM);
        assertThat(reply.text()).startsWith("One thing to fix first:");
        assertThat(reply.text()).contains("학교 (hakgyo) means \"school\"");
    }

    @Test
    @DisplayName("An unknown sentence should get a clarification and still count as activity")
    void testUnmatchedTurn() {
        var reply = service.handleMessage("mina", Language.KOREAN, "qwerty zxcv");

        assertThat(reply.matched()).isFalse();
        assertThat(reply.text()).isEqualTo("Sorry, I didn't catch that. Could you say it another way?");
        assertThat(service.getProficiency("mina").wordsLearned()).isZero();
        assertThat(service.getProficiency("mina").conversationActivityCount()).isEqualTo(1L);
        assertThat(service.getProficiency("mina").score()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Blank and unmatched messages should never earn points")
    void testUnmatchedTurnsEarnNothing() {
        for (int i = 0; i < 25; i++) {
            service.handleMessage("mina", Language.KOREAN, i % 2 == 0 ? "" : "asdf");
        }

        var profile = service.getProficiency("mina");
        assertThat(profile.score()).isZero();
        assertThat(profile.conversationActivityCount()).isEqualTo(25L);
        assertThat(service.leaderboard(10)).isEmpty();
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("Switching language should start a new conversation")
    void testLanguageSwitch() {
        service.handleMessage("mina", Language.KOREAN, "안녕");
        service.handleMessage("mina", Language.KOREAN, "학교");

        service.handleMessage("mina", Language.JAPANESE, "こんにちは");

        var context = storage.loadContext("mina").orElseThrow();
        assertThat(context.getLanguage()).isEqualTo(Language.JAPANESE);
        assertThat(context.getTurnCount()).isEqualTo(1);
        assertThat(context.getLastMatchedEntryId()).isEqualTo("ja-konnichiwa");
    }

    @Test
    @DisplayName("A damaged stored context should be replaced by a fresh one")
    void testUnusableContext() {
        var damaged = new ConversationContext("someone-else", Language.KOREAN);
        damaged.setTurnCount(-3);
        storage.saveContext("mina", damaged);

        service.handleMessage("mina", Language.KOREAN, "안녕");

        var context = storage.loadContext("mina").orElseThrow();
        assertThat(context.getUserId()).isEqualTo("mina");
        assertThat(context.getTurnCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A context pointing at a removed entry should drop the reference")
    void testRemovedEntryCleared() {
        var stale = new ConversationContext("mina", Language.KOREAN);
        stale.recordTurn(Intent.STATEMENT, "ko-removed", 5, NOW);
        storage.saveContext("mina", stale);

        service.handleMessage("mina", Language.KOREAN, "qwerty");

        var context = storage.loadContext("mina").orElseThrow();
        assertThat(context.getLastMatchedEntryId()).isNull();
        assertThat(context.getTurnCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent messages of one learner should all be applied")
    void testConcurrentMessages() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                futures.add(pool.submit(() -> service.handleMessage("mina", Language.KOREAN, "책")));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(storage.loadContext("mina").orElseThrow().getTurnCount()).isEqualTo(30);
        assertThat(service.getProficiency("mina").conversationActivityCount()).isEqualTo(30L);
        assertThat(service.getProficiency("mina").score()).isEqualTo(20L);
    }

    @Test
    @DisplayName("Answering the last question should finalize the test and award points")
    void testTestFlow() {
        var view = service.requestTest("mina", ExamType.TOPIK, 4);

        assertThat(view.status()).isEqualTo(TestStatus.IN_PROGRESS);
        assertThat(view.questions()).hasSize(4);
        assertThat(view.questions()).allSatisfy(question -> assertThat(question.answeredIndex()).isNull());

        var instance = storage.loadTestInstance(view.testId()).orElseThrow();
        AnswerAck ack = null;
        for (int i = 0; i < 4; i++) {
            ack = service.submitTestAnswer("mina", view.testId(), i, instance.getQuestions().get(i).correctAnswerIndex());
            if (i < 3) {
                assertThat(ack.finalReport()).isEmpty();
            }
        }

        assertThat(ack.answeredCount()).isEqualTo(4);
        var report = ack.finalReport().orElseThrow();
        assertThat(report.passed()).isTrue();
        // 3 beginner x 2 + 1 intermediate x 3 + 10 bonus
        assertThat(report.scoreDelta()).isEqualTo(19L);
        assertThat(service.finishTest("mina", view.testId())).isEqualTo(report);
        assertThat(service.viewTest("mina", view.testId()).status()).isEqualTo(TestStatus.COMPLETED);

        var profile = service.getProficiency("mina");
        assertThat(profile.score()).isEqualTo(19L);
        assertThat(profile.testHistory()).hasSize(1);
        assertThat(profile.quizAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("A learner should not be able to touch another learner's test")
    void testForeignTest() {
        var view = service.requestTest("mina", ExamType.JLPT, 2);

        assertThatThrownBy(() -> service.submitTestAnswer("kenji", view.testId(), 0, 0))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> service.finishTest("kenji", view.testId()))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> service.viewTest("kenji", view.testId()))
                .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> service.viewTest("mina", "missing"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(storage.loadTestInstance(view.testId()).orElseThrow().getAnswers()).isEmpty();
    }

    @Test
    @DisplayName("Blank user ids should be rejected")
    void testBlankUser() {
        assertThatThrownBy(() -> service.handleMessage(" ", Language.KOREAN, "안녕"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.requestTest(null, ExamType.TOPIK))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.getProficiency(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Leaderboard, reset and statistics should reflect learner activity")
    void testAdministration() {
        service.handleMessage("mina", Language.KOREAN, "안녕");
        service.handleMessage("mina", Language.KOREAN, "학교");
        service.handleMessage("kenji", Language.JAPANESE, "こんにちは");
        service.handleMessage("anna", Language.KOREAN, "qwerty");

        assertThat(service.leaderboard(10)).extracting(LeaderboardEntry::userId)
                .containsExactly("mina", "kenji");

        var reset = service.resetScore("mina");
        assertThat(reset.score()).isZero();
        assertThat(reset.level()).isEqualTo(Level.NOVICE);
        assertThat(service.leaderboard(10)).extracting(LeaderboardEntry::userId).containsExactly("kenji");

        var stats = service.statistics();
        assertThat(stats.totalUsers()).isEqualTo(3);
        assertThat(stats.conversationTurns()).isEqualTo(4L);
        assertThat(stats.wordsLearned()).isEqualTo(3L);
        assertThat(stats.activeLeaders()).isEqualTo(1);
        assertThat(stats.entriesByLanguage()).containsEntry(Language.KOREAN, 18).containsEntry(Language.JAPANESE, 11);
    }

    @Test
    @DisplayName("Lookup and reload should use the current corpus")
    void testLookupAndReload() {
        assertThat(service.lookup("hakgyo", Language.KOREAN)).extracting(VocabularyEntry::id)
                .containsExactly("ko-hakgyo");
        assertThat(service.lookup("학교", Language.JAPANESE)).isEmpty();
        assertThat(service.reloadCorpus()).isEqualTo(29);
    }
}
