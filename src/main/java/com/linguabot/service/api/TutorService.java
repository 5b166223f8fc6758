package com.linguabot.service.api;

import com.linguabot.model.AnswerAck;
import com.linguabot.model.ComposedReply;
import com.linguabot.model.ExamType;
import com.linguabot.model.Language;
import com.linguabot.model.LeaderboardEntry;
import com.linguabot.model.ProficiencyView;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestView;
import com.linguabot.model.TutorStatistics;
import com.linguabot.model.VocabularyEntry;

import java.util.List;

/**
 * Inbound facade used by the transport layer.
 * <p>
 * Each call for a user runs under that user's lock, so a learner's turns are processed one at a
 * time and in order while different learners are served concurrently.
 * </p>
 */
public interface TutorService {

    /**
     * Processes one conversational turn: match, grammar check, reply, context update and rating.
     *
     * @param userId   The learner.
     * @param language The language being practised.
     * @param text     The learner's message.
     * @return The tutor's reply.
     */
    ComposedReply handleMessage(String userId, Language language, String text);

    /**
     * Generates and starts a test with the configured default number of questions.
     */
    TestView requestTest(String userId, ExamType examType);

    TestView requestTest(String userId, ExamType examType, int questionCount);

    /**
     * Records an answer. When it closes the last open question the test is finalized and the
     * acknowledgement carries the score report.
     *
     * @param questionIndex 0-based.
     * @param choiceIndex   0-based.
     */
    AnswerAck submitTestAnswer(String userId, String testId, int questionIndex, int choiceIndex);

    /**
     * Finalizes a test explicitly, e.g. when the learner stops early. Unanswered questions count as wrong.
     */
    ScoreReport finishTest(String userId, String testId);

    TestView viewTest(String userId, String testId);

    ProficiencyView getProficiency(String userId);

    List<LeaderboardEntry> leaderboard(int topN);

    /**
     * Dictionary lookup of a single word or phrase.
     */
    List<VocabularyEntry> lookup(String token, Language language);

    /**
     * Reloads the corpus from storage (administrative).
     *
     * @return Number of entries now loaded.
     */
    int reloadCorpus();

    /**
     * Resets a learner's score to zero (administrative).
     */
    ProficiencyView resetScore(String userId);

    TutorStatistics statistics();
}
