package com.linguabot.shell;

import com.linguabot.exception.InsufficientDataException;
import com.linguabot.exception.TutorException;
import com.linguabot.model.ComposedReply;
import com.linguabot.model.ExamType;
import com.linguabot.model.Language;
import com.linguabot.model.ScoreReport;
import com.linguabot.model.TestView;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.TutorService;
import lombok.RequiredArgsConstructor;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Interactive shell front end of the tutor.
 * <p>
 * Every command acts on behalf of the learner held in {@link LearnerSession} and delegates to
 * {@link TutorService}. Failures are printed as a styled error line; the shell keeps running.
 * Question and choice numbers are 1-based here and converted to indexes before they reach the service.
 * </p>
 */
@ShellComponent
@RequiredArgsConstructor
public class TutorCommands {

    private final TutorService tutorService;
    private final LearnerSession session;
    private final Terminal terminal;
    private final ObjectProvider<BuildProperties> buildProperties;

    private static final AttributedStyle STYLE_HEADER = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).bold();
    private static final AttributedStyle STYLE_LABEL = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.CYAN);
    private static final AttributedStyle STYLE_KEY = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.YELLOW);
    private static final AttributedStyle STYLE_INFO = AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW).italic();
    private static final AttributedStyle STYLE_ERROR = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.RED);
    private static final AttributedStyle STYLE_SUCCESS = AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.GREEN).bold();
    private static final AttributedStyle STYLE_TUTOR = AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA);
    private static final AttributedStyle STYLE_FIX = AttributedStyle.DEFAULT.foreground(AttributedStyle.RED).italic();

    // --- LEARNER CONTEXT ---

    @ShellMethod(key = "user", value = "Switch the active learner.")
    public void user(@ShellOption(help = "The learner's id (e.g., 'minji').") String userId) {
        if (userId == null || userId.isBlank()) {
            printError("Please give a learner id.");
            return;
        }
        session.setUserId(userId.trim());
        session.setActiveTestId(null);
        printSuccess("Now tutoring '" + session.getUserId() + "'.");
    }

    @ShellMethod(key = "lang", value = "Choose the language to practise (korean or japanese).")
    public void lang(@ShellOption(help = "'korean', 'japanese', 'ko' or 'ja'.") String language) {
        try {
            session.setLanguage(Language.fromUserInput(language));
            printSuccess("Practising " + session.getLanguage().name().toLowerCase(Locale.ROOT) + ".");
        } catch (IllegalArgumentException e) {
            printError(e.getMessage());
        }
    }

    // --- CONVERSATION ---

    /**
     * Sends one message to the tutor. Wrap sentences with spaces in quotes, e.g. {@code say "학교에 가요"}.
     */
    @ShellMethod(key = {"say", "s"}, value = "Say something to the tutor.")
    public void say(@ShellOption(help = "Your message, enclosed in quotes.") String message) {
        try {
            var reply = tutorService.handleMessage(session.getUserId(), session.getLanguage(), message);
            printReply(reply);
        } catch (TutorException | IllegalArgumentException e) {
            printError("Error: " + e.getMessage());
        }
    }

    @ShellMethod(key = "lookup", value = "Look a word up in the vocabulary.")
    public void lookup(@ShellOption(help = "A word, romanization or kana reading.") String word) {
        List<VocabularyEntry> entries = tutorService.lookup(word, session.getLanguage());
        if (entries.isEmpty()) {
            printInfo("No entry found for '" + word + "'.");
            return;
        }
        for (VocabularyEntry entry : entries) {
            var builder = new AttributedStringBuilder()
                    .style(STYLE_KEY).append(entry.surfaceForm())
                    .style(AttributedStyle.DEFAULT);
            if (entry.details() != null && entry.details().pronunciation() != null) {
                builder.append(" [").append(entry.details().pronunciation()).append("]");
            }
            builder.append(" ").append(entry.translation())
                    .style(STYLE_INFO).append("  (%s, %s)".formatted(
                            entry.partOfSpeech().name().toLowerCase(Locale.ROOT),
                            entry.difficultyTier().name().toLowerCase(Locale.ROOT)));
            terminal.writer().println(builder.toAnsi());
            entry.firstExample().ifPresent(example -> terminal.writer().println("    e.g. " + example));
        }
        terminal.writer().flush();
    }

    // --- TESTS ---

    @ShellMethod(key = "test", value = "Start a TOPIK or JLPT style vocabulary test.")
    public void test(
            @ShellOption(help = "'topik' or 'jlpt'; defaults to the exam of the current language.",
                    defaultValue = ShellOption.NULL) String exam,
            @ShellOption(help = "Number of questions; defaults to the configured count.",
                    defaultValue = ShellOption.NULL) Integer count
    ) {
        try {
            var examType = exam == null ? ExamType.forLanguage(session.getLanguage()) : ExamType.fromUserInput(exam);
            var view = count == null
                    ? tutorService.requestTest(session.getUserId(), examType)
                    : tutorService.requestTest(session.getUserId(), examType, count);
            session.setActiveTestId(view.testId());
            printTest(view);
            printInfo("Answer with 'answer <question> <choice>', e.g. 'answer 1 3'. Use 'finish' to hand in early.");
        } catch (InsufficientDataException e) {
            printError("This test is not available yet: " + e.getMessage());
        } catch (TutorException | IllegalArgumentException e) {
            printError("Error: " + e.getMessage());
        }
    }

    @ShellMethod(key = "answer", value = "Answer a question of the open test.")
    public void answer(
            @ShellOption(help = "Question number (1-based).") int question,
            @ShellOption(help = "Choice number (1-based).") int choice
    ) {
        var testId = session.getActiveTestId();
        if (testId == null) {
            printInfo("There is no open test. Use 'test' to start one.");
            return;
        }
        try {
            var ack = tutorService.submitTestAnswer(session.getUserId(), testId, question - 1, choice - 1);
            printLabel("Answer saved (%d of %d answered).".formatted(ack.answeredCount(), ack.total()));
            ack.finalReport().ifPresent(report -> {
                session.setActiveTestId(null);
                printReport(report);
            });
        } catch (TutorException | IllegalArgumentException e) {
            printError("Rejected: " + e.getMessage());
        }
    }

    @ShellMethod(key = "finish", value = "Hand in the open test now. Unanswered questions count as wrong.")
    public void finish() {
        var testId = session.getActiveTestId();
        if (testId == null) {
            printInfo("There is no open test.");
            return;
        }
        try {
            var report = tutorService.finishTest(session.getUserId(), testId);
            session.setActiveTestId(null);
            printReport(report);
        } catch (TutorException | IllegalArgumentException e) {
            printError("Rejected: " + e.getMessage());
        }
    }

    // --- PROGRESS ---

    @ShellMethod(key = "profile", value = "Show the active learner's score, level and history.")
    public void profile() {
        var view = tutorService.getProficiency(session.getUserId());
        printHeader("\nProfile of " + view.userId());
        printField("Score", String.valueOf(view.score()));
        printField("Level", view.level().name());
        printField("Next level at", view.nextLevelScore() == null ? "top level reached" : String.valueOf(view.nextLevelScore()));
        printField("Words learned", String.valueOf(view.wordsLearned()));
        printField("Conversation turns", String.valueOf(view.conversationActivityCount()));
        printField("Tests taken", "%d (%d correct answers)".formatted(view.quizAttempts(), view.quizCorrectTotal()));
        view.testHistory().forEach(summary -> terminal.writer().println("  - %s %d/%d %s +%d".formatted(
                summary.examType(), summary.correctCount(), summary.total(),
                summary.passed() ? "passed" : "failed", summary.scoreDelta())));
        terminal.writer().flush();
    }

    @ShellMethod(key = "leaderboard", value = "Show the top learners.")
    public void leaderboard(@ShellOption(help = "How many rows to show.", defaultValue = "10") int top) {
        var rows = tutorService.leaderboard(top);
        if (rows.isEmpty()) {
            printInfo("Nobody has scored yet.");
            return;
        }
        printHeader("\nLeaderboard");
        rows.forEach(row -> terminal.writer().println(new AttributedStringBuilder()
                .style(STYLE_KEY).append(String.format("%3d. ", row.rank()))
                .style(AttributedStyle.DEFAULT).append(String.format("%-16s %6d  ", row.userId(), row.score()))
                .style(STYLE_INFO).append(row.level().name())
                .toAnsi()));
        terminal.writer().flush();
    }

    // --- ADMINISTRATION ---

    @ShellMethod(key = "stats", value = "Show totals across all learners.")
    public void stats() {
        var stats = tutorService.statistics();
        printHeader("\nStatistics");
        printField("Learners", String.valueOf(stats.totalUsers()));
        printField("Learners with a score", String.valueOf(stats.activeLeaders()));
        for (Map.Entry<Language, Integer> entry : stats.entriesByLanguage().entrySet()) {
            printField(entry.getKey().name().toLowerCase(Locale.ROOT) + " entries", String.valueOf(entry.getValue()));
        }
        printField("Completed tests", String.valueOf(stats.completedTests()));
        printField("Conversation turns", String.valueOf(stats.conversationTurns()));
        printField("Words learned", String.valueOf(stats.wordsLearned()));
        terminal.writer().flush();
    }

    @ShellMethod(key = "reload", value = "Reload the vocabulary corpus and rule tables.")
    public void reload() {
        try {
            int size = tutorService.reloadCorpus();
            printSuccess("Corpus reloaded: " + size + " entries.");
        } catch (TutorException e) {
            printError("Reload failed, the previous corpus stays active: " + e.getMessage());
        }
    }

    @ShellMethod(key = "reset-score", value = "Reset a learner's score to zero.")
    public void resetScore(@ShellOption(help = "The learner; defaults to the active one.",
            defaultValue = ShellOption.NULL) String userId) {
        var target = userId == null ? session.getUserId() : userId;
        var view = tutorService.resetScore(target);
        printSuccess("Score of '" + view.userId() + "' reset to " + view.score() + ".");
    }

    @ShellMethod(key = "version", value = "Display the application version.")
    public void version() {
        var properties = buildProperties.getIfAvailable();
        terminal.writer().println("linguabot version " + (properties == null ? "unknown" : properties.getVersion()));
        terminal.writer().flush();
    }

    // --- INTERNAL HELPERS ---

    private void printReply(ComposedReply reply) {
        var style = reply.corrections().isEmpty() ? STYLE_TUTOR : STYLE_FIX;
        terminal.writer().println(new AttributedString(reply.text(), style).toAnsi());
        terminal.writer().flush();
    }

    private void printTest(TestView view) {
        printHeader("\n%s test (%d questions, due %s)".formatted(view.examType(), view.questions().size(), view.expiresAt()));
        for (TestView.QuestionView question : view.questions()) {
            printLabel("%d. %s".formatted(question.number(), question.prompt()));
            for (int i = 0; i < question.choices().size(); i++) {
                terminal.writer().println("     %d) %s".formatted(i + 1, question.choices().get(i)));
            }
        }
        terminal.writer().flush();
    }

    private void printReport(ScoreReport report) {
        var headline = "%s test finished: %d/%d (%d%%)".formatted(
                report.examType(), report.correctCount(), report.total(), report.percentage());
        if (report.passed()) {
            printSuccess(headline + " - passed! +" + report.scoreDelta() + " points");
        } else {
            printError(headline + " - not passed this time.");
        }
        if (report.derivedLevelDelta() > 0) {
            printSuccess("Level up!");
        }
    }

    private void printField(String label, String value) {
        terminal.writer().println(new AttributedStringBuilder()
                .style(STYLE_LABEL).append(String.format("%-22s", label + ":"))
                .style(AttributedStyle.DEFAULT).append(value)
                .toAnsi());
    }

    private void printHeader(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_HEADER).toAnsi());
        printSeparator();
    }

    private void printLabel(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_LABEL).toAnsi());
        terminal.writer().flush();
    }

    private void printInfo(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_INFO).toAnsi());
        terminal.writer().flush();
    }

    private void printError(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_ERROR).toAnsi());
        terminal.writer().flush();
    }

    private void printSuccess(String text) {
        terminal.writer().println(new AttributedString(text, STYLE_SUCCESS).toAnsi());
        terminal.writer().flush();
    }

    private void printSeparator() {
        terminal.writer().println("─".repeat(40));
    }
}
