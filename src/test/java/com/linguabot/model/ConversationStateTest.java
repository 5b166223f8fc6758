package com.linguabot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationStateTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    @DisplayName("recordTurn should keep the newest intents and the last matched entry")
    void testRecordTurn() {
        var context = new ConversationContext("mina", Language.KOREAN);

        context.recordTurn(Intent.GREETING, "ko-annyeong", 2, NOW);
        context.recordTurn(Intent.QUESTION, null, 2, NOW);
        context.recordTurn(Intent.STATEMENT, null, 2, NOW.plusSeconds(5));

        assertThat(context.getRecentIntents()).containsExactly(Intent.QUESTION, Intent.STATEMENT);
        assertThat(context.lastIntent()).contains(Intent.STATEMENT);
        assertThat(context.getLastMatchedEntryId()).isEqualTo("ko-annyeong");
        assertThat(context.getTurnCount()).isEqualTo(3);
        assertThat(context.getLastActiveAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    @DisplayName("A context is usable only for its own learner and language")
    void testUsable() {
        var context = new ConversationContext("mina", Language.KOREAN);
        var copy = context.copy();
        copy.getRecentIntents().add(null);

        assertThat(context.isUsableFor("mina", Language.KOREAN)).isTrue();
        assertThat(context.isUsableFor("kenji", Language.KOREAN)).isFalse();
        assertThat(context.isUsableFor("mina", Language.JAPANESE)).isFalse();
        assertThat(copy.isUsableFor("mina", Language.KOREAN)).isFalse();
        assertThat(context.getRecentIntents()).isEmpty();
    }

    @Test
    @DisplayName("A test should expire exactly at its deadline and only once")
    void testExpiry() {
        var test = new TestInstance("t-1", "mina", ExamType.TOPIK, List.of());
        test.begin(NOW, Duration.ofMinutes(30));

        assertThat(test.expireIfDue(NOW.plus(Duration.ofMinutes(30)).minusMillis(1))).isFalse();
        assertThat(test.expireIfDue(NOW.plus(Duration.ofMinutes(30)))).isTrue();
        assertThat(test.getStatus()).isEqualTo(TestStatus.EXPIRED);
        assertThat(test.expireIfDue(NOW.plus(Duration.ofHours(2)))).isFalse();
        assertThatThrownBy(() -> test.begin(NOW, Duration.ofMinutes(30))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A score report should round its percentage and carry the rating outcome")
    void testScoreReport() {
        var report = new ScoreReport("t-1", ExamType.JLPT, 2, 3, true, 0, 0L, null, NOW);

        var rated = report.withRating(17L, 1);

        assertThat(report.percentage()).isEqualTo(67);
        assertThat(rated.scoreDelta()).isEqualTo(17L);
        assertThat(rated.derivedLevelDelta()).isEqualTo(1);
        assertThat(rated.correctByTier()).isEmpty();
    }
}
