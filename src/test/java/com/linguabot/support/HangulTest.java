package com.linguabot.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HangulTest {

    @Test
    @DisplayName("endsWithBatchim should read the final consonant of the last syllable")
    void testEndsWithBatchim() {
        assertThat(Hangul.endsWithBatchim("책")).isTrue();
        assertThat(Hangul.endsWithBatchim("학교")).isFalse();
        assertThat(Hangul.endsWithBatchim("물")).isTrue();
        assertThat(Hangul.endsWithBatchim("abc")).isFalse();
        assertThat(Hangul.endsWithBatchim("")).isFalse();
        assertThat(Hangul.endsWithRieul("물")).isTrue();
        assertThat(Hangul.endsWithRieul("책")).isFalse();
    }

    @ParameterizedTest(name = "{0} + {1} -> {2}")
    @CsvSource({
            "책, 은/는, 은",
            "학교, 은/는, 는",
            "사람, 이/가, 이",
            "친구, 을/를, 를",
            "책, 과/와, 과",
            "학교, 으로/로, 로",
            "집, 으로/로, 으로",
            "물, 으로/로, 로"
    })
    @DisplayName("agreeingParticle should pick the allomorph that fits the word")
    void testAgreeingParticle(String word, String pair, String expected) {
        assertThat(Hangul.agreeingParticle(word, pair)).isEqualTo(expected);
    }

    @Test
    @DisplayName("splitPair should reject malformed pairs")
    void testSplitPair() {
        assertThat(Hangul.splitPair(" 이 / 가 ")).containsExactly("이", "가");
        assertThatThrownBy(() -> Hangul.splitPair("이가")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Hangul.splitPair("이/")).isInstanceOf(IllegalArgumentException.class);
    }
}
