package com.linguabot.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Test
    @DisplayName("normalizeKey should lower-case, strip punctuation and collapse whitespace")
    void testNormalizeKey() {
        assertThat(TextNormalizer.normalizeKey("  Hello,   WORLD!! ")).isEqualTo("hello world");
        assertThat(TextNormalizer.normalizeKey("안녕하세요?")).isEqualTo("안녕하세요");
        assertThat(TextNormalizer.normalizeKey(null)).isEmpty();
        assertThat(TextNormalizer.normalizeKey("?!...")).isEmpty();
    }

    @Test
    @DisplayName("normalizeKey should apply NFKC and fold katakana to hiragana")
    void testNormalizeKeyScripts() {
        assertThat(TextNormalizer.normalizeKey("ＡＢＣ")).isEqualTo("abc");
        assertThat(TextNormalizer.normalizeKey("ガッコウ")).isEqualTo("がっこう");
        assertThat(TextNormalizer.normalizeKey("ｶﾞｯｺｳ")).isEqualTo("がっこう");
        assertThat(TextNormalizer.normalizeKey("コーヒー")).isEqualTo("こーひー");
    }

    @Test
    @DisplayName("compactKey should join romanized spellings")
    void testCompactKey() {
        assertThat(TextNormalizer.compactKey("an-nyeong")).isEqualTo("annyeong");
        assertThat(TextNormalizer.compactKey("Kuuki wo yomu")).isEqualTo("kuukiwoyomu");
    }

    @Test
    @DisplayName("tokenize and tokenBounds should agree on token positions")
    void testTokens() {
        var key = TextNormalizer.normalizeKey("학교에 가요!");

        assertThat(TextNormalizer.tokenize("학교에 가요!")).containsExactly("학교에", "가요");
        var bounds = TextNormalizer.tokenBounds(key);
        assertThat(bounds).hasSize(2);
        assertThat(key.substring(bounds.get(0)[0], bounds.get(0)[1])).isEqualTo("학교에");
        assertThat(key.substring(bounds.get(1)[0], bounds.get(1)[1])).isEqualTo("가요");
        assertThat(TextNormalizer.tokenize("   ")).isEmpty();
    }
}
