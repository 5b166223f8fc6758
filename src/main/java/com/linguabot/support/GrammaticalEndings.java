package com.linguabot.support;

import com.linguabot.model.Language;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Particles, copulas and polite endings that may follow a dictionary word inside a token.
 * <p>
 * Japanese endings are in hiragana because normalized text folds katakana to hiragana.
 * </p>
 */
public final class GrammaticalEndings {

    private static final Map<Language, List<String>> ENDINGS = new EnumMap<>(Language.class);

    static {
        ENDINGS.put(Language.KOREAN, longestFirst(
                "은", "는", "이", "가", "을", "를", "에", "에서", "에게", "께", "한테", "의", "도", "와", "과",
                "로", "으로", "랑", "이랑", "하고", "까지", "부터", "보다", "처럼", "만",
                "요", "예요", "이에요", "이야", "야", "이다", "입니다"));
        ENDINGS.put(Language.JAPANESE, longestFirst(
                "は", "が", "を", "に", "で", "と", "の", "も", "へ", "や", "から", "まで", "より",
                "ね", "よ", "か", "です", "でした", "だ", "ます", "ました", "ません"));
    }

    private GrammaticalEndings() {
    }

    /**
     * Length of the longest ending that starts at {@code position} of {@code text}, or 0.
     */
    public static int lengthAt(String text, int position, Language language) {
        for (String ending : ENDINGS.getOrDefault(language, List.of())) {
            if (text.startsWith(ending, position)) {
                return ending.length();
            }
        }
        return 0;
    }

    /**
     * Whether {@code text} starts with a Hangul, kana or CJK ideograph character; only such text
     * is segmented into dictionary words.
     */
    public static boolean isSegmentable(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        var script = Character.UnicodeScript.of(text.codePointAt(0));
        return script == Character.UnicodeScript.HANGUL
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HAN;
    }

    private static List<String> longestFirst(String... endings) {
        return Stream.of(endings).sorted(Comparator.comparingInt(String::length).reversed()).toList();
    }
}
