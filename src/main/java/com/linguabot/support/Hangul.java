package com.linguabot.support;

/**
 * Syllable arithmetic for precomposed Hangul (U+AC00..U+D7A3).
 * <p>
 * A syllable encodes {@code 0xAC00 + (initial * 21 + medial) * 28 + final}; a final index of 0
 * means the syllable ends in a vowel (no batchim).
 * </p>
 */
public final class Hangul {

    private static final char FIRST_SYLLABLE = '가';
    private static final char LAST_SYLLABLE = '힣';
    private static final int FINAL_COUNT = 28;
    private static final int FINAL_RIEUL = 8;

    private Hangul() {
    }

    public static boolean isSyllable(char c) {
        return c >= FIRST_SYLLABLE && c <= LAST_SYLLABLE;
    }

    public static boolean containsHangul(String text) {
        return text != null && text.chars().anyMatch(c -> isSyllable((char) c));
    }

    /**
     * Whether the last character of {@code word} is a Hangul syllable with a final consonant.
     */
    public static boolean endsWithBatchim(String word) {
        int finalIndex = finalConsonantIndex(word);
        return finalIndex > 0;
    }

    /**
     * Whether the last syllable of {@code word} ends in ㄹ, which takes the vowel-form of 으로/로.
     */
    public static boolean endsWithRieul(String word) {
        return finalConsonantIndex(word) == FINAL_RIEUL;
    }

    /**
     * Picks the allomorph of a "withBatchim/withoutBatchim" particle pair that agrees with {@code word}.
     *
     * @param word The word the particle attaches to.
     * @param pair A pair such as {@code "은/는"} or {@code "으로/로"}.
     * @return The particle form that should follow {@code word}.
     */
    public static String agreeingParticle(String word, String pair) {
        String[] forms = splitPair(pair);
        boolean instrumental = forms[0].equals("으로");
        if (endsWithBatchim(word) && !(instrumental && endsWithRieul(word))) {
            return forms[0];
        }
        return forms[1];
    }

    public static String[] splitPair(String pair) {
        String[] forms = pair.split("/");
        if (forms.length != 2 || forms[0].isBlank() || forms[1].isBlank()) {
            throw new IllegalArgumentException("Particle pair must look like 'X/Y': " + pair);
        }
        return new String[]{forms[0].trim(), forms[1].trim()};
    }

    private static int finalConsonantIndex(String word) {
        if (word == null || word.isEmpty()) {
            return -1;
        }
        char last = word.charAt(word.length() - 1);
        if (!isSyllable(last)) {
            return -1;
        }
        return (last - FIRST_SYLLABLE) % FINAL_COUNT;
    }
}
