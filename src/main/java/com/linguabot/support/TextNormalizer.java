package com.linguabot.support;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the normalized lookup keys shared by the corpus index and the matcher.
 * <p>
 * A key is NFKC-normalized, lower-cased, has katakana folded to hiragana and every character that
 * is neither a letter nor a digit replaced by a single space. The "compact" form additionally
 * drops the spaces, so "an-nyeong", "An Nyeong" and "annyeong" all meet on "annyeong".
 * </p>
 */
public final class TextNormalizer {

    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");

    private static final char KATAKANA_SMALL_A = 'ァ';
    private static final char KATAKANA_VU = 'ヶ';
    private static final int KANA_OFFSET = 0x60;

    private TextNormalizer() {
    }

    public static String normalizeKey(String text) {
        if (text == null) {
            return "";
        }
        var nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        var builder = new StringBuilder(nfkc.length());
        for (int i = 0; i < nfkc.length(); i++) {
            char c = nfkc.charAt(i);
            if (c >= KATAKANA_SMALL_A && c <= KATAKANA_VU) {
                builder.append((char) (c - KANA_OFFSET));
            } else if (Character.isLetterOrDigit(c) || c == 'ー') {
                builder.append(c);
            } else {
                builder.append(' ');
            }
        }
        return MULTI_SPACE.matcher(builder).replaceAll(" ").trim();
    }

    public static String compactKey(String text) {
        return normalizeKey(text).replace(" ", "");
    }

    /**
     * Splits text into normalized whitespace-separated tokens.
     */
    public static List<String> tokenize(String text) {
        var key = normalizeKey(text);
        if (key.isEmpty()) {
            return List.of();
        }
        return List.of(key.split(" "));
    }

    /**
     * Returns the start offsets of each token of an already normalized key.
     */
    public static List<int[]> tokenBounds(String normalizedKey) {
        List<int[]> bounds = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= normalizedKey.length(); i++) {
            boolean boundary = i == normalizedKey.length() || normalizedKey.charAt(i) == ' ';
            if (boundary && start >= 0) {
                bounds.add(new int[]{start, i});
                start = -1;
            } else if (!boundary && start < 0) {
                start = i;
            }
        }
        return bounds;
    }
}
