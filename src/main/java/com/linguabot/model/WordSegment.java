package com.linguabot.model;

/**
 * A dictionary word found inside a token, followed by the grammatical endings attached to it.
 *
 * @param start  Offset of the word inside the token.
 * @param keyEnd Exclusive end of the corpus key.
 * @param end    Exclusive end of the word including its endings ("학교에" has keyEnd 2, end 3).
 * @param key    The corpus key.
 */
public record WordSegment(int start, int keyEnd, int end, String key) {

    public WordSegment withEnd(int newEnd) {
        return new WordSegment(start, keyEnd, newEnd, key);
    }
}
