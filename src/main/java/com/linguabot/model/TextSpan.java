package com.linguabot.model;

/**
 * A character range {@code [start, end)} of the learner's original text.
 *
 * @param start Inclusive start offset.
 * @param end   Exclusive end offset.
 * @param text  The covered text.
 */
public record TextSpan(int start, int end, String text) {
}
