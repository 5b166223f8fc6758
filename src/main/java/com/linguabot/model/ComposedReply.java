package com.linguabot.model;

import java.util.List;

/**
 * The tutor's reply to one learner turn, ready for the transport layer.
 *
 * @param text        Natural-language reply text.
 * @param corrections The grammar issues the reply mentions, in text order.
 * @param intent      The intent the utterance was classified as.
 * @param matched     Whether a corpus entry was recognized.
 */
public record ComposedReply(String text, List<Correction> corrections, Intent intent, boolean matched) {

    public ComposedReply {
        corrections = corrections == null ? List.of() : List.copyOf(corrections);
    }
}
