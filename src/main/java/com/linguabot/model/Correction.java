package com.linguabot.model;

/**
 * A single grammar issue found in a learner utterance.
 *
 * @param span       Where the issue is.
 * @param issueKind  What kind of issue it is.
 * @param suggestion The corrected text for the span.
 */
public record Correction(TextSpan span, IssueKind issueKind, String suggestion) {
}
