package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * One row of the intent classification table. A rule fires when any of its keyword,
 * suffix or regex conditions holds for the normalized utterance.
 *
 * @param intent   The intent assigned when the rule fires.
 * @param language Restricts the rule to one language; {@code null} applies to both.
 * @param contains Keywords searched anywhere in the utterance.
 * @param endsWith Suffixes checked against the utterance with trailing whitespace removed.
 * @param regex    Optional regular expression searched in the raw utterance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentRule(Intent intent, Language language, List<String> contains, List<String> endsWith, String regex) {

    public IntentRule {
        contains = contains == null ? Collections.emptyList() : List.copyOf(contains);
        endsWith = endsWith == null ? Collections.emptyList() : List.copyOf(endsWith);
    }

    public boolean appliesTo(Language target) {
        return language == null || language == target;
    }
}
