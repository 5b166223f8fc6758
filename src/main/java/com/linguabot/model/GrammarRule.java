package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * Declarative grammar check, keyed by language and part of speech.
 * <p>
 * Rules are data: new checks are added to the corpus file, not to the matching code.
 * Which fields are meaningful depends on {@link #kind()}:
 * </p>
 * <ul>
 *   <li>{@code PATTERN}: {@code pattern} and {@code suggestion} (with {@code $n} group references).</li>
 *   <li>{@code PARTICLE_AGREEMENT} / {@code PARTICLE_REQUIRED}: {@code particles} as
 *       "withBatchim/withoutBatchim" pairs, e.g. {@code "은/는"}.</li>
 *   <li>{@code VERB_FINAL}: no extra fields.</li>
 * </ul>
 *
 * @param id           Rule identifier, used in logs only.
 * @param language     The language the rule checks.
 * @param partOfSpeech The matched entry's category the rule applies to; {@code null} for any
 *                     utterance, including unmatched ones.
 * @param kind         The structural check.
 * @param issueKind    The issue reported when the rule fires.
 * @param pattern      Regex for {@code PATTERN} rules.
 * @param suggestion   Replacement template for {@code PATTERN} rules.
 * @param particles    Allomorph pairs for particle rules.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GrammarRule(
        String id,
        Language language,
        PartOfSpeech partOfSpeech,
        GrammarRuleKind kind,
        IssueKind issueKind,
        String pattern,
        String suggestion,
        List<String> particles) {

    public GrammarRule {
        particles = particles == null ? Collections.emptyList() : List.copyOf(particles);
    }

    public boolean appliesTo(Language target, PartOfSpeech matchedCategory) {
        return language == target && (partOfSpeech == null || partOfSpeech == matchedCategory);
    }
}
