package com.linguabot.service.impl;

import com.linguabot.config.TutorProperties;
import com.linguabot.corpus.ContentSnapshot;
import com.linguabot.corpus.RuleBook;
import com.linguabot.corpus.VocabularyCorpus;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.Intent;
import com.linguabot.model.IntentRule;
import com.linguabot.model.Language;
import com.linguabot.model.Level;
import com.linguabot.model.MatchResult;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.MatchEngine;
import com.linguabot.support.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Corpus-driven {@link MatchEngine}.
 * <p>
 * The utterance is broken into query units (tokens, dictionary segments inside tokens, token
 * n-grams and the whole utterance). Every unit is looked up in the corpus, and each entry it hits is
 * credited with the characters the unit covers. Entries covering less than {@code min-coverage} of
 * the input are dropped whatever their tier or continuity; the rest are ranked by the weighted sum
 * of coverage, tier proximity and conversational continuity.
 * </p>
 */
@Service
public class MatchEngineImpl implements MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngineImpl.class);

    private final TutorProperties.Matching settings;
    private final Clock clock;

    public MatchEngineImpl(TutorProperties properties, Clock clock) {
        this.settings = properties.getMatching();
        this.clock = clock;
    }

    /**
     * A lookup key with the {@code [start, end)} offsets it covers inside the normalized utterance.
     * Segments cover their attached endings too.
     */
    private record QueryUnit(int start, int end, String key) {
    }

    private record Candidate(VocabularyEntry entry, double score, int position) {
    }

    @Override
    public MatchResult match(String text, Language language, ConversationContext context, Level level,
                             ContentSnapshot snapshot) {
        var raw = text == null ? "" : text;
        var normalized = TextNormalizer.normalizeKey(raw);
        var corpus = snapshot.vocabulary();

        var best = normalized.isEmpty() ? null : bestCandidate(normalized, language, context, level, corpus);
        var entry = best == null ? null : best.entry();
        var intent = classify(raw, normalized, language, entry, snapshot.rules());

        context.recordTurn(intent, entry == null ? null : entry.id(), settings.getRecentIntentCapacity(),
                clock.instant());

        if (entry == null) {
            log.debug("No match for '{}' ({}), intent {}", raw, language, intent);
            return MatchResult.noMatch(intent);
        }
        log.debug("Matched '{}' to {} with score {}, intent {}", raw, entry.id(), best.score(), intent);
        return new MatchResult(intent, entry, best.score());
    }

    private Candidate bestCandidate(String normalized, Language language, ConversationContext context,
                                    Level level, VocabularyCorpus corpus) {
        int letters = normalized.replace(" ", "").length();
        Map<VocabularyEntry, boolean[]> coverage = new LinkedHashMap<>();
        for (QueryUnit unit : queryUnits(normalized, language, corpus)) {
            for (VocabularyEntry hit : corpus.lookupByToken(unit.key(), language)) {
                var covered = coverage.computeIfAbsent(hit, e -> new boolean[normalized.length()]);
                for (int i = unit.start(); i < unit.end(); i++) {
                    covered[i] = true;
                }
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        coverage.forEach((entry, covered) -> {
            int hits = 0;
            for (int i = 0; i < covered.length; i++) {
                if (covered[i] && normalized.charAt(i) != ' ') {
                    hits++;
                }
            }
            double entryCoverage = (double) hits / letters;
            if (entryCoverage < settings.getMinCoverage()) {
                return;
            }
            double score = score(entryCoverage, entry, context, level);
            if (score >= settings.getMinScore()) {
                candidates.add(new Candidate(entry, score, corpus.positionOf(entry)));
            }
        });

        return candidates.stream()
                .min(Comparator.comparingDouble(Candidate::score).reversed()
                        .thenComparing(candidate -> candidate.entry().difficultyTier())
                        .thenComparingInt(Candidate::position))
                .orElse(null);
    }

    private double score(double coverage, VocabularyEntry entry, ConversationContext context, Level level) {
        double tierProximity = 1.0 - entry.difficultyTier().distanceTo(level.preferredTier()) / 2.0;
        double continuity = continues(entry, context) ? 1.0 : 0.0;
        return settings.getOverlapWeight() * coverage
                + settings.getTierWeight() * tierProximity
                + settings.getContinuityWeight() * continuity;
    }

    private boolean continues(VocabularyEntry entry, ConversationContext context) {
        if (entry.id().equals(context.getLastMatchedEntryId())) {
            return true;
        }
        return entry.intent() != null && context.getRecentIntents().contains(entry.intent());
    }

    private List<QueryUnit> queryUnits(String normalized, Language language, VocabularyCorpus corpus) {
        List<QueryUnit> units = new ArrayList<>();
        var bounds = TextNormalizer.tokenBounds(normalized);
        for (int[] token : bounds) {
            var tokenText = normalized.substring(token[0], token[1]);
            units.add(new QueryUnit(token[0], token[1], tokenText));
            corpus.segment(tokenText, language).forEach(word ->
                    units.add(new QueryUnit(token[0] + word.start(), token[0] + word.end(), word.key())));
        }
        int maxNgram = Math.max(2, settings.getMaxNgram());
        for (int size = 2; size <= maxNgram; size++) {
            for (int first = 0; first + size <= bounds.size(); first++) {
                int start = bounds.get(first)[0];
                int end = bounds.get(first + size - 1)[1];
                units.add(new QueryUnit(start, end, normalized.substring(start, end)));
            }
        }
        if (bounds.size() > maxNgram) {
            units.add(new QueryUnit(0, normalized.length(), normalized));
        }
        return units;
    }

    /**
     * First firing intent rule wins; otherwise the matched entry's own intent, then STATEMENT.
     */
    private Intent classify(String raw, String normalized, Language language, VocabularyEntry entry, RuleBook rules) {
        var trimmed = raw.strip();
        for (IntentRule rule : rules.intentRules()) {
            if (rule.appliesTo(language) && fires(rule, trimmed, normalized, rules)) {
                return rule.intent();
            }
        }
        if (entry != null && entry.intent() != null) {
            return entry.intent();
        }
        return Intent.STATEMENT;
    }

    private boolean fires(IntentRule rule, String trimmed, String normalized, RuleBook rules) {
        for (String keyword : rule.contains()) {
            if (keyword == null || keyword.isEmpty()) {
                continue;
            }
            var key = TextNormalizer.normalizeKey(keyword);
            if (key.isEmpty() ? trimmed.contains(keyword) : normalized.contains(key)) {
                return true;
            }
        }
        for (String suffix : rule.endsWith()) {
            if (suffix == null || suffix.isEmpty()) {
                continue;
            }
            var key = TextNormalizer.normalizeKey(suffix);
            if (trimmed.endsWith(suffix) || (!key.isEmpty() && normalized.endsWith(key))) {
                return true;
            }
        }
        return rules.intentPattern(rule).map(pattern -> pattern.matcher(trimmed).find()).orElse(false);
    }
}
