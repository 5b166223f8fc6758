package com.linguabot.service.impl;

import com.linguabot.corpus.RuleBook;
import com.linguabot.model.Correction;
import com.linguabot.model.GrammarRule;
import com.linguabot.model.Language;
import com.linguabot.model.PartOfSpeech;
import com.linguabot.model.TextSpan;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.GrammarCorrector;
import com.linguabot.support.Hangul;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the rule book's grammar rules to an utterance.
 * <p>
 * Structural rules (particle agreement, missing particle, verb-final order) look at the words of the
 * utterance that carry the matched entry, so they only run when something matched. Pattern rules
 * run on the raw text regardless.
 * </p>
 */
@Service
public class GrammarCorrectorImpl implements GrammarCorrector {

    private static final Logger log = LoggerFactory.getLogger(GrammarCorrectorImpl.class);

    private static final Pattern WORD = Pattern.compile("\\S+");
    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\$(\\d)");

    @Override
    public List<Correction> check(String text, VocabularyEntry matchedEntry, Language language, RuleBook rules) {
        if (text == null || text.isBlank() || language == null || rules == null) {
            return List.of();
        }
        var category = matchedEntry == null ? null : matchedEntry.partOfSpeech();
        var words = words(text);
        List<Correction> corrections = new ArrayList<>();
        for (GrammarRule rule : rules.grammarRules()) {
            if (!rule.appliesTo(language, category)) {
                continue;
            }
            try {
                switch (rule.kind()) {
                    case PATTERN -> applyPattern(rule, rules.grammarPattern(rule), text, corrections);
                    case PARTICLE_AGREEMENT -> checkParticleAgreement(rule, matchedEntry, words, corrections);
                    case PARTICLE_REQUIRED -> checkParticleRequired(rule, matchedEntry, words, corrections);
                    case VERB_FINAL -> checkVerbFinal(rule, matchedEntry, words, corrections);
                }
            } catch (RuntimeException e) {
                log.warn("Grammar rule '{}' failed on '{}' and was skipped: {}", rule.id(), text, e.toString());
            }
        }
        corrections.sort(Comparator.comparingInt((Correction c) -> c.span().start())
                .thenComparingInt(c -> c.span().end()));
        return List.copyOf(corrections);
    }

    private void applyPattern(GrammarRule rule, Pattern pattern, String text, List<Correction> out) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            var span = new TextSpan(matcher.start(), matcher.end(), matcher.group());
            out.add(new Correction(span, rule.issueKind(), expand(rule.suggestion(), matcher)));
        }
    }

    /**
     * The particle attached to the matched word must agree with the word's final consonant:
     * 책은 but 학교는.
     */
    private void checkParticleAgreement(GrammarRule rule, VocabularyEntry entry, List<TextSpan> words,
                                        List<Correction> out) {
        if (entry == null) {
            return;
        }
        for (TextSpan word : words) {
            var stem = stemIn(word.text(), entry);
            if (stem == null || stem.length() == word.text().length()) {
                continue;
            }
            var attached = word.text().substring(stem.length());
            for (String pair : rule.particles()) {
                var forms = Hangul.splitPair(pair);
                if (!attached.equals(forms[0]) && !attached.equals(forms[1])) {
                    continue;
                }
                var expected = Hangul.agreeingParticle(stem, pair);
                if (!attached.equals(expected)) {
                    var span = new TextSpan(word.start() + stem.length(), word.end(), attached);
                    out.add(new Correction(span, rule.issueKind(), expected));
                }
                break;
            }
        }
    }

    private void checkParticleRequired(GrammarRule rule, VocabularyEntry entry, List<TextSpan> words,
                                       List<Correction> out) {
        if (entry == null || words.size() < 2 || !takesParticle(entry.partOfSpeech())) {
            return;
        }
        for (int i = 0; i < words.size() - 1; i++) {
            var word = words.get(i);
            if (word.text().equals(entry.surfaceForm())) {
                var particle = Hangul.agreeingParticle(word.text(), rule.particles().get(0));
                out.add(new Correction(word, rule.issueKind(), word.text() + particle));
                return;
            }
        }
    }

    private void checkVerbFinal(GrammarRule rule, VocabularyEntry entry, List<TextSpan> words, List<Correction> out) {
        if (entry == null || !entry.partOfSpeech().isPredicate() || words.size() < 2) {
            return;
        }
        for (int i = 0; i < words.size() - 1; i++) {
            var word = words.get(i);
            if (stemIn(word.text(), entry) != null) {
                List<String> reordered = new ArrayList<>();
                for (int j = 0; j < words.size(); j++) {
                    if (j != i) {
                        reordered.add(words.get(j).text());
                    }
                }
                reordered.add(word.text());
                out.add(new Correction(word, rule.issueKind(), String.join(" ", reordered)));
                return;
            }
        }
    }

    /**
     * The longest form of {@code entry} that {@code word} starts with, or {@code null}. Predicates are
     * also recognized by their dictionary stem ("먹다" -> "먹").
     */
    private static String stemIn(String word, VocabularyEntry entry) {
        List<String> forms = new ArrayList<>(List.of(entry.surfaceForm(), entry.canonicalForm()));
        if (entry.partOfSpeech().isPredicate() && entry.canonicalForm().endsWith("다")
                && entry.canonicalForm().length() > 1) {
            forms.add(entry.canonicalForm().substring(0, entry.canonicalForm().length() - 1));
        }
        String stem = null;
        for (String form : forms) {
            if (word.startsWith(form) && (stem == null || form.length() > stem.length())) {
                stem = form;
            }
        }
        return stem;
    }

    private static boolean takesParticle(PartOfSpeech partOfSpeech) {
        return partOfSpeech == PartOfSpeech.NOUN || partOfSpeech == PartOfSpeech.PRONOUN;
    }

    /**
     * Words with their offsets; trailing punctuation is not part of a word.
     */
    private static List<TextSpan> words(String text) {
        List<TextSpan> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            int end = matcher.end();
            while (end > matcher.start() && !Character.isLetterOrDigit(text.charAt(end - 1))) {
                end--;
            }
            if (end > matcher.start()) {
                words.add(new TextSpan(matcher.start(), end, text.substring(matcher.start(), end)));
            }
        }
        return words;
    }

    private static String expand(String template, Matcher match) {
        Matcher reference = GROUP_REFERENCE.matcher(template);
        var builder = new StringBuilder();
        while (reference.find()) {
            int group = Integer.parseInt(reference.group(1));
            var value = group <= match.groupCount() && match.group(group) != null ? match.group(group) : "";
            reference.appendReplacement(builder, Matcher.quoteReplacement(value));
        }
        reference.appendTail(builder);
        return builder.toString();
    }
}
