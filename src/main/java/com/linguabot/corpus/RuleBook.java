package com.linguabot.corpus;

import com.linguabot.exception.CorpusLoadException;
import com.linguabot.model.CorpusDocument;
import com.linguabot.model.GrammarRule;
import com.linguabot.model.GrammarRuleKind;
import com.linguabot.model.Intent;
import com.linguabot.model.IntentRule;
import com.linguabot.model.Language;
import com.linguabot.support.Hangul;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The declarative tables that drive intent detection, grammar checks and reply wording, loaded
 * alongside the vocabulary. Regular expressions are compiled once here.
 */
public final class RuleBook {

    static final String DEFAULT_PROMPTS_KEY = "DEFAULT";

    private static final Map<Intent, String> FALLBACK_TEMPLATES = Map.of(
            Intent.GREETING, "{surface} ({reading}) is a greeting: \"{translation}\".",
            Intent.QUESTION, "You asked about {surface}. It means \"{translation}\".",
            Intent.STATEMENT, "{surface} means \"{translation}\".",
            Intent.CORRECTION_REQUEST, "Let's look at {surface} (\"{translation}\")."
    );

    private static final List<String> FALLBACK_PROMPTS = List.of(
            "Sorry, I didn't catch that. Could you say it another way?");

    private final List<IntentRule> intentRules;
    private final Map<IntentRule, Pattern> intentPatterns;
    private final List<GrammarRule> grammarRules;
    private final Map<GrammarRule, Pattern> grammarPatterns;
    private final Map<Intent, String> replyTemplates;
    private final Map<String, List<String>> clarificationPrompts;

    private RuleBook(List<IntentRule> intentRules, Map<IntentRule, Pattern> intentPatterns,
                     List<GrammarRule> grammarRules, Map<GrammarRule, Pattern> grammarPatterns,
                     Map<Intent, String> replyTemplates, Map<String, List<String>> clarificationPrompts) {
        this.intentRules = intentRules;
        this.intentPatterns = intentPatterns;
        this.grammarRules = grammarRules;
        this.grammarPatterns = grammarPatterns;
        this.replyTemplates = replyTemplates;
        this.clarificationPrompts = clarificationPrompts;
    }

    /**
     * Validates and compiles the rule tables of a corpus document.
     *
     * @throws CorpusLoadException on an invalid regex, an incomplete rule, a malformed particle pair
     *                             or a template keyed by an unknown intent.
     */
    public static RuleBook from(CorpusDocument document) {
        Map<IntentRule, Pattern> intentPatterns = new IdentityHashMap<>();
        List<IntentRule> intentRules = new ArrayList<>();
        for (IntentRule rule : document.intentRules()) {
            if (rule == null || rule.intent() == null) {
                throw new CorpusLoadException("Intent rule #" + intentRules.size() + " has no intent.");
            }
            if (rule.regex() != null && !rule.regex().isBlank()) {
                intentPatterns.put(rule, compile(rule.regex(), "intent rule for " + rule.intent()));
            }
            intentRules.add(rule);
        }

        Map<GrammarRule, Pattern> grammarPatterns = new IdentityHashMap<>();
        List<GrammarRule> grammarRules = new ArrayList<>();
        for (GrammarRule rule : document.grammarRules()) {
            validateGrammarRule(rule, grammarRules.size());
            if (rule.kind() == GrammarRuleKind.PATTERN) {
                grammarPatterns.put(rule, compile(rule.pattern(), "grammar rule '" + rule.id() + "'"));
            }
            grammarRules.add(rule);
        }

        Map<Intent, String> templates = new EnumMap<>(FALLBACK_TEMPLATES);
        document.replyTemplates().forEach((key, template) -> {
            if (template == null || template.isBlank()) {
                throw new CorpusLoadException("Reply template '" + key + "' is empty.");
            }
            templates.put(parseIntent(key, "reply template"), template);
        });

        Map<String, List<String>> prompts = new LinkedHashMap<>();
        document.clarificationPrompts().forEach((key, list) -> {
            var normalizedKey = key.trim().toUpperCase(Locale.ROOT);
            if (!normalizedKey.equals(DEFAULT_PROMPTS_KEY)) {
                parseIntent(normalizedKey, "clarification prompts");
            }
            var cleaned = list == null ? List.<String>of()
                    : list.stream().filter(p -> p != null && !p.isBlank()).toList();
            if (!cleaned.isEmpty()) {
                prompts.put(normalizedKey, cleaned);
            }
        });
        prompts.putIfAbsent(DEFAULT_PROMPTS_KEY, FALLBACK_PROMPTS);

        return new RuleBook(List.copyOf(intentRules), intentPatterns, List.copyOf(grammarRules), grammarPatterns,
                Collections.unmodifiableMap(templates), Collections.unmodifiableMap(prompts));
    }

    public List<IntentRule> intentRules() {
        return intentRules;
    }

    public Optional<Pattern> intentPattern(IntentRule rule) {
        return Optional.ofNullable(intentPatterns.get(rule));
    }

    public List<GrammarRule> grammarRules() {
        return grammarRules;
    }

    public Pattern grammarPattern(GrammarRule rule) {
        return grammarPatterns.get(rule);
    }

    public String replyTemplate(Intent intent) {
        return replyTemplates.get(intent);
    }

    /**
     * Clarification prompts for the given previous intent, falling back to the default list.
     */
    public List<String> clarificationPrompts(Intent previousIntent) {
        if (previousIntent != null) {
            var keyed = clarificationPrompts.get(previousIntent.name());
            if (keyed != null) {
                return keyed;
            }
        }
        return clarificationPrompts.get(DEFAULT_PROMPTS_KEY);
    }

    private static void validateGrammarRule(GrammarRule rule, int index) {
        if (rule == null || rule.kind() == null || rule.language() == null || rule.issueKind() == null) {
            throw new CorpusLoadException("Grammar rule #" + index + " needs kind, language and issueKind.");
        }
        switch (rule.kind()) {
            case PATTERN -> {
                if (rule.pattern() == null || rule.pattern().isBlank() || rule.suggestion() == null) {
                    throw new CorpusLoadException("Pattern rule '" + rule.id() + "' needs pattern and suggestion.");
                }
            }
            case PARTICLE_AGREEMENT, PARTICLE_REQUIRED -> {
                if (rule.language() != Language.KOREAN || rule.particles().isEmpty()) {
                    throw new CorpusLoadException("Particle rule '" + rule.id() + "' must be Korean and list particles.");
                }
                for (String pair : rule.particles()) {
                    try {
                        Hangul.splitPair(pair);
                    } catch (IllegalArgumentException e) {
                        throw new CorpusLoadException("Particle rule '" + rule.id() + "': " + e.getMessage(), e);
                    }
                }
            }
            case VERB_FINAL -> {
                // no parameters
            }
        }
    }

    private static Intent parseIntent(String key, String what) {
        try {
            return Intent.valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CorpusLoadException("Unknown intent '" + key + "' in " + what + ".", e);
        }
    }

    private static Pattern compile(String regex, String owner) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new CorpusLoadException("Invalid regular expression in " + owner + ": " + e.getDescription(), e);
        }
    }
}
