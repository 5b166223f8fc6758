package com.linguabot.corpus;

import com.linguabot.exception.CorpusLoadException;
import com.linguabot.exception.InsufficientDataException;
import com.linguabot.model.DifficultyTier;
import com.linguabot.model.Language;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.model.WordSegment;
import com.linguabot.support.GrammaticalEndings;
import com.linguabot.support.TextNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable, indexed set of vocabulary entries for both languages.
 * <p>
 * All indexes are built once in {@link #load(List)}: a normalized-key index (surface, canonical
 * and variant forms, each in spaced and compact form) for lookups, and a per-tier index for
 * sampling. Instances are never mutated afterwards and are shared across threads without locking.
 * </p>
 */
public final class VocabularyCorpus {

    private final List<VocabularyEntry> entries;
    private final Map<String, VocabularyEntry> byId;
    private final Map<String, Integer> positionById;
    private final Map<Language, Map<String, List<VocabularyEntry>>> keyIndex;
    private final Map<Language, Integer> maxKeyLength;
    private final Map<Language, Map<DifficultyTier, List<VocabularyEntry>>> tierIndex;

    private VocabularyCorpus(List<VocabularyEntry> entries) {
        this.entries = List.copyOf(entries);
        this.byId = new HashMap<>();
        this.positionById = new HashMap<>();
        this.keyIndex = new EnumMap<>(Language.class);
        this.maxKeyLength = new EnumMap<>(Language.class);
        this.tierIndex = new EnumMap<>(Language.class);

        for (Language language : Language.values()) {
            keyIndex.put(language, new HashMap<>());
            maxKeyLength.put(language, 0);
            Map<DifficultyTier, List<VocabularyEntry>> tiers = new EnumMap<>(DifficultyTier.class);
            for (DifficultyTier tier : DifficultyTier.values()) {
                tiers.put(tier, new ArrayList<>());
            }
            tierIndex.put(language, tiers);
        }

        for (int position = 0; position < this.entries.size(); position++) {
            var entry = this.entries.get(position);
            byId.put(entry.id(), entry);
            positionById.put(entry.id(), position);
            tierIndex.get(entry.language()).get(entry.difficultyTier()).add(entry);
            for (String key : indexKeys(entry)) {
                keyIndex.get(entry.language()).computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
                maxKeyLength.merge(entry.language(), key.length(), Integer::max);
            }
        }
    }

    /**
     * Validates and indexes a list of raw entries.
     *
     * @param source Entries in corpus order; the order is the final tie-breaker of the matcher.
     * @return The indexed corpus.
     * @throws CorpusLoadException if the list is empty, an entry lacks a required field, an id is
     *                             duplicated, or an entry's details belong to another language.
     */
    public static VocabularyCorpus load(List<VocabularyEntry> source) {
        if (source == null || source.isEmpty()) {
            throw new CorpusLoadException("Corpus contains no entries.");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < source.size(); i++) {
            var entry = source.get(i);
            if (entry == null) {
                throw new CorpusLoadException("Entry #" + i + " is empty.");
            }
            requireText(entry.id(), "id", i);
            requireText(entry.surfaceForm(), "surfaceForm", i);
            requireText(entry.translation(), "translation", i);
            if (entry.language() == null) {
                throw new CorpusLoadException("Entry '" + entry.id() + "' has no language.");
            }
            if (entry.partOfSpeech() == null) {
                throw new CorpusLoadException("Entry '" + entry.id() + "' has no partOfSpeech.");
            }
            if (entry.difficultyTier() == null) {
                throw new CorpusLoadException("Entry '" + entry.id() + "' has no difficultyTier.");
            }
            if (entry.details() != null && entry.details().language() != entry.language()) {
                throw new CorpusLoadException("Entry '" + entry.id() + "' is " + entry.language()
                        + " but carries " + entry.details().language() + " details.");
            }
            if (TextNormalizer.normalizeKey(entry.surfaceForm()).isEmpty()) {
                throw new CorpusLoadException("Entry '" + entry.id() + "' has a surface form without letters.");
            }
            if (!seen.add(entry.id())) {
                throw new CorpusLoadException("Duplicate entry id '" + entry.id() + "'.");
            }
        }
        return new VocabularyCorpus(source);
    }

    /**
     * Finds the entries indexed under a token, in corpus order.
     * <p>
     * The token is normalized the same way the index keys were, so lookups are case-insensitive,
     * ignore punctuation, treat katakana and hiragana alike and accept romanized or kana spellings
     * registered as variant forms.
     * </p>
     *
     * @return Matching entries, possibly empty; never {@code null}.
     */
    public List<VocabularyEntry> lookupByToken(String token, Language language) {
        var key = TextNormalizer.normalizeKey(token);
        if (key.isEmpty()) {
            return List.of();
        }
        var index = keyIndex.get(language);
        var exact = index.getOrDefault(key, List.of());
        var compact = key.replace(" ", "");
        if (compact.equals(key)) {
            return List.copyOf(exact);
        }
        var merged = new LinkedHashSet<>(exact);
        merged.addAll(index.getOrDefault(compact, List.of()));
        return inCorpusOrder(merged);
    }

    /**
     * Splits a normalized, space-free token into corpus words, scanning left to right from its first
     * character.
     * <p>
     * At each position the longest corpus key is taken; where none starts, a grammatical ending
     * (particle, copula, polite ending) is attached to the preceding word. The scan stops at the first
     * character that is neither, and the word the scan stopped in is discarded, so "학교에" yields
     * "학교" while "저녁" and "책상" yield nothing. Tokens that are not Hangul, kana or kanji are never
     * segmented.
     * </p>
     *
     * @return Found words with their offsets inside {@code token}.
     */
    public List<WordSegment> segment(String token, Language language) {
        List<WordSegment> segments = new ArrayList<>();
        if (!GrammaticalEndings.isSegmentable(token)) {
            return segments;
        }
        var index = keyIndex.get(language);
        int longest = maxKeyLength.get(language);
        int position = 0;
        while (position < token.length()) {
            int keyEnd = -1;
            for (int end = Math.min(token.length(), position + longest); end > position; end--) {
                if (index.containsKey(token.substring(position, end))) {
                    keyEnd = end;
                    break;
                }
            }
            if (keyEnd > 0) {
                segments.add(new WordSegment(position, keyEnd, keyEnd, token.substring(position, keyEnd)));
                position = keyEnd;
                continue;
            }
            int ending = segments.isEmpty() ? 0 : GrammaticalEndings.lengthAt(token, position, language);
            if (ending > 0) {
                int last = segments.size() - 1;
                segments.set(last, segments.get(last).withEnd(position + ending));
                position += ending;
                continue;
            }
            if (!segments.isEmpty()) {
                segments.remove(segments.size() - 1);
            }
            break;
        }
        return segments;
    }

    /**
     * Draws {@code count} distinct entries of exactly {@code tier}, skipping {@code excludeIds}.
     *
     * @throws InsufficientDataException if fewer than {@code count} eligible entries exist.
     */
    public List<VocabularyEntry> sampleByDifficulty(Language language, DifficultyTier tier, int count,
                                                    Collection<String> excludeIds) {
        return sampleByDifficulty(language, tier, count, excludeIds, ThreadLocalRandom.current());
    }

    public List<VocabularyEntry> sampleByDifficulty(Language language, DifficultyTier tier, int count,
                                                    Collection<String> excludeIds, Random random) {
        if (count < 0) {
            throw new IllegalArgumentException("Sample size must not be negative: " + count);
        }
        Set<String> excluded = excludeIds == null ? Set.of() : Set.copyOf(excludeIds);
        List<VocabularyEntry> eligible = new ArrayList<>();
        for (VocabularyEntry entry : tierIndex.get(language).get(tier)) {
            if (!excluded.contains(entry.id())) {
                eligible.add(entry);
            }
        }
        if (eligible.size() < count) {
            throw new InsufficientDataException(language, tier, count, eligible.size());
        }
        Collections.shuffle(eligible, random);
        return List.copyOf(eligible.subList(0, count));
    }

    public Optional<VocabularyEntry> findById(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    /**
     * Insertion position of an entry, the deterministic last tie-breaker of matching.
     */
    public int positionOf(VocabularyEntry entry) {
        return positionById.getOrDefault(entry.id(), Integer.MAX_VALUE);
    }

    public List<VocabularyEntry> entries() {
        return entries;
    }

    public List<VocabularyEntry> entries(Language language) {
        return entries.stream().filter(entry -> entry.language() == language).toList();
    }

    public List<VocabularyEntry> entries(Language language, DifficultyTier tier) {
        return Collections.unmodifiableList(tierIndex.get(language).get(tier));
    }

    public int size() {
        return entries.size();
    }

    public Map<Language, Integer> countByLanguage() {
        Map<Language, Integer> counts = new LinkedHashMap<>();
        for (Language language : Language.values()) {
            int total = 0;
            for (List<VocabularyEntry> tierEntries : tierIndex.get(language).values()) {
                total += tierEntries.size();
            }
            counts.put(language, total);
        }
        return counts;
    }

    private List<VocabularyEntry> inCorpusOrder(Collection<VocabularyEntry> found) {
        List<VocabularyEntry> ordered = new ArrayList<>(found);
        ordered.sort(Comparator.comparingInt(this::positionOf));
        return List.copyOf(ordered);
    }

    private static Set<String> indexKeys(VocabularyEntry entry) {
        List<String> forms = new ArrayList<>();
        forms.add(entry.surfaceForm());
        forms.add(entry.canonicalForm());
        if (entry.details() != null) {
            forms.addAll(entry.details().variantForms());
        }
        Set<String> keys = new LinkedHashSet<>();
        for (String form : forms) {
            var key = TextNormalizer.normalizeKey(form);
            if (!key.isEmpty()) {
                keys.add(key);
                keys.add(key.replace(" ", ""));
            }
        }
        return keys;
    }

    private static void requireText(String value, String field, int index) {
        if (value == null || value.isBlank()) {
            throw new CorpusLoadException("Entry #" + index + " is missing '" + field + "'.");
        }
    }
}
