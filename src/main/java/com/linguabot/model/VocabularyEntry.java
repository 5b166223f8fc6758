package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A lexical item or phrase of the tutoring corpus.
 * <p>
 * Entries are immutable once loaded and are owned by the
 * {@link com.linguabot.corpus.VocabularyCorpus} snapshot that indexed them.
 * </p>
 *
 * @param id             Stable, corpus-unique identifier. Never shown to the learner.
 * @param language       The language the entry belongs to.
 * @param surfaceForm    The form as it usually appears in text (e.g. "먹어요").
 * @param canonicalForm  The dictionary form (e.g. "먹다"). Defaults to the surface form.
 * @param translation    The English gloss.
 * @param partOfSpeech   Grammatical category, used to select grammar rules.
 * @param difficultyTier Proficiency bucket.
 * @param usageExamples  Example sentences, most useful first.
 * @param culturalNote   Optional note on usage etiquette.
 * @param intent         The intent the phrase itself expresses (greetings), or {@code null}.
 * @param details        Korean- or Japanese-specific metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VocabularyEntry(
        String id,
        Language language,
        String surfaceForm,
        String canonicalForm,
        String translation,
        PartOfSpeech partOfSpeech,
        DifficultyTier difficultyTier,
        List<String> usageExamples,
        String culturalNote,
        Intent intent,
        LanguageDetails details) {

    public VocabularyEntry {
        usageExamples = usageExamples == null ? Collections.emptyList() : List.copyOf(usageExamples);
        if (canonicalForm == null || canonicalForm.isBlank()) {
            canonicalForm = surfaceForm;
        }
    }

    public Optional<String> culturalNoteText() {
        return culturalNote == null || culturalNote.isBlank() ? Optional.empty() : Optional.of(culturalNote);
    }

    public Optional<String> firstExample() {
        return usageExamples.isEmpty() ? Optional.empty() : Optional.of(usageExamples.get(0));
    }
}
