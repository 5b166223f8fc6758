package com.linguabot.corpus;

import com.linguabot.model.CorpusDocument;

import java.time.Instant;

/**
 * A complete, immutable generation of tutoring content: the vocabulary and the rule tables loaded
 * with it. Readers hold one snapshot for the duration of a request, so a reload is never observed
 * half-applied.
 *
 * @param vocabulary The indexed vocabulary.
 * @param rules      The compiled rule tables.
 * @param loadedAt   When the snapshot was built.
 * @param generation Monotonic snapshot number, 1 for the first load.
 */
public record ContentSnapshot(VocabularyCorpus vocabulary, RuleBook rules, Instant loadedAt, long generation) {

    public static ContentSnapshot build(CorpusDocument document, Instant loadedAt, long generation) {
        var vocabulary = VocabularyCorpus.load(document.entries());
        var rules = RuleBook.from(document);
        return new ContentSnapshot(vocabulary, rules, loadedAt, generation);
    }
}
