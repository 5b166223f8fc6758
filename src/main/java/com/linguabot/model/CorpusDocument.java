package com.linguabot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Raw content as delivered by the storage collaborator: vocabulary entries plus the rule tables
 * loaded alongside them. Validation and indexing happen when a snapshot is built from it.
 *
 * @param entries              Vocabulary entries in corpus order.
 * @param intentRules          Intent classification rules, evaluated in order.
 * @param grammarRules         Grammar checks, evaluated in order.
 * @param replyTemplates       Reply template per intent name.
 * @param clarificationPrompts Clarification prompts per intent name, plus a {@code DEFAULT} list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusDocument(
        List<VocabularyEntry> entries,
        List<IntentRule> intentRules,
        List<GrammarRule> grammarRules,
        Map<String, String> replyTemplates,
        Map<String, List<String>> clarificationPrompts) {

    public CorpusDocument {
        entries = entries == null ? Collections.emptyList() : entries;
        intentRules = intentRules == null ? Collections.emptyList() : intentRules;
        grammarRules = grammarRules == null ? Collections.emptyList() : grammarRules;
        replyTemplates = replyTemplates == null ? Collections.emptyMap() : replyTemplates;
        clarificationPrompts = clarificationPrompts == null ? Collections.emptyMap() : clarificationPrompts;
    }
}
