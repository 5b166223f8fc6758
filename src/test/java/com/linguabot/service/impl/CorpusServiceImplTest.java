package com.linguabot.service.impl;

import com.linguabot.TestFixtures;
import com.linguabot.exception.CorpusLoadException;
import com.linguabot.model.CorpusDocument;
import com.linguabot.model.Language;
import com.linguabot.model.VocabularyEntry;
import com.linguabot.service.api.TutorStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CorpusServiceImplTest {

    @Mock
    private TutorStorage storage;

    private CorpusServiceImpl service;
    private CorpusDocument document;

    @BeforeEach
    void setUp() {
        service = new CorpusServiceImpl(storage, Clock.fixed(TestFixtures.LOADED_AT, ZoneOffset.UTC));
        document = TestFixtures.document();
    }

    @Test
    @DisplayName("Reading the corpus before it is loaded should fail")
    void testNotLoaded() {
        assertThatThrownBy(service::current).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A reload should publish a new snapshot with the next generation")
    void testReloadSwapsSnapshot() {
        var smaller = new CorpusDocument(document.entries().subList(0, 10), document.intentRules(),
                document.grammarRules(), document.replyTemplates(), document.clarificationPrompts());
        when(storage.loadCorpus()).thenReturn(document, smaller);

        service.loadInitialCorpus();
        var first = service.current();
        var second = service.reload();

        assertThat(first.generation()).isEqualTo(1L);
        assertThat(first.vocabulary().size()).isEqualTo(29);
        assertThat(first.loadedAt()).isEqualTo(TestFixtures.LOADED_AT);
        assertThat(second.generation()).isEqualTo(2L);
        assertThat(service.current()).isSameAs(second);
        assertThat(service.current().vocabulary().size()).isEqualTo(10);
        // readers holding the old snapshot keep a complete view
        assertThat(first.vocabulary().entries(Language.JAPANESE)).hasSize(11);
    }

    @Test
    @DisplayName("A failed reload should keep the previous snapshot in effect")
    void testFailedReloadKeepsSnapshot() {
        List<VocabularyEntry> duplicated = new ArrayList<>(document.entries());
        duplicated.add(document.entries().get(0));
        var invalid = new CorpusDocument(duplicated, document.intentRules(), document.grammarRules(),
                document.replyTemplates(), document.clarificationPrompts());
        when(storage.loadCorpus())
                .thenReturn(document, invalid)
                .thenThrow(new CorpusLoadException("Corpus resource not found: test"))
                .thenReturn(document);

        service.loadInitialCorpus();
        var loaded = service.current();

        assertThatThrownBy(service::reload).isInstanceOf(CorpusLoadException.class);
        assertThatThrownBy(service::reload).isInstanceOf(CorpusLoadException.class);
        assertThat(service.current()).isSameAs(loaded);
        assertThat(service.reload().generation()).isEqualTo(2L);
    }
}
