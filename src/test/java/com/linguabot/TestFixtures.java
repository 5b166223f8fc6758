package com.linguabot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.linguabot.corpus.ContentSnapshot;
import com.linguabot.model.CorpusDocument;
import com.linguabot.service.impl.JsonTutorStorage;
import org.springframework.core.io.ClassPathResource;

import java.time.Instant;

/**
 * Shared fixtures: the small test corpus under {@code src/test/resources/corpus} and a Jackson mapper
 * configured like the application's.
 * <p>
 * The test corpus holds 8/5/5 Korean and 6/3/2 Japanese entries per tier (beginner/intermediate/advanced).
 * </p>
 */
public final class TestFixtures {

    public static final String TEST_CORPUS = "corpus/test-corpus.json";
    public static final Instant LOADED_AT = Instant.parse("2024-05-01T09:00:00Z");

    private TestFixtures() {
    }

    public static ObjectMapper objectMapper() {
        return JsonMapper.builder().findAndAddModules().build();
    }

    public static JsonTutorStorage memoryStorage() {
        return new JsonTutorStorage(objectMapper(), new ClassPathResource(TEST_CORPUS), "");
    }

    public static CorpusDocument document() {
        return memoryStorage().loadCorpus();
    }

    public static ContentSnapshot snapshot() {
        return ContentSnapshot.build(document(), LOADED_AT, 1);
    }
}
