package com.linguabot.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linguabot.exception.CorpusLoadException;
import com.linguabot.model.ConversationContext;
import com.linguabot.model.CorpusDocument;
import com.linguabot.model.ProficiencyRecord;
import com.linguabot.model.TestInstance;
import com.linguabot.service.api.TutorStorage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link TutorStorage} backed by Jackson.
 * <p>
 * Every saved object is kept as its JSON text, so each load hands out an independent copy. When
 * {@code app.storage.directory} is set, saves are also written to
 * {@code <dir>/contexts|proficiency|tests/<id>.json} and the files are read back on startup.
 * With a blank directory the state lives for the lifetime of the process only.
 * </p>
 */
@Service
public class JsonTutorStorage implements TutorStorage {

    private static final Logger log = LoggerFactory.getLogger(JsonTutorStorage.class);

    private static final String JSON_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final Resource corpusLocation;
    private final Path directory;

    private final Map<String, String> contexts = new ConcurrentHashMap<>();
    private final Map<String, String> proficiency = new ConcurrentHashMap<>();
    private final Map<String, String> tests = new ConcurrentHashMap<>();

    public JsonTutorStorage(ObjectMapper objectMapper,
                            @Value("${app.corpus.location:classpath:corpus/corpus.json}") Resource corpusLocation,
                            @Value("${app.storage.directory:}") String directory) {
        this.objectMapper = objectMapper;
        this.corpusLocation = corpusLocation;
        this.directory = directory == null || directory.isBlank() ? null : Path.of(directory);
    }

    /**
     * Restores previously written state from the storage directory, if one is configured.
     */
    @PostConstruct
    public void restore() {
        if (directory == null) {
            log.info("No storage directory configured; learner state is kept in memory only");
            return;
        }
        restoreBucket("contexts", contexts);
        restoreBucket("proficiency", proficiency);
        restoreBucket("tests", tests);
        log.info("Restored {} contexts, {} proficiency records and {} tests from {}",
                contexts.size(), proficiency.size(), tests.size(), directory);
    }

    @Override
    public CorpusDocument loadCorpus() {
        if (!corpusLocation.exists()) {
            throw new CorpusLoadException("Corpus resource not found: " + corpusLocation.getDescription());
        }
        log.info("Loading corpus from {}", corpusLocation.getDescription());
        try (InputStream in = corpusLocation.getInputStream()) {
            return objectMapper.readValue(in, CorpusDocument.class);
        } catch (IOException e) {
            log.error("Failed to read corpus {}: {}", corpusLocation.getDescription(), e.getMessage());
            throw new CorpusLoadException("Could not read corpus: " + e.getMessage(), e);
        }
    }

    @Override
    public void saveContext(String userId, ConversationContext context) {
        store("contexts", contexts, userId, context);
    }

    @Override
    public Optional<ConversationContext> loadContext(String userId) {
        return read(contexts.get(userId), ConversationContext.class);
    }

    @Override
    public void saveProficiency(String userId, ProficiencyRecord record) {
        store("proficiency", proficiency, userId, record);
    }

    @Override
    public Optional<ProficiencyRecord> loadProficiency(String userId) {
        return read(proficiency.get(userId), ProficiencyRecord.class);
    }

    @Override
    public List<ProficiencyRecord> loadAllProficiency() {
        List<ProficiencyRecord> records = new ArrayList<>();
        for (String json : proficiency.values()) {
            read(json, ProficiencyRecord.class).ifPresent(records::add);
        }
        return records;
    }

    @Override
    public void saveTestInstance(TestInstance instance) {
        store("tests", tests, instance.getTestId(), instance);
    }

    @Override
    public Optional<TestInstance> loadTestInstance(String testId) {
        return read(tests.get(testId), TestInstance.class);
    }

    private void store(String bucket, Map<String, String> target, String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + bucket + " entry '" + key + "'", e);
        }
        target.put(key, json);
        if (directory != null) {
            writeThrough(bucket, key, json);
        }
    }

    private <T> Optional<T> read(String json, Class<T> type) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Stored {} could not be read back: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private void writeThrough(String bucket, String key, String json) {
        var file = directory.resolve(bucket).resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + JSON_SUFFIX);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {} to {}: {}", bucket, file, e.getMessage());
        }
    }

    private void restoreBucket(String bucket, Map<String, String> target) {
        var folder = directory.resolve(bucket);
        if (!Files.isDirectory(folder)) {
            return;
        }
        try (Stream<Path> files = Files.list(folder)) {
            files.filter(file -> file.getFileName().toString().endsWith(JSON_SUFFIX)).forEach(file -> {
                var name = file.getFileName().toString();
                var key = URLDecoder.decode(name.substring(0, name.length() - JSON_SUFFIX.length()),
                        StandardCharsets.UTF_8);
                try {
                    target.put(key, Files.readString(file, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to restore {} from {}: {}", bucket, folder, e.getMessage());
        }
    }
}
