package com.linguabot.service.api;

import com.linguabot.model.ConversationContext;
import com.linguabot.model.CorpusDocument;
import com.linguabot.model.ProficiencyRecord;
import com.linguabot.model.TestInstance;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator of the tutoring core.
 * <p>
 * The core never assumes a particular database. Implementations persist the entity shapes of the
 * model package however they like, and return independent copies: mutating a loaded object has no
 * effect until it is saved again.
 * </p>
 */
public interface TutorStorage {

    /**
     * Reads the raw corpus and its rule tables.
     *
     * @throws com.linguabot.exception.CorpusLoadException if the source is missing or unreadable.
     */
    CorpusDocument loadCorpus();

    void saveContext(String userId, ConversationContext context);

    Optional<ConversationContext> loadContext(String userId);

    void saveProficiency(String userId, ProficiencyRecord record);

    Optional<ProficiencyRecord> loadProficiency(String userId);

    List<ProficiencyRecord> loadAllProficiency();

    void saveTestInstance(TestInstance instance);

    Optional<TestInstance> loadTestInstance(String testId);
}
