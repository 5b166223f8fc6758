package com.linguabot.service.impl;

import com.linguabot.corpus.ContentSnapshot;
import com.linguabot.service.api.CorpusService;
import com.linguabot.service.api.TutorStorage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default {@link CorpusService}: builds snapshots from {@link TutorStorage#loadCorpus()} and publishes
 * them through an {@link AtomicReference}.
 */
@Service
public class CorpusServiceImpl implements CorpusService {

    private static final Logger log = LoggerFactory.getLogger(CorpusServiceImpl.class);

    private final TutorStorage storage;
    private final Clock clock;
    private final AtomicReference<ContentSnapshot> current = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();

    public CorpusServiceImpl(TutorStorage storage, Clock clock) {
        this.storage = storage;
        this.clock = clock;
    }

    /**
     * Loads the corpus at startup. A malformed corpus aborts the application context.
     */
    @PostConstruct
    public void loadInitialCorpus() {
        reload();
    }

    @Override
    public ContentSnapshot current() {
        var snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("The vocabulary corpus has not been loaded.");
        }
        return snapshot;
    }

    @Override
    public synchronized ContentSnapshot reload() {
        var document = storage.loadCorpus();
        var snapshot = ContentSnapshot.build(document, clock.instant(), generations.get() + 1);
        generations.incrementAndGet();
        current.set(snapshot);
        log.info("Corpus generation {} loaded: {} entries {}, {} intent rules, {} grammar rules",
                snapshot.generation(), snapshot.vocabulary().size(), snapshot.vocabulary().countByLanguage(),
                snapshot.rules().intentRules().size(), snapshot.rules().grammarRules().size());
        return snapshot;
    }
}
