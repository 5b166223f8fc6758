package com.linguabot.service.api;

import com.linguabot.corpus.ContentSnapshot;

/**
 * Owns the current generation of tutoring content.
 * <p>
 * The service hands out immutable {@link ContentSnapshot}s. A reload builds a complete new snapshot
 * from the storage collaborator and publishes it with a single reference swap: concurrent readers
 * observe either the old or the new snapshot in full, never a mix.
 * </p>
 */
public interface CorpusService {

    /**
     * Returns the snapshot currently in effect.
     *
     * @throws IllegalStateException if no corpus has been loaded yet.
     */
    ContentSnapshot current();

    /**
     * Loads the corpus again and atomically replaces the current snapshot.
     * <p>
     * If the new content is invalid the previous snapshot stays active.
     * </p>
     *
     * @return The snapshot now in effect.
     * @throws com.linguabot.exception.CorpusLoadException if the new content is malformed.
     */
    ContentSnapshot reload();
}
