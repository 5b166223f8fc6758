package com.linguabot.exception;

/**
 * The corpus or its rule tables are malformed (missing fields, duplicate ids, invalid patterns)
 * or could not be read. Fatal at startup; on reload the previous snapshot stays active.
 */
public class CorpusLoadException extends TutorException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
