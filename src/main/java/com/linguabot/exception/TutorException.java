package com.linguabot.exception;

/**
 * Base type of all failures the tutoring engine reports to its callers.
 */
public class TutorException extends RuntimeException {

    public TutorException(String message) {
        super(message);
    }

    public TutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
