package com.linguabot.exception;

/**
 * An action was attempted against a test in a state that does not accept it, for example an
 * answer submitted after the deadline. Not fatal: the action is rejected and nothing changes.
 */
public class InvalidStateException extends TutorException {

    public InvalidStateException(String message) {
        super(message);
    }
}
