package com.z254.campusvoice.voice.domain.exception;

/**
 * A request value the service cannot interpret.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
