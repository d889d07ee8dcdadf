package com.z254.campusvoice.voice.domain.exception;

/**
 * Storage failure that is expected to succeed on retry.
 */
public class TransientPersistenceException extends RuntimeException {

    public TransientPersistenceException(String message) {
        super(message);
    }

    public TransientPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
