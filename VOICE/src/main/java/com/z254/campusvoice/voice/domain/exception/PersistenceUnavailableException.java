package com.z254.campusvoice.voice.domain.exception;

/**
 * Storage kept failing after all retry attempts.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String operation, Throwable cause) {
        super("Storage unavailable during " + operation, cause);
    }
}
