package com.z254.campusvoice.voice.classification;

/**
 * Classifier returned something that is not a usable classification.
 */
public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
