package com.z254.campusvoice.voice.domain.exception;

public class InvalidStatusException extends InvalidInputException {

    public InvalidStatusException(String status) {
        super("Invalid status '" + status + "'. Must be one of: raised, opened, reviewed, closed");
    }
}
