package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Complaint lifecycle status. Transitions between any two values are allowed.
 */
public enum ComplaintStatus {

    RAISED("raised"),
    OPENED("opened"),
    REVIEWED("reviewed"),
    CLOSED("closed");

    private final String label;

    ComplaintStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<ComplaintStatus> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.label.equals(value))
                .findFirst();
    }
}
