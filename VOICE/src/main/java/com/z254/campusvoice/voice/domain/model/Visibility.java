package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Visibility {

    PUBLIC("Public"),
    PRIVATE("Private");

    private final String label;

    Visibility(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static Optional<Visibility> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(v -> v.label.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
