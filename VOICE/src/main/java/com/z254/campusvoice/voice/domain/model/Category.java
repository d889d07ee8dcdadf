package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Complaint category as reported by the classifier.
 */
public enum Category {

    FOOD("food"),
    INFRASTRUCTURE("infrastructure"),
    ACADEMIC("academic"),
    HOSTEL("hostel"),
    TRANSPORT("transport"),
    OTHER("other");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Strict lookup, used where an unknown key is a client error.
     */
    public static Optional<Category> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.label.equals(normalized))
                .findFirst();
    }

    /**
     * Lenient lookup: anything unrecognized is {@link #OTHER}.
     */
    public static Category from(String value) {
        return fromLabel(value).orElse(OTHER);
    }
}
