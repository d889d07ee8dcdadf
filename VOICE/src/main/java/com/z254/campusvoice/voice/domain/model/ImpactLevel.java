package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * How many people a complaint affects, with its score bonus.
 */
public enum ImpactLevel {

    INDIVIDUAL("individual", 50),
    GROUP("group", 150),
    CAMPUS_WIDE("campus-wide", 300);

    private final String label;
    private final int bonus;

    ImpactLevel(String label, int bonus) {
        this.label = label;
        this.bonus = bonus;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getBonus() {
        return bonus;
    }

    public static Optional<ImpactLevel> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(i -> i.label.equals(normalized))
                .findFirst();
    }
}
