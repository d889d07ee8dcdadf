package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Coarse priority label derived from the numeric priority score.
 */
public enum Priority {

    LOW("low", 100, 0),
    MEDIUM("medium", 300, 300),
    HIGH("high", 700, 700),
    CRITICAL("critical", 1500, 1500);

    private final String label;
    /** Base score contributed when the classifier reports this priority */
    private final int baseScore;
    /** Lowest score that maps to this label */
    private final int threshold;

    Priority(String label, int baseScore, int threshold) {
        this.label = label;
        this.baseScore = baseScore;
        this.threshold = threshold;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getBaseScore() {
        return baseScore;
    }

    public int getThreshold() {
        return threshold;
    }

    /**
     * Highest-ranked label whose threshold the score reaches.
     */
    public static Priority forScore(int score) {
        Priority result = LOW;
        for (Priority priority : values()) {
            if (score >= priority.threshold) {
                result = priority;
            }
        }
        return result;
    }

    /**
     * Exact wire label, as accepted from API callers.
     */
    public static Optional<Priority> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.label.equals(value))
                .findFirst();
    }

    /**
     * Label as reported by the classifier, ignoring case and surrounding blanks.
     */
    public static Optional<Priority> fromReportedLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return fromLabel(value.trim().toLowerCase(Locale.ROOT));
    }
}
