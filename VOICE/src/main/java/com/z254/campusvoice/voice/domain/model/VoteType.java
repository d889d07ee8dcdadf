package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum VoteType {

    UPVOTE("upvote"),
    DOWNVOTE("downvote");

    private final String label;

    VoteType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public VoteType opposite() {
        return this == UPVOTE ? DOWNVOTE : UPVOTE;
    }

    public static Optional<VoteType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(t -> t.label.equals(value))
                .findFirst();
    }
}
