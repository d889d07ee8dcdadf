package com.z254.campusvoice.voice.voting;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a vote request did to the voter's existing vote.
 */
public enum VoteAction {

    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted");

    private final String label;

    VoteAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
