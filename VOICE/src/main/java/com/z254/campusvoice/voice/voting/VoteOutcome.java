package com.z254.campusvoice.voice.voting;

import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.domain.model.VoteType;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a committed vote.
 */
@Data
@Builder
public class VoteOutcome {

    private String complaintId;

    private String voterId;

    /** Vote type that was requested */
    private VoteType voteType;

    private VoteAction action;

    private int upvotes;

    private int downvotes;

    private boolean priorityUpdated;

    /** Set only when the priority label changed */
    private Priority oldPriority;

    /** Set only when the priority label changed */
    private Priority newPriority;

    private int priorityScore;

    public int getNetVotes() {
        return upvotes - downvotes;
    }

    public int getTotalVotes() {
        return upvotes + downvotes;
    }

    /**
     * Human readable summary, e.g. "Upvote added" or "Vote changed to downvote".
     */
    public String getMessage() {
        String type = voteType.getLabel();
        String capitalized = Character.toUpperCase(type.charAt(0)) + type.substring(1);
        return switch (action) {
            case CREATED -> capitalized + " added";
            case DELETED -> capitalized + " removed";
            case UPDATED -> "Vote changed to " + type;
        };
    }
}
