package com.z254.campusvoice.voice.voting;

import com.z254.campusvoice.voice.domain.model.VoteType;

/**
 * State of a single (complaint, voter) pair.
 * <p>
 * Transitions:
 * <pre>
 *   NONE      --upvote-->   UPVOTED    (created)
 *   NONE      --downvote--> DOWNVOTED  (created)
 *   UPVOTED   --upvote-->   NONE       (deleted)
 *   UPVOTED   --downvote--> DOWNVOTED  (updated)
 *   DOWNVOTED --downvote--> NONE       (deleted)
 *   DOWNVOTED --upvote-->   UPVOTED    (updated)
 * </pre>
 */
public enum VoteState {

    NONE,
    UPVOTED,
    DOWNVOTED;

    public static VoteState of(VoteType existing) {
        if (existing == null) {
            return NONE;
        }
        return existing == VoteType.UPVOTE ? UPVOTED : DOWNVOTED;
    }

    public VoteAction actionFor(VoteType requested) {
        if (this == NONE) {
            return VoteAction.CREATED;
        }
        return heldType() == requested ? VoteAction.DELETED : VoteAction.UPDATED;
    }

    public VoteState next(VoteType requested) {
        return switch (actionFor(requested)) {
            case DELETED -> NONE;
            case CREATED, UPDATED -> of(requested);
        };
    }

    /**
     * Vote type held in this state, or null for {@link #NONE}.
     */
    public VoteType heldType() {
        return switch (this) {
            case NONE -> null;
            case UPVOTED -> VoteType.UPVOTE;
            case DOWNVOTED -> VoteType.DOWNVOTE;
        };
    }
}
