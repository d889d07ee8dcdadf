package com.z254.campusvoice.voice.domain.exception;

public class InvalidVoteTypeException extends InvalidInputException {

    public InvalidVoteTypeException(String voteType) {
        super("Invalid vote type '" + voteType + "'. Must be 'upvote' or 'downvote'");
    }
}
