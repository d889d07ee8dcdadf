package com.z254.campusvoice.voice.domain.exception;

/**
 * A vote kept colliding with a concurrent vote from the same voter.
 */
public class VoteConflictException extends RuntimeException {

    public VoteConflictException(String complaintId, String voterId, Throwable cause) {
        super("Concurrent vote conflict for complaint " + complaintId + " and voter " + voterId, cause);
    }
}
