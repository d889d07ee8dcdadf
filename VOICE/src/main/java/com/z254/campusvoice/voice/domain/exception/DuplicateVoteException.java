package com.z254.campusvoice.voice.domain.exception;

/**
 * Unique (complaint, voter) constraint violated on insert.
 */
public class DuplicateVoteException extends RuntimeException {

    public DuplicateVoteException(String complaintId, String voterId) {
        super("Vote already exists for complaint " + complaintId + " and voter " + voterId);
    }
}
