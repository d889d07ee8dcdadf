package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.exception.DuplicateVoteException;
import com.z254.campusvoice.voice.domain.model.Vote;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for votes, unique per (complaint, voter).
 */
public interface VoteRepository {

    /**
     * Insert a new vote.
     *
     * @throws DuplicateVoteException if the voter already has a vote on the complaint
     */
    Vote insert(Vote vote);

    /**
     * Replace an existing vote.
     */
    Vote update(Vote vote);

    void delete(String complaintId, String voterId);

    Optional<Vote> find(String complaintId, String voterId);

    List<Vote> findByComplaint(String complaintId);

    long count();
}
