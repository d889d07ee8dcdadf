package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.Voter;

import java.util.Optional;

/**
 * Repository abstraction for student profiles.
 * <p>
 * Both write operations are single atomic upserts; there is no separate
 * exists-then-insert path.
 */
public interface VoterRepository {

    /**
     * Insert the profile, or merge its non-null fields into the existing one.
     */
    Voter upsert(Voter profile);

    /**
     * Register a bare voter id if it is not known yet. Existing profiles are untouched.
     */
    Voter registerIfAbsent(String voterId);

    Optional<Voter> findById(String voterId);

    long count();
}
