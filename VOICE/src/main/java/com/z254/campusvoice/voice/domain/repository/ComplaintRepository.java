package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.Complaint;

import java.util.List;
import java.util.Optional;

/**
 * Repository abstraction for complaint persistence.
 */
public interface ComplaintRepository {

    /**
     * Persist the given complaint. Existing complaints are replaced.
     */
    Complaint save(Complaint complaint);

    /**
     * Look up a complaint by ID. The result is a detached copy.
     */
    Optional<Complaint> findById(String id);

    /**
     * Retrieve all complaints as detached copies.
     */
    List<Complaint> findAll();

    long count();
}
