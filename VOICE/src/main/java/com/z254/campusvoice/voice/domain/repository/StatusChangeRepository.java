package com.z254.campusvoice.voice.domain.repository;

import com.z254.campusvoice.voice.domain.model.StatusChange;

import java.util.List;

/**
 * Append-only store for status audit records.
 */
public interface StatusChangeRepository {

    StatusChange append(StatusChange change);

    /**
     * Audit trail for a complaint, oldest first.
     */
    List<StatusChange> findByComplaint(String complaintId);

    long count();
}
