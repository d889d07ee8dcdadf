package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.StatusChange;

/**
 * Complaint state after a status update together with its audit record.
 */
public record StatusUpdateResult(Complaint complaint, StatusChange change) {
}
