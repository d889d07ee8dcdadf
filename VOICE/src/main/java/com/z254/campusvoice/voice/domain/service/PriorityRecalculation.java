package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.Priority;

/**
 * Outcome of an explicit priority recalculation.
 */
public record PriorityRecalculation(Complaint complaint, Priority oldPriority, Priority newPriority, int score) {

    public boolean changed() {
        return oldPriority != newPriority;
    }
}
