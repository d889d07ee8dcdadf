package com.z254.campusvoice.voice.scoring;

import com.z254.campusvoice.voice.domain.model.Priority;

/**
 * Numeric priority score and the label it maps to.
 */
public record PriorityScore(int score, Priority label) {
}
