package com.z254.campusvoice.voice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single student's vote on a complaint. Unique per (complaint, voter).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Vote {

    private String complaintId;

    private String voterId;

    private VoteType voteType;

    private Instant createdAt;

    /** Last time the vote switched type */
    private Instant updatedAt;

    public Vote copy() {
        return toBuilder().build();
    }
}
