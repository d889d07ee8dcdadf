package com.z254.campusvoice.voice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit record of a status update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChange {

    private String id;

    private String complaintId;

    private ComplaintStatus oldStatus;

    private ComplaintStatus newStatus;

    /** Caller-supplied identifier of whoever made the change */
    private String actor;

    private String reason;

    private Instant timestamp;
}
