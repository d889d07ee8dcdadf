package com.z254.campusvoice.voice.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Feed entry with a shortened description.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComplaintSummaryDto {
    private String id;
    private String title;
    private String description;
    private String status;
    private String priority;
    private int priorityScore;
    private String category;
    private String assignedAuthority;
    private int upvotes;
    private int downvotes;
    private int netVotes;
    private Instant submittedAt;
    private Instant resolvedAt;
}
