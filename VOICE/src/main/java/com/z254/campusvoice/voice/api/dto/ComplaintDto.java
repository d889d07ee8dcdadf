package com.z254.campusvoice.voice.api.dto;

import com.z254.campusvoice.voice.domain.model.Classification;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Full complaint view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ComplaintDto {
    private String id;
    private String title;
    private String description;
    private String visibility;
    private String status;
    private String priority;
    private int priorityScore;
    private String category;
    private String assignedAuthority;
    private String authorityEmail;
    private String authorityDepartment;
    private int upvotes;
    private int downvotes;
    private int netVotes;
    private String submitterId;
    private String imageUrl;
    private Classification classification;
    private Instant submittedAt;
    private Instant updatedAt;
    private Instant resolvedAt;
}
