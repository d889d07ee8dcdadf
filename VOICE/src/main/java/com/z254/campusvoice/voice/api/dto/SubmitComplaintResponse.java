package com.z254.campusvoice.voice.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Returned after a complaint is accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubmitComplaintResponse {
    private String complaintId;
    private String title;
    private String priority;
    private int priorityScore;
    private String category;
    private Integer urgencyScore;
    private String assignedTo;
    private String authorityEmail;
    private String authorityDepartment;
    private String summary;
    private String status;
    private String visibility;
    private Instant submittedAt;
}
