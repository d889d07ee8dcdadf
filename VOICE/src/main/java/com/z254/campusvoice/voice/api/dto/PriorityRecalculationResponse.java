package com.z254.campusvoice.voice.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PriorityRecalculationResponse {
    private String complaintId;
    private String oldPriority;
    private String newPriority;
    private int priorityScore;
    private boolean priorityChanged;
    private int upvotes;
    private int downvotes;
}
