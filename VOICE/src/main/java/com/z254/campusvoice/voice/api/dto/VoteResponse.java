package com.z254.campusvoice.voice.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a vote request. Old and new priority are only present when the label changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class VoteResponse {
    private String complaintId;
    private String message;
    private String action;
    private String voteType;
    private int upvotes;
    private int downvotes;
    private int netVotes;
    private boolean priorityUpdated;
    private String oldPriority;
    private String newPriority;
    private int priorityScore;
}
