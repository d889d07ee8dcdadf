package com.z254.campusvoice.voice.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Platform-wide counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OverallStatsDto {
    private long totalComplaints;
    private long totalVotes;
    private long totalVoters;
    private long totalStatusChanges;
    private Map<String, Long> byStatus;
    private Map<String, Long> byPriority;
    private int activeRealtimeConnections;
}
