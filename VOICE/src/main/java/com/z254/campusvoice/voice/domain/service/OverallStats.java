package com.z254.campusvoice.voice.domain.service;

import java.util.Map;

public record OverallStats(long totalComplaints,
                           long totalVotes,
                           long totalVoters,
                           long totalStatusChanges,
                           Map<String, Long> byStatus,
                           Map<String, Long> byPriority) {
}
