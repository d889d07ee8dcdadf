package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the broadcast registry.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegistryStats {
    private int activeComplaints;
    private int totalActiveConnections;
    private long totalConnectionsEver;
    private long totalDisconnections;
    private List<String> complaintsBeingWatched;
    private Map<String, Integer> connectionsPerComplaint;
}
