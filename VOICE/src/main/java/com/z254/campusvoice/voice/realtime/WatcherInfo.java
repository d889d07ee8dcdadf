package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WatcherInfo {
    private String complaintId;
    private String channelId;
    private Instant connectedAt;
    private Map<String, String> clientInfo;
}
