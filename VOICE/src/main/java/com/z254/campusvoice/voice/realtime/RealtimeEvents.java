package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Messages pushed over the vote feed.
 */
public final class RealtimeEvents {

    public static final String CONNECTION = "connection";
    public static final String VOTE_UPDATE = "vote_update";
    public static final String STATUS_UPDATE = "status_update";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    private RealtimeEvents() {
    }

    public static ConnectionEvent connection(String complaintId) {
        return ConnectionEvent.builder()
                .complaintId(complaintId)
                .message("Connected to vote feed")
                .timestamp(now())
                .build();
    }

    public static HeartbeatEvent ping() {
        return new HeartbeatEvent(PING, now());
    }

    public static HeartbeatEvent pong() {
        return new HeartbeatEvent(PONG, now());
    }

    static String now() {
        return Instant.now().toString();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ConnectionEvent {
        @Builder.Default
        private String type = CONNECTION;
        private String complaintId;
        private String message;
        private String timestamp;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VoteUpdateEvent {
        @Builder.Default
        private String type = VOTE_UPDATE;
        private String complaintId;
        private int upvotes;
        private int downvotes;
        private int totalVotes;
        /** created, updated or deleted */
        private String action;
        private String voteType;
        private Boolean priorityUpdated;
        private String newPriority;
        @Builder.Default
        private String timestamp = now();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StatusUpdateEvent {
        @Builder.Default
        private String type = STATUS_UPDATE;
        private String complaintId;
        private String oldStatus;
        private String newStatus;
        private String updatedBy;
        private String reason;
        @Builder.Default
        private String timestamp = now();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HeartbeatEvent {
        private String type;
        private String timestamp;
    }
}
