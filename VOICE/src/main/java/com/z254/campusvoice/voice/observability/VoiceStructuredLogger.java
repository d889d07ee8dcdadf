package com.z254.campusvoice.voice.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for VOICE service.
 * <p>
 * Emits domain events as {@code message | data={...}} with the complaint id
 * in MDC, so log shippers can index them without parsing free text.
 */
@Slf4j
@Component
public class VoiceStructuredLogger {

    // MDC keys
    public static final String MDC_COMPLAINT_ID = "complaintId";
    public static final String MDC_VOTER_ID = "voterId";
    public static final String MDC_CHANNEL_ID = "channelId";

    /**
     * Log a complaint lifecycle event.
     */
    public void logComplaintEvent(String complaintId, ComplaintEventType eventType,
                                  String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_COMPLAINT_ID, complaintId))) {
            Map<String, Object> logData = eventData(eventType.name(), complaintId, details);

            switch (eventType) {
                case CLASSIFICATION_FALLBACK ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a vote ledger event.
     */
    public void logVoteEvent(String complaintId, String voterId, VoteEventType eventType,
                             String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_COMPLAINT_ID, complaintId,
                MDC_VOTER_ID, voterId != null ? voterId : ""))) {

            Map<String, Object> logData = eventData(eventType.name(), complaintId, details);
            if (voterId != null) {
                logData.put("voterId", voterId);
            }

            switch (eventType) {
                case CONFLICT_RETRIED, BROADCAST_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case CONFLICT_UNRESOLVED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a status workflow event.
     */
    public void logStatusEvent(String complaintId, StatusEventType eventType,
                               String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_COMPLAINT_ID, complaintId))) {
            Map<String, Object> logData = eventData(eventType.name(), complaintId, details);

            switch (eventType) {
                case BROADCAST_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a realtime channel event.
     */
    public void logRealtimeEvent(String complaintId, String channelId, RealtimeEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_COMPLAINT_ID, complaintId != null ? complaintId : "",
                MDC_CHANNEL_ID, channelId != null ? channelId : ""))) {

            Map<String, Object> logData = eventData(eventType.name(), complaintId, details);
            if (channelId != null) {
                logData.put("channelId", channelId);
            }

            switch (eventType) {
                case DEAD_CHANNEL_REMOVED, CLOSE_FAILED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case SUBSCRIBED, UNSUBSCRIBED -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private Map<String, Object> eventData(String event, String complaintId, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", event);
        if (complaintId != null) {
            logData.put("complaintId", complaintId);
        }
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum ComplaintEventType {
        SUBMITTED, CLASSIFIED, CLASSIFICATION_FALLBACK, PRIORITY_RECALCULATED
    }

    public enum VoteEventType {
        CREATED, UPDATED, DELETED, PRIORITY_CHANGED, CONFLICT_RETRIED, CONFLICT_UNRESOLVED, BROADCAST_FAILED
    }

    public enum StatusEventType {
        CHANGED, BROADCAST_FAILED
    }

    public enum RealtimeEventType {
        SUBSCRIBED, UNSUBSCRIBED, DEAD_CHANNEL_REMOVED, SWEEP_COMPLETED, CLOSE_FAILED, SHUTDOWN
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
