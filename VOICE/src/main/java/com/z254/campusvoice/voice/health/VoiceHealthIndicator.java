package com.z254.campusvoice.voice.health;

import com.z254.campusvoice.voice.classification.ClassificationGateway;
import com.z254.campusvoice.voice.domain.repository.ComplaintRepository;
import com.z254.campusvoice.voice.realtime.BroadcastRegistry;
import com.z254.campusvoice.voice.realtime.RegistryStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for VOICE service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Complaint store size</li>
 *     <li>Realtime registry state and active connections</li>
 *     <li>Classifier mode (live or fallback only)</li>
 * </ul>
 */
@Slf4j
@Component
public class VoiceHealthIndicator implements ReactiveHealthIndicator {

    private final ComplaintRepository complaintRepository;
    private final BroadcastRegistry broadcastRegistry;
    private final ClassificationGateway classificationGateway;

    public VoiceHealthIndicator(ComplaintRepository complaintRepository,
                                BroadcastRegistry broadcastRegistry,
                                ClassificationGateway classificationGateway) {
        this.complaintRepository = complaintRepository;
        this.broadcastRegistry = broadcastRegistry;
        this.classificationGateway = classificationGateway;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        try {
            details.put("complaints", complaintRepository.count());
        } catch (RuntimeException e) {
            healthy = false;
            details.put("store.error", "Complaint store unavailable: " + e.getMessage());
            log.error("Health check failed for complaint store", e);
        }

        RegistryStats stats = broadcastRegistry.getStats();
        details.put("realtime.state", broadcastRegistry.isClosed() ? "CLOSED" : "OPEN");
        details.put("realtime.activeConnections", stats.getTotalActiveConnections());
        details.put("realtime.watchedComplaints", stats.getActiveComplaints());
        if (broadcastRegistry.isClosed()) {
            healthy = false;
        }

        details.put("classifier", classificationGateway.getClassifierId());
        details.put("classifier.mode", classificationGateway.isClassifierConfigured() ? "LIVE" : "FALLBACK_ONLY");

        return healthy
                ? Health.up().withDetails(details).build()
                : Health.down().withDetails(details).build();
    }
}
