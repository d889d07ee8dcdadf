package com.z254.campusvoice.voice.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for VOICE service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Complaint intake (submitted, classified, fallback rate)</li>
 *     <li>Vote ledger (actions, conflicts, priority flips)</li>
 *     <li>Status workflow (transitions by target status)</li>
 *     <li>Realtime feed (subscribers, broadcasts, dead channels, sweeps)</li>
 * </ul>
 */
@Component
public class VoiceMetrics {

    private final MeterRegistry meterRegistry;

    // Complaint metrics
    @Getter
    private final Counter complaintsSubmitted;
    @Getter
    private final Counter classifierCalls;
    @Getter
    private final Counter classifierFallbacks;
    private final Timer classifierLatency;

    // Vote metrics
    private final Map<String, Counter> votesByAction = new ConcurrentHashMap<>();
    @Getter
    private final Counter voteConflicts;
    @Getter
    private final Counter priorityFlips;
    private final Timer voteLatency;

    // Persistence metrics
    @Getter
    private final Counter persistenceRetries;
    @Getter
    private final Counter persistenceFailures;

    // Status metrics
    private final Map<String, Counter> statusChangesByTarget = new ConcurrentHashMap<>();

    // Realtime metrics
    @Getter
    private final Counter broadcastsSent;
    @Getter
    private final Counter broadcastFailures;
    @Getter
    private final Counter deadChannelsRemoved;
    @Getter
    private final Counter sweepsCompleted;
    private final AtomicInteger activeSubscribers;

    public VoiceMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.complaintsSubmitted = Counter.builder("voice.complaints.submitted")
                .description("Total complaints submitted")
                .register(meterRegistry);
        this.classifierCalls = Counter.builder("voice.classifier.calls")
                .description("Classification attempts")
                .register(meterRegistry);
        this.classifierFallbacks = Counter.builder("voice.classifier.fallbacks")
                .description("Classifications resolved through the fallback record")
                .register(meterRegistry);
        this.classifierLatency = Timer.builder("voice.classifier.latency")
                .description("Classification latency including fallback")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.voteConflicts = Counter.builder("voice.votes.conflicts")
                .description("Unique constraint collisions retried by the vote ledger")
                .register(meterRegistry);
        this.priorityFlips = Counter.builder("voice.votes.priority_flips")
                .description("Votes that changed a complaint's priority label")
                .register(meterRegistry);
        this.voteLatency = Timer.builder("voice.votes.latency")
                .description("Vote ledger operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.persistenceRetries = Counter.builder("voice.persistence.retries")
                .description("Retries after transient storage failures")
                .register(meterRegistry);
        this.persistenceFailures = Counter.builder("voice.persistence.failures")
                .description("Storage operations that exhausted their retries")
                .register(meterRegistry);

        this.broadcastsSent = Counter.builder("voice.realtime.broadcasts")
                .description("Messages delivered to subscribers")
                .register(meterRegistry);
        this.broadcastFailures = Counter.builder("voice.realtime.broadcast_failures")
                .description("Broadcasts that failed before reaching the registry")
                .register(meterRegistry);
        this.deadChannelsRemoved = Counter.builder("voice.realtime.dead_channels")
                .description("Channels removed after a failed send")
                .register(meterRegistry);
        this.sweepsCompleted = Counter.builder("voice.realtime.sweeps")
                .description("Liveness sweeps completed")
                .register(meterRegistry);
        this.activeSubscribers = meterRegistry.gauge("voice.realtime.subscribers.active", new AtomicInteger(0));
    }

    // ========== Complaint Methods ==========

    public void recordComplaintSubmitted() {
        complaintsSubmitted.increment();
    }

    public Timer.Sample startClassification() {
        classifierCalls.increment();
        return Timer.start(meterRegistry);
    }

    public void recordClassification(Timer.Sample sample, boolean fallback) {
        sample.stop(classifierLatency);
        if (fallback) {
            classifierFallbacks.increment();
        }
    }

    // ========== Vote Methods ==========

    public void recordVote(String action, Duration duration) {
        voteLatency.record(duration);
        getVoteCounterByAction(action).increment();
    }

    public void recordVoteConflict() {
        voteConflicts.increment();
    }

    public void recordPriorityFlip() {
        priorityFlips.increment();
    }

    // ========== Persistence Methods ==========

    public void recordPersistenceRetry() {
        persistenceRetries.increment();
    }

    public void recordPersistenceFailure() {
        persistenceFailures.increment();
    }

    // ========== Status Methods ==========

    public void recordStatusChange(String newStatus) {
        statusChangesByTarget.computeIfAbsent(newStatus, status ->
                Counter.builder("voice.status.changes")
                        .tag("status", status)
                        .description("Status updates by target status")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Realtime Methods ==========

    public void recordSubscribed() {
        activeSubscribers.incrementAndGet();
    }

    public void recordUnsubscribed(int count) {
        activeSubscribers.addAndGet(-count);
    }

    public void recordBroadcast(int delivered, int dead) {
        broadcastsSent.increment(delivered);
        deadChannelsRemoved.increment(dead);
    }

    public void recordBroadcastFailure() {
        broadcastFailures.increment();
    }

    public void recordSweep(int dead) {
        sweepsCompleted.increment();
        deadChannelsRemoved.increment(dead);
    }

    public int getActiveSubscribers() {
        return activeSubscribers.get();
    }

    private Counter getVoteCounterByAction(String action) {
        return votesByAction.computeIfAbsent(action, a ->
                Counter.builder("voice.votes")
                        .tag("action", a)
                        .description("Votes by resulting action")
                        .register(meterRegistry));
    }
}
