package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.RealtimeEventType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of open vote-feed channels, grouped by complaint.
 * <p>
 * Each complaint's subscriber set has its own lock; subscribe, unsubscribe,
 * broadcast and sweep on the same complaint are mutually exclusive while
 * different complaints proceed independently. A set that becomes empty is
 * retired and removed from the map, and a subscriber that races with the
 * removal simply registers into a fresh set.
 * <p>
 * Delivery is best effort. A channel that fails a send is dropped and
 * counted as a disconnection without affecting the other subscribers.
 */
@Slf4j
@Component
public class BroadcastRegistry {

    private final ConcurrentMap<String, SubscriberGroup> groups = new ConcurrentHashMap<>();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalDisconnections = new AtomicLong();

    private final ObjectMapper objectMapper;
    private final VoiceMetrics metrics;
    private final VoiceStructuredLogger structuredLogger;
    private final String shutdownReason;

    private volatile boolean closed;

    public BroadcastRegistry(ObjectMapper objectMapper,
                             VoiceMetrics metrics,
                             VoiceStructuredLogger structuredLogger,
                             VoiceProperties properties) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.shutdownReason = properties.getRealtime().getShutdownReason();
    }

    /**
     * Register a channel under a complaint and send it the connection acknowledgment.
     *
     * @return false if the channel could not be registered (registry shut down or ack rejected)
     */
    public boolean subscribe(SubscriberChannel channel, String complaintId) {
        if (closed) {
            closeQuietly(channel, complaintId, shutdownReason);
            return false;
        }
        String ack = serialize(RealtimeEvents.connection(complaintId));

        while (true) {
            SubscriberGroup group = groups.computeIfAbsent(complaintId, id -> new SubscriberGroup());
            group.lock.lock();
            try {
                if (group.retired) {
                    continue;
                }
                if (closed) {
                    retireIfEmpty(complaintId, group);
                    closeQuietly(channel, complaintId, shutdownReason);
                    return false;
                }
                if (!group.members.add(channel)) {
                    return true;
                }
                totalConnections.incrementAndGet();
                metrics.recordSubscribed();

                if (ack != null) {
                    try {
                        channel.send(ack);
                    } catch (RuntimeException e) {
                        removeDead(complaintId, group, channel, e);
                        retireIfEmpty(complaintId, group);
                        return false;
                    }
                }
                structuredLogger.logRealtimeEvent(complaintId, channel.getId(), RealtimeEventType.SUBSCRIBED,
                        "Subscriber connected", Map.of("subscribers", group.members.size()));
                return true;
            } finally {
                group.lock.unlock();
            }
        }
    }

    /**
     * Remove a channel. Removing the last subscriber drops the complaint's entry.
     *
     * @return true if the channel was registered
     */
    public boolean unsubscribe(SubscriberChannel channel, String complaintId) {
        SubscriberGroup group = groups.get(complaintId);
        if (group == null) {
            return false;
        }
        group.lock.lock();
        try {
            boolean removed = group.members.remove(channel);
            if (removed) {
                totalDisconnections.incrementAndGet();
                metrics.recordUnsubscribed(1);
                structuredLogger.logRealtimeEvent(complaintId, channel.getId(), RealtimeEventType.UNSUBSCRIBED,
                        "Subscriber disconnected", Map.of("subscribers", group.members.size()));
            }
            retireIfEmpty(complaintId, group);
            return removed;
        } finally {
            group.lock.unlock();
        }
    }

    /**
     * Push a vote update to every subscriber of the complaint.
     *
     * @return number of channels that accepted the message
     */
    public int broadcastVote(String complaintId, RealtimeEvents.VoteUpdateEvent event) {
        return broadcast(complaintId, RealtimeEvents.VOTE_UPDATE, event);
    }

    /**
     * Push a status update to every subscriber of the complaint.
     *
     * @return number of channels that accepted the message
     */
    public int broadcastStatus(String complaintId, RealtimeEvents.StatusUpdateEvent event) {
        return broadcast(complaintId, RealtimeEvents.STATUS_UPDATE, event);
    }

    /**
     * Probe every open channel with a ping and drop the ones that reject it.
     *
     * @return number of channels removed
     */
    public int sweep() {
        if (closed) {
            return 0;
        }
        String probe = serialize(RealtimeEvents.ping());
        if (probe == null) {
            return 0;
        }

        int probed = 0;
        int removed = 0;
        for (Map.Entry<String, SubscriberGroup> entry : groups.entrySet()) {
            SubscriberGroup group = entry.getValue();
            group.lock.lock();
            try {
                if (group.retired) {
                    continue;
                }
                Delivery delivery = deliver(entry.getKey(), group, probe);
                probed += delivery.delivered() + delivery.dead();
                removed += delivery.dead();
            } finally {
                group.lock.unlock();
            }
        }

        metrics.recordSweep(removed);
        structuredLogger.logRealtimeEvent(null, null, RealtimeEventType.SWEEP_COMPLETED,
                "Liveness sweep completed", Map.of("probed", probed, "removed", removed));
        return removed;
    }

    /**
     * Close every channel and clear all state. Safe to call repeatedly and with no channels.
     */
    @PreDestroy
    public void shutdown() {
        closed = true;
        int closedChannels = 0;

        for (Map.Entry<String, SubscriberGroup> entry : groups.entrySet()) {
            String complaintId = entry.getKey();
            SubscriberGroup group = entry.getValue();
            group.lock.lock();
            try {
                for (SubscriberChannel channel : List.copyOf(group.members)) {
                    closeQuietly(channel, complaintId, shutdownReason);
                    closedChannels++;
                }
                int count = group.members.size();
                if (count > 0) {
                    totalDisconnections.addAndGet(count);
                    metrics.recordUnsubscribed(count);
                }
                group.members.clear();
                retireIfEmpty(complaintId, group);
            } finally {
                group.lock.unlock();
            }
        }

        structuredLogger.logRealtimeEvent(null, null, RealtimeEventType.SHUTDOWN,
                "Realtime registry shut down", Map.of("closedChannels", closedChannels));
    }

    public RegistryStats getStats() {
        Map<String, Integer> perComplaint = new TreeMap<>();
        groups.forEach((complaintId, group) -> {
            int size = group.members.size();
            if (size > 0) {
                perComplaint.put(complaintId, size);
            }
        });
        return RegistryStats.builder()
                .activeComplaints(perComplaint.size())
                .totalActiveConnections(perComplaint.values().stream().mapToInt(Integer::intValue).sum())
                .totalConnectionsEver(totalConnections.get())
                .totalDisconnections(totalDisconnections.get())
                .complaintsBeingWatched(List.copyOf(perComplaint.keySet()))
                .connectionsPerComplaint(perComplaint)
                .build();
    }

    public List<WatcherInfo> getWatchers(String complaintId) {
        SubscriberGroup group = groups.get(complaintId);
        if (group == null) {
            return List.of();
        }
        return group.members.stream()
                .sorted(Comparator.comparing(SubscriberChannel::getConnectedAt))
                .map(channel -> WatcherInfo.builder()
                        .complaintId(complaintId)
                        .channelId(channel.getId())
                        .connectedAt(channel.getConnectedAt())
                        .clientInfo(channel.getClientInfo())
                        .build())
                .toList();
    }

    public int getSubscriberCount(String complaintId) {
        SubscriberGroup group = groups.get(complaintId);
        return group == null ? 0 : group.members.size();
    }

    /**
     * Whether the complaint currently has an entry in the registry.
     */
    public boolean isTracked(String complaintId) {
        return groups.containsKey(complaintId);
    }

    public boolean isClosed() {
        return closed;
    }

    private int broadcast(String complaintId, String eventType, Object event) {
        SubscriberGroup group = groups.get(complaintId);
        if (group == null) {
            log.debug("No subscribers for {} on complaint {}", eventType, complaintId);
            return 0;
        }
        String message = serialize(event);
        if (message == null) {
            return 0;
        }

        group.lock.lock();
        try {
            if (group.retired) {
                return 0;
            }
            Delivery delivery = deliver(complaintId, group, message);
            metrics.recordBroadcast(delivery.delivered(), delivery.dead());
            log.debug("Broadcast {} for complaint {} to {} subscribers ({} dropped)",
                    eventType, complaintId, delivery.delivered(), delivery.dead());
            return delivery.delivered();
        } finally {
            group.lock.unlock();
        }
    }

    // Caller holds the group lock.
    private Delivery deliver(String complaintId, SubscriberGroup group, String message) {
        int delivered = 0;
        List<SubscriberChannel> dead = new ArrayList<>();
        for (SubscriberChannel channel : List.copyOf(group.members)) {
            try {
                channel.send(message);
                delivered++;
            } catch (RuntimeException e) {
                dead.add(channel);
                removeDead(complaintId, group, channel, e);
            }
        }
        retireIfEmpty(complaintId, group);
        return new Delivery(delivered, dead.size());
    }

    // Caller holds the group lock.
    private void removeDead(String complaintId, SubscriberGroup group, SubscriberChannel channel, Exception cause) {
        if (group.members.remove(channel)) {
            totalDisconnections.incrementAndGet();
            metrics.recordUnsubscribed(1);
        }
        structuredLogger.logRealtimeEvent(complaintId, channel.getId(), RealtimeEventType.DEAD_CHANNEL_REMOVED,
                "Dropping channel after failed send", Map.of("error", String.valueOf(cause.getMessage())));
        closeQuietly(channel, complaintId, "Delivery failed");
    }

    // Caller holds the group lock.
    private void retireIfEmpty(String complaintId, SubscriberGroup group) {
        if (group.members.isEmpty() && !group.retired) {
            group.retired = true;
            groups.remove(complaintId, group);
        }
    }

    private void closeQuietly(SubscriberChannel channel, String complaintId, String reason) {
        try {
            channel.close(reason);
        } catch (RuntimeException e) {
            structuredLogger.logRealtimeEvent(complaintId, channel.getId(), RealtimeEventType.CLOSE_FAILED,
                    "Failed to close channel", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private String serialize(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize realtime event {}: {}", event.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private record Delivery(int delivered, int dead) {
    }

    private static final class SubscriberGroup {
        private final ReentrantLock lock = new ReentrantLock();
        // Mutated under lock; concurrent set so stats can read without it.
        private final Set<SubscriberChannel> members = ConcurrentHashMap.newKeySet();
        private boolean retired;
    }
}
