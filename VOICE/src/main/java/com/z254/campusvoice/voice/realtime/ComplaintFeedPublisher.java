package com.z254.campusvoice.voice.realtime;

import com.z254.campusvoice.voice.domain.model.StatusChange;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.StatusEventType;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.VoteEventType;
import com.z254.campusvoice.voice.voting.VoteOutcome;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns committed vote and status changes into feed events.
 * <p>
 * Called after the change is stored. Failures are logged and counted and
 * never reach the caller.
 */
@Component
public class ComplaintFeedPublisher {

    private final BroadcastRegistry registry;
    private final VoiceMetrics metrics;
    private final VoiceStructuredLogger structuredLogger;

    public ComplaintFeedPublisher(BroadcastRegistry registry,
                                  VoiceMetrics metrics,
                                  VoiceStructuredLogger structuredLogger) {
        this.registry = registry;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public void publishVote(VoteOutcome outcome) {
        try {
            RealtimeEvents.VoteUpdateEvent event = RealtimeEvents.VoteUpdateEvent.builder()
                    .complaintId(outcome.getComplaintId())
                    .upvotes(outcome.getUpvotes())
                    .downvotes(outcome.getDownvotes())
                    .totalVotes(outcome.getTotalVotes())
                    .action(outcome.getAction().getLabel())
                    .voteType(outcome.getVoteType().getLabel())
                    .priorityUpdated(outcome.isPriorityUpdated())
                    .newPriority(outcome.isPriorityUpdated() ? outcome.getNewPriority().getLabel() : null)
                    .build();
            registry.broadcastVote(outcome.getComplaintId(), event);
        } catch (RuntimeException e) {
            metrics.recordBroadcastFailure();
            structuredLogger.logVoteEvent(outcome.getComplaintId(), outcome.getVoterId(),
                    VoteEventType.BROADCAST_FAILED, "Vote broadcast failed",
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    public void publishStatus(StatusChange change) {
        try {
            RealtimeEvents.StatusUpdateEvent event = RealtimeEvents.StatusUpdateEvent.builder()
                    .complaintId(change.getComplaintId())
                    .oldStatus(change.getOldStatus().getLabel())
                    .newStatus(change.getNewStatus().getLabel())
                    .updatedBy(change.getActor())
                    .reason(change.getReason())
                    .build();
            registry.broadcastStatus(change.getComplaintId(), event);
        } catch (RuntimeException e) {
            metrics.recordBroadcastFailure();
            structuredLogger.logStatusEvent(change.getComplaintId(), StatusEventType.BROADCAST_FAILED,
                    "Status broadcast failed", Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
