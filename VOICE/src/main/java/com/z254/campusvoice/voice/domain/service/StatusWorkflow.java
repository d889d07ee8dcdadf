package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.exception.InvalidStatusException;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.ComplaintStatus;
import com.z254.campusvoice.voice.domain.model.StatusChange;
import com.z254.campusvoice.voice.domain.repository.ComplaintRepository;
import com.z254.campusvoice.voice.domain.repository.StatusChangeRepository;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.StatusEventType;
import com.z254.campusvoice.voice.persistence.ComplaintLockManager;
import com.z254.campusvoice.voice.persistence.StorageAccess;
import com.z254.campusvoice.voice.realtime.ComplaintFeedPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies status updates and keeps the audit trail.
 * <p>
 * Any status may follow any other, including the current one; every
 * update is audited. Closing a complaint stamps its resolution time.
 */
@Service
public class StatusWorkflow {

    private final ComplaintRepository complaintRepository;
    private final StatusChangeRepository statusChangeRepository;
    private final ComplaintLockManager lockManager;
    private final StorageAccess storageAccess;
    private final ComplaintFeedPublisher feedPublisher;
    private final VoiceMetrics metrics;
    private final VoiceStructuredLogger structuredLogger;

    public StatusWorkflow(ComplaintRepository complaintRepository,
                          StatusChangeRepository statusChangeRepository,
                          ComplaintLockManager lockManager,
                          StorageAccess storageAccess,
                          ComplaintFeedPublisher feedPublisher,
                          VoiceMetrics metrics,
                          VoiceStructuredLogger structuredLogger) {
        this.complaintRepository = complaintRepository;
        this.statusChangeRepository = statusChangeRepository;
        this.lockManager = lockManager;
        this.storageAccess = storageAccess;
        this.feedPublisher = feedPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Move a complaint to a new status.
     *
     * @throws InvalidStatusException     if the status is not recognized
     * @throws ComplaintNotFoundException if the complaint does not exist
     */
    public StatusUpdateResult updateStatus(String complaintId, String newStatus, String actor, String reason) {
        ComplaintStatus target = ComplaintStatus.fromLabel(newStatus)
                .orElseThrow(() -> new InvalidStatusException(newStatus));
        if (complaintId == null || complaintId.isBlank()) {
            throw new InvalidInputException("complaint_id is required");
        }
        if (actor == null || actor.isBlank()) {
            throw new InvalidInputException("actor is required");
        }

        StatusUpdateResult result = storageAccess.execute("status-update",
                () -> applyUpdate(complaintId, target, actor, reason));

        metrics.recordStatusChange(target.getLabel());
        Map<String, Object> details = new HashMap<>();
        details.put("oldStatus", result.change().getOldStatus().getLabel());
        details.put("newStatus", target.getLabel());
        details.put("actor", actor);
        details.put("reason", reason);
        structuredLogger.logStatusEvent(complaintId, StatusEventType.CHANGED, "Complaint status updated", details);

        feedPublisher.publishStatus(result.change());
        return result;
    }

    public List<StatusChange> history(String complaintId) {
        if (complaintRepository.findById(complaintId).isEmpty()) {
            throw new ComplaintNotFoundException(complaintId);
        }
        return statusChangeRepository.findByComplaint(complaintId);
    }

    private StatusUpdateResult applyUpdate(String complaintId, ComplaintStatus target, String actor, String reason) {
        return lockManager.withLock(complaintId, () -> {
            Complaint current = complaintRepository.findById(complaintId)
                    .orElseThrow(() -> new ComplaintNotFoundException(complaintId));
            Instant now = Instant.now();

            Complaint updated = current.copy();
            updated.setStatus(target);
            updated.setUpdatedAt(now);
            if (target == ComplaintStatus.CLOSED) {
                updated.setResolvedAt(now);
            }

            StatusChange change = StatusChange.builder()
                    .id(UUID.randomUUID().toString())
                    .complaintId(complaintId)
                    .oldStatus(current.getStatus())
                    .newStatus(target)
                    .actor(actor)
                    .reason(reason)
                    .timestamp(now)
                    .build();

            complaintRepository.save(updated);
            try {
                statusChangeRepository.append(change);
            } catch (RuntimeException e) {
                complaintRepository.save(current);
                throw e;
            }
            return new StatusUpdateResult(updated, change);
        });
    }
}
