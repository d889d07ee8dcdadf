package com.z254.campusvoice.voice.voting;

import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.DuplicateVoteException;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.exception.InvalidVoteTypeException;
import com.z254.campusvoice.voice.domain.exception.VoteConflictException;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.domain.model.Vote;
import com.z254.campusvoice.voice.domain.model.VoteType;
import com.z254.campusvoice.voice.domain.repository.ComplaintRepository;
import com.z254.campusvoice.voice.domain.repository.VoteRepository;
import com.z254.campusvoice.voice.domain.repository.VoterRepository;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger.VoteEventType;
import com.z254.campusvoice.voice.persistence.ComplaintLockManager;
import com.z254.campusvoice.voice.persistence.StorageAccess;
import com.z254.campusvoice.voice.realtime.ComplaintFeedPublisher;
import com.z254.campusvoice.voice.scoring.PriorityScore;
import com.z254.campusvoice.voice.scoring.PriorityScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sole writer of votes and complaint vote counters.
 * <p>
 * A vote is one atomic unit per complaint: read the voter's existing vote,
 * apply the create/toggle/switch transition, adjust counters, recompute the
 * priority and store both records. If storing the complaint fails the vote
 * change is undone, so a failed vote leaves nothing behind. The feed update
 * is sent after the unit commits.
 */
@Slf4j
@Service
public class VoteLedger {

    private final ComplaintRepository complaintRepository;
    private final VoteRepository voteRepository;
    private final VoterRepository voterRepository;
    private final PriorityScorer priorityScorer;
    private final ComplaintLockManager lockManager;
    private final StorageAccess storageAccess;
    private final ComplaintFeedPublisher feedPublisher;
    private final VoiceMetrics metrics;
    private final VoiceStructuredLogger structuredLogger;

    public VoteLedger(ComplaintRepository complaintRepository,
                      VoteRepository voteRepository,
                      VoterRepository voterRepository,
                      PriorityScorer priorityScorer,
                      ComplaintLockManager lockManager,
                      StorageAccess storageAccess,
                      ComplaintFeedPublisher feedPublisher,
                      VoiceMetrics metrics,
                      VoiceStructuredLogger structuredLogger) {
        this.complaintRepository = complaintRepository;
        this.voteRepository = voteRepository;
        this.voterRepository = voterRepository;
        this.priorityScorer = priorityScorer;
        this.lockManager = lockManager;
        this.storageAccess = storageAccess;
        this.feedPublisher = feedPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    /**
     * Cast, toggle off or switch a vote.
     *
     * @throws InvalidVoteTypeException   if the vote type is not upvote or downvote
     * @throws ComplaintNotFoundException if the complaint does not exist
     * @throws VoteConflictException      if a concurrent insert for the same voter won twice
     */
    public VoteOutcome vote(String complaintId, String voterId, String voteType) {
        VoteType requested = VoteType.fromLabel(voteType)
                .orElseThrow(() -> new InvalidVoteTypeException(voteType));
        requireId(complaintId, "complaint_id");
        requireId(voterId, "voter_id");

        long start = System.nanoTime();
        VoteOutcome outcome = castWithConflictRetry(complaintId, voterId, requested);
        metrics.recordVote(outcome.getAction().getLabel(), Duration.ofNanos(System.nanoTime() - start));
        logOutcome(outcome);

        feedPublisher.publishVote(outcome);
        return outcome;
    }

    public Optional<VoteType> findVote(String complaintId, String voterId) {
        return voteRepository.find(complaintId, voterId).map(Vote::getVoteType);
    }

    public List<Vote> votesOn(String complaintId) {
        return voteRepository.findByComplaint(complaintId);
    }

    private VoteOutcome castWithConflictRetry(String complaintId, String voterId, VoteType requested) {
        try {
            return storageAccess.execute("vote", () -> castVote(complaintId, voterId, requested));
        } catch (DuplicateVoteException first) {
            metrics.recordVoteConflict();
            structuredLogger.logVoteEvent(complaintId, voterId, VoteEventType.CONFLICT_RETRIED,
                    "Vote collided with a concurrent insert, retrying", null);
            try {
                return storageAccess.execute("vote", () -> castVote(complaintId, voterId, requested));
            } catch (DuplicateVoteException second) {
                structuredLogger.logVoteEvent(complaintId, voterId, VoteEventType.CONFLICT_UNRESOLVED,
                        "Vote conflict persisted after retry", null);
                throw new VoteConflictException(complaintId, voterId, second);
            }
        }
    }

    private VoteOutcome castVote(String complaintId, String voterId, VoteType requested) {
        return lockManager.withLock(complaintId, () -> {
            Complaint current = complaintRepository.findById(complaintId)
                    .orElseThrow(() -> new ComplaintNotFoundException(complaintId));

            Optional<Vote> existing = voteRepository.find(complaintId, voterId);
            VoteState state = VoteState.of(existing.map(Vote::getVoteType).orElse(null));
            VoteAction action = state.actionFor(requested);
            Instant now = Instant.now();

            Complaint updated = current.copy();
            Vote after = switch (action) {
                case CREATED -> {
                    updated.adjustCount(requested, 1);
                    yield Vote.builder()
                            .complaintId(complaintId)
                            .voterId(voterId)
                            .voteType(requested)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                }
                case DELETED -> {
                    updated.adjustCount(requested, -1);
                    yield null;
                }
                case UPDATED -> {
                    updated.adjustCount(requested.opposite(), -1);
                    updated.adjustCount(requested, 1);
                    yield existing.get().toBuilder()
                            .voteType(requested)
                            .updatedAt(now)
                            .build();
                }
            };
            updated.setUpdatedAt(now);

            Priority oldPriority = current.getPriority();
            PriorityScore score = priorityScorer.score(
                    updated.getClassification(), updated.getUpvotes(), updated.getDownvotes());
            boolean priorityUpdated = score.label() != oldPriority;
            if (priorityUpdated) {
                updated.setPriority(score.label());
                updated.setPriorityScore(score.score());
            }

            VoteChange change = new VoteChange(existing.orElse(null), after);
            change.apply(voteRepository);
            try {
                complaintRepository.save(updated);
            } catch (RuntimeException e) {
                change.revert(voteRepository, e);
                throw e;
            }
            // Registered only once the vote and counters are stored.
            try {
                voterRepository.registerIfAbsent(voterId);
            } catch (RuntimeException e) {
                restoreComplaint(current, e);
                change.revert(voteRepository, e);
                throw e;
            }

            return VoteOutcome.builder()
                    .complaintId(complaintId)
                    .voterId(voterId)
                    .voteType(requested)
                    .action(action)
                    .upvotes(updated.getUpvotes())
                    .downvotes(updated.getDownvotes())
                    .priorityUpdated(priorityUpdated)
                    .oldPriority(priorityUpdated ? oldPriority : null)
                    .newPriority(priorityUpdated ? score.label() : null)
                    .priorityScore(updated.getPriorityScore())
                    .build();
        });
    }

    private void logOutcome(VoteOutcome outcome) {
        Map<String, Object> details = new HashMap<>();
        details.put("voteType", outcome.getVoteType().getLabel());
        details.put("upvotes", outcome.getUpvotes());
        details.put("downvotes", outcome.getDownvotes());

        VoteEventType eventType = switch (outcome.getAction()) {
            case CREATED -> VoteEventType.CREATED;
            case UPDATED -> VoteEventType.UPDATED;
            case DELETED -> VoteEventType.DELETED;
        };
        structuredLogger.logVoteEvent(outcome.getComplaintId(), outcome.getVoterId(), eventType,
                outcome.getMessage(), details);

        if (outcome.isPriorityUpdated()) {
            metrics.recordPriorityFlip();
            structuredLogger.logVoteEvent(outcome.getComplaintId(), outcome.getVoterId(),
                    VoteEventType.PRIORITY_CHANGED, "Priority changed by vote",
                    Map.of("oldPriority", outcome.getOldPriority().getLabel(),
                            "newPriority", outcome.getNewPriority().getLabel(),
                            "score", outcome.getPriorityScore()));
        }
    }

    private void restoreComplaint(Complaint previous, RuntimeException failure) {
        try {
            complaintRepository.save(previous);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.error("Failed to restore complaint {} after a failed vote", previous.getId(), e);
        }
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
    }

    /**
     * Vote row change within one unit; either side may be absent.
     */
    private record VoteChange(Vote before, Vote after) {

        void apply(VoteRepository repository) {
            if (before == null) {
                repository.insert(after);
            } else if (after == null) {
                repository.delete(before.getComplaintId(), before.getVoterId());
            } else {
                repository.update(after);
            }
        }

        void revert(VoteRepository repository, RuntimeException failure) {
            try {
                if (before == null) {
                    repository.delete(after.getComplaintId(), after.getVoterId());
                } else if (after == null) {
                    repository.insert(before);
                } else {
                    repository.update(before);
                }
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
                log.error("Failed to undo vote change for complaint {}",
                        before != null ? before.getComplaintId() : after.getComplaintId(), e);
            }
        }
    }
}
