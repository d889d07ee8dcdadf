package com.z254.campusvoice.voice.api.mapper;

import com.z254.campusvoice.voice.api.dto.VoteResponse;
import com.z254.campusvoice.voice.api.dto.VoteStatsDto;
import com.z254.campusvoice.voice.api.dto.VotersResponse;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.Vote;
import com.z254.campusvoice.voice.domain.model.VoteType;
import com.z254.campusvoice.voice.domain.model.Voter;
import com.z254.campusvoice.voice.voting.VoteOutcome;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Mapper for vote results and vote listings.
 */
public final class VoteMapper {

    private VoteMapper() {}

    public static VoteResponse toResponse(VoteOutcome outcome) {
        return VoteResponse.builder()
                .complaintId(outcome.getComplaintId())
                .message(outcome.getMessage())
                .action(outcome.getAction().getLabel())
                .voteType(outcome.getVoteType().getLabel())
                .upvotes(outcome.getUpvotes())
                .downvotes(outcome.getDownvotes())
                .netVotes(outcome.getNetVotes())
                .priorityUpdated(outcome.isPriorityUpdated())
                .oldPriority(outcome.getOldPriority() != null ? outcome.getOldPriority().getLabel() : null)
                .newPriority(outcome.getNewPriority() != null ? outcome.getNewPriority().getLabel() : null)
                .priorityScore(outcome.getPriorityScore())
                .build();
    }

    public static VoteStatsDto toStats(Complaint complaint) {
        return VoteStatsDto.builder()
                .complaintId(complaint.getId())
                .upvotes(complaint.getUpvotes())
                .downvotes(complaint.getDownvotes())
                .total(complaint.getTotalVotes())
                .netVotes(complaint.getNetVotes())
                .build();
    }

    public static VotersResponse toVoters(String complaintId, List<Vote> votes,
                                          Function<String, Optional<Voter>> voterLookup) {
        return VotersResponse.builder()
                .complaintId(complaintId)
                .upvoters(entries(votes, VoteType.UPVOTE, voterLookup))
                .downvoters(entries(votes, VoteType.DOWNVOTE, voterLookup))
                .build();
    }

    private static List<VotersResponse.VoterEntry> entries(List<Vote> votes, VoteType type,
                                                           Function<String, Optional<Voter>> voterLookup) {
        return votes.stream()
                .filter(v -> v.getVoteType() == type)
                .map(v -> VotersResponse.VoterEntry.builder()
                        .voterId(v.getVoterId())
                        .name(voterLookup.apply(v.getVoterId())
                                .map(Voter::getDisplayName)
                                .orElse(v.getVoterId()))
                        .votedAt(v.getUpdatedAt() != null ? v.getUpdatedAt() : v.getCreatedAt())
                        .build())
                .toList();
    }
}
