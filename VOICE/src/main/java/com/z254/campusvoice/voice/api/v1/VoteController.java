package com.z254.campusvoice.voice.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.z254.campusvoice.voice.api.dto.UserVoteDto;
import com.z254.campusvoice.voice.api.dto.VoteResponse;
import com.z254.campusvoice.voice.api.dto.VoteStatsDto;
import com.z254.campusvoice.voice.api.dto.VotersResponse;
import com.z254.campusvoice.voice.api.mapper.VoteMapper;
import com.z254.campusvoice.voice.domain.model.VoteType;
import com.z254.campusvoice.voice.domain.service.ComplaintService;
import com.z254.campusvoice.voice.voting.VoteLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for voting.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/votes")
@Tag(name = "Votes", description = "Voting and vote statistics")
public class VoteController {

    private final VoteLedger voteLedger;
    private final ComplaintService complaintService;

    public VoteController(VoteLedger voteLedger, ComplaintService complaintService) {
        this.voteLedger = voteLedger;
        this.complaintService = complaintService;
    }

    @PostMapping
    @Operation(summary = "Vote",
               description = "Cast a vote. Repeating the same vote removes it; the opposite vote switches it")
    public Mono<ResponseEntity<VoteResponse>> vote(@Valid @RequestBody VoteRequest request) {
        return Mono.fromCallable(() -> voteLedger.vote(
                        request.getComplaintId(), request.getVoterId().trim(), request.getVoteType()))
                .map(VoteMapper::toResponse)
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{complaintId}")
    @Operation(summary = "Vote stats", description = "Current vote counts for a complaint")
    public Mono<ResponseEntity<VoteStatsDto>> getVoteStats(
            @Parameter(description = "Complaint ID") @PathVariable String complaintId) {

        return Mono.justOrEmpty(complaintService.getComplaint(complaintId))
                .map(VoteMapper::toStats)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{complaintId}/voters")
    @Operation(summary = "Voters", description = "Students who upvoted and downvoted a complaint")
    public Mono<ResponseEntity<VotersResponse>> getVoters(
            @Parameter(description = "Complaint ID") @PathVariable String complaintId) {

        return Mono.fromCallable(() -> {
                    complaintService.requireComplaint(complaintId);
                    return VoteMapper.toVoters(complaintId, voteLedger.votesOn(complaintId),
                            complaintService::findVoter);
                })
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{complaintId}/voters/{voterId}")
    @Operation(summary = "Voter's vote", description = "A student's current vote on a complaint, if any")
    public Mono<ResponseEntity<UserVoteDto>> getUserVote(
            @Parameter(description = "Complaint ID") @PathVariable String complaintId,
            @Parameter(description = "Roll number") @PathVariable String voterId) {

        return Mono.fromCallable(() -> {
                    complaintService.requireComplaint(complaintId);
                    return UserVoteDto.builder()
                            .complaintId(complaintId)
                            .voterId(voterId)
                            .voteType(voteLedger.findVote(complaintId, voterId)
                                    .map(VoteType::getLabel)
                                    .orElse(null))
                            .build();
                })
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VoteRequest {
        @NotBlank
        private String complaintId;
        @NotBlank
        private String voterId;
        /** upvote or downvote; anything else is rejected by the ledger */
        @NotBlank
        private String voteType;
    }
}
