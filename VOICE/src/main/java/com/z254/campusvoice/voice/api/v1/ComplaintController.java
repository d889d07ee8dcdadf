package com.z254.campusvoice.voice.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.z254.campusvoice.voice.api.dto.ComplaintDto;
import com.z254.campusvoice.voice.api.dto.ComplaintListResponse;
import com.z254.campusvoice.voice.api.dto.PriorityRecalculationResponse;
import com.z254.campusvoice.voice.api.dto.StatusChangeDto;
import com.z254.campusvoice.voice.api.dto.SubmitComplaintResponse;
import com.z254.campusvoice.voice.api.mapper.ComplaintMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.exception.InvalidInputException;
import com.z254.campusvoice.voice.domain.exception.InvalidStatusException;
import com.z254.campusvoice.voice.domain.model.ComplaintStatus;
import com.z254.campusvoice.voice.domain.model.Priority;
import com.z254.campusvoice.voice.domain.model.Visibility;
import com.z254.campusvoice.voice.domain.service.ComplaintService;
import com.z254.campusvoice.voice.domain.service.NewComplaint;
import com.z254.campusvoice.voice.domain.service.StatusWorkflow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST API controller for complaint intake and querying.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/complaints")
@Tag(name = "Complaints", description = "Complaint submission and querying")
public class ComplaintController {

    private final ComplaintService complaintService;
    private final StatusWorkflow statusWorkflow;
    private final int previewLength;

    public ComplaintController(ComplaintService complaintService,
                               StatusWorkflow statusWorkflow,
                               VoiceProperties properties) {
        this.complaintService = complaintService;
        this.statusWorkflow = statusWorkflow;
        this.previewLength = properties.getFeed().getDescriptionPreviewLength();
    }

    @PostMapping
    @Operation(summary = "Submit complaint",
               description = "Classify a complaint, route it to an authority and store it")
    public Mono<ResponseEntity<SubmitComplaintResponse>> submitComplaint(
            @Valid @RequestBody SubmitComplaintRequest request) {

        NewComplaint complaint = NewComplaint.builder()
                .submitterId(request.getSubmitterId().trim())
                .submitterName(request.getName())
                .submitterEmail(request.getEmail())
                .department(request.getDepartment())
                .stayType(request.getStayType())
                .title(request.getTitle())
                .description(request.getDescription())
                .visibility(Visibility.fromLabel(request.getVisibility()).orElse(Visibility.PUBLIC))
                .imageUrl(request.getImageUrl())
                .build();

        return complaintService.submit(complaint)
                .map(ComplaintMapper::toSubmitResponse)
                .map(body -> ResponseEntity.status(HttpStatus.CREATED).body(body));
    }

    @GetMapping("/public")
    @Operation(summary = "Public feed", description = "List public complaints, newest first")
    public Mono<ResponseEntity<ComplaintListResponse>> listPublic(
            @Parameter(description = "Filter by status (raised, opened, reviewed, closed)")
            @RequestParam(required = false) String status,
            @Parameter(description = "Filter by priority (low, medium, high, critical)")
            @RequestParam(required = false) String priority,
            @Parameter(description = "Page size (1-100)")
            @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @Parameter(description = "Number of complaints to skip")
            @RequestParam(required = false) @Min(0) Integer offset) {

        return Mono.fromCallable(() -> complaintService.listPublic(
                        parseStatus(status), parsePriority(priority), limit, offset))
                .map(page -> ResponseEntity.ok(ComplaintMapper.toListResponse(page, previewLength)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/my")
    @Operation(summary = "My complaints", description = "List complaints raised by a student, any visibility")
    public Mono<ResponseEntity<ComplaintListResponse>> listMine(
            @Parameter(description = "Roll number of the submitter")
            @RequestParam String submitterId,
            @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @RequestParam(required = false) @Min(0) Integer offset) {

        return Mono.fromCallable(() -> complaintService.listBySubmitter(submitterId, limit, offset))
                .map(page -> ResponseEntity.ok(ComplaintMapper.toListResponse(page, previewLength)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get complaint", description = "Get complaint details by ID")
    public Mono<ResponseEntity<ComplaintDto>> getComplaint(
            @Parameter(description = "Complaint ID") @PathVariable String id) {

        return Mono.justOrEmpty(complaintService.getComplaint(id))
                .map(ComplaintMapper::toDto)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/status-history")
    @Operation(summary = "Status history", description = "Audit trail of status updates, oldest first")
    public Mono<ResponseEntity<List<StatusChangeDto>>> getStatusHistory(
            @Parameter(description = "Complaint ID") @PathVariable String id) {

        return Mono.fromCallable(() -> statusWorkflow.history(id).stream()
                        .map(ComplaintMapper::toDto)
                        .toList())
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/recalculate-priority")
    @Operation(summary = "Recalculate priority",
               description = "Recompute the priority score from the stored classification and current votes")
    public Mono<ResponseEntity<PriorityRecalculationResponse>> recalculatePriority(
            @Parameter(description = "Complaint ID") @PathVariable String id) {

        return Mono.fromCallable(() -> complaintService.recalculatePriority(id))
                .map(ComplaintMapper::toRecalculationResponse)
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    static ComplaintStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        return ComplaintStatus.fromLabel(status).orElseThrow(() -> new InvalidStatusException(status));
    }

    static Priority parsePriority(String priority) {
        if (priority == null || priority.isBlank()) {
            return null;
        }
        return Priority.fromLabel(priority).orElseThrow(() -> new InvalidInputException(
                "Invalid priority '" + priority + "'. Must be one of: low, medium, high, critical"));
    }

    // ========== Request DTOs ==========

    @lombok.Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class SubmitComplaintRequest {
        @NotBlank
        private String submitterId;
        private String name;
        @Email
        private String email;
        private String department;
        private String stayType;
        @NotBlank
        @Size(min = 5, max = 200)
        private String title;
        @NotBlank
        @Size(min = 10, max = 2000)
        private String description;
        @Pattern(regexp = "(?i)public|private", message = "must be Public or Private")
        private String visibility = "Public";
        private String imageUrl;
    }
}
