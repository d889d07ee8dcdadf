package com.z254.campusvoice.voice.api.v1;

import com.z254.campusvoice.voice.api.dto.ComplaintListResponse;
import com.z254.campusvoice.voice.api.mapper.ComplaintMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.service.ComplaintService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for the per-authority complaint queue.
 */
@Validated
@RestController
@RequestMapping("/api/v1/authority")
@Tag(name = "Complaints")
public class AuthorityController {

    private final ComplaintService complaintService;
    private final int previewLength;

    public AuthorityController(ComplaintService complaintService, VoiceProperties properties) {
        this.complaintService = complaintService;
        this.previewLength = properties.getFeed().getDescriptionPreviewLength();
    }

    @GetMapping("/{authorityType}/complaints")
    @Operation(summary = "Authority queue",
               description = "Complaints routed to the authority for a category, newest first")
    public Mono<ResponseEntity<ComplaintListResponse>> listForAuthority(
            @Parameter(description = "food, infrastructure, academic, hostel, transport or other")
            @PathVariable String authorityType,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @Min(1) @Max(100) Integer limit,
            @RequestParam(required = false) @Min(0) Integer offset) {

        return Mono.fromCallable(() -> complaintService.listForAuthority(
                        authorityType, ComplaintController.parseStatus(status), limit, offset))
                .map(page -> ResponseEntity.ok(ComplaintMapper.toListResponse(page, previewLength)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
