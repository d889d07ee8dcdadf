package com.z254.campusvoice.voice.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.z254.campusvoice.voice.api.dto.StatusUpdateResponse;
import com.z254.campusvoice.voice.api.mapper.ComplaintMapper;
import com.z254.campusvoice.voice.domain.service.StatusWorkflow;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST API controller for authority status updates.
 */
@RestController
@RequestMapping("/api/v1/status")
@Tag(name = "Status", description = "Authority status updates")
public class StatusController {

    private final StatusWorkflow statusWorkflow;

    public StatusController(StatusWorkflow statusWorkflow) {
        this.statusWorkflow = statusWorkflow;
    }

    @PostMapping("/update")
    @Operation(summary = "Update status",
               description = "Move a complaint to raised, opened, reviewed or closed and notify live subscribers")
    public Mono<ResponseEntity<StatusUpdateResponse>> updateStatus(
            @Valid @RequestBody StatusUpdateRequest request) {

        return Mono.fromCallable(() -> statusWorkflow.updateStatus(
                        request.getComplaintId(), request.getNewStatus(), request.getActor(), request.getReason()))
                .map(ComplaintMapper::toStatusResponse)
                .map(ResponseEntity::ok)
                .subscribeOn(Schedulers.boundedElastic());
    }

    // ========== Request DTOs ==========

    @lombok.Data
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class StatusUpdateRequest {
        @NotBlank
        private String complaintId;
        @NotBlank
        private String newStatus;
        /** Identifier of whoever makes the change */
        @NotBlank
        private String actor;
        @Size(max = 500)
        private String reason;
    }
}
