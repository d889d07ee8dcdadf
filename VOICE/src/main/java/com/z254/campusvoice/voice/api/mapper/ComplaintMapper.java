package com.z254.campusvoice.voice.api.mapper;

import com.z254.campusvoice.voice.api.dto.ComplaintDto;
import com.z254.campusvoice.voice.api.dto.ComplaintListResponse;
import com.z254.campusvoice.voice.api.dto.ComplaintSummaryDto;
import com.z254.campusvoice.voice.api.dto.PriorityRecalculationResponse;
import com.z254.campusvoice.voice.api.dto.StatusChangeDto;
import com.z254.campusvoice.voice.api.dto.StatusUpdateResponse;
import com.z254.campusvoice.voice.api.dto.SubmitComplaintResponse;
import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.domain.model.Complaint;
import com.z254.campusvoice.voice.domain.model.StatusChange;
import com.z254.campusvoice.voice.domain.service.ComplaintPage;
import com.z254.campusvoice.voice.domain.service.PriorityRecalculation;
import com.z254.campusvoice.voice.domain.service.StatusUpdateResult;

/**
 * Mapper for complaint and status conversions.
 */
public final class ComplaintMapper {

    private ComplaintMapper() {}

    public static ComplaintDto toDto(Complaint complaint) {
        return ComplaintDto.builder()
                .id(complaint.getId())
                .title(complaint.getTitle())
                .description(complaint.getDescription())
                .visibility(complaint.getVisibility().getLabel())
                .status(complaint.getStatus().getLabel())
                .priority(complaint.getPriority().getLabel())
                .priorityScore(complaint.getPriorityScore())
                .category(complaint.getCategory().getLabel())
                .assignedAuthority(complaint.getAssignedAuthority())
                .authorityEmail(complaint.getAuthorityEmail())
                .authorityDepartment(complaint.getAuthorityDepartment())
                .upvotes(complaint.getUpvotes())
                .downvotes(complaint.getDownvotes())
                .netVotes(complaint.getNetVotes())
                .submitterId(complaint.getSubmitterId())
                .imageUrl(complaint.getImageUrl())
                .classification(complaint.getClassification())
                .submittedAt(complaint.getSubmittedAt())
                .updatedAt(complaint.getUpdatedAt())
                .resolvedAt(complaint.getResolvedAt())
                .build();
    }

    public static ComplaintSummaryDto toSummary(Complaint complaint, int previewLength) {
        return ComplaintSummaryDto.builder()
                .id(complaint.getId())
                .title(complaint.getTitle())
                .description(preview(complaint.getDescription(), previewLength))
                .status(complaint.getStatus().getLabel())
                .priority(complaint.getPriority().getLabel())
                .priorityScore(complaint.getPriorityScore())
                .category(complaint.getCategory().getLabel())
                .assignedAuthority(complaint.getAssignedAuthority())
                .upvotes(complaint.getUpvotes())
                .downvotes(complaint.getDownvotes())
                .netVotes(complaint.getNetVotes())
                .submittedAt(complaint.getSubmittedAt())
                .resolvedAt(complaint.getResolvedAt())
                .build();
    }

    public static ComplaintListResponse toListResponse(ComplaintPage page, int previewLength) {
        return ComplaintListResponse.builder()
                .complaints(page.complaints().stream()
                        .map(c -> toSummary(c, previewLength))
                        .toList())
                .total(page.total())
                .limit(page.limit())
                .offset(page.offset())
                .build();
    }

    public static SubmitComplaintResponse toSubmitResponse(Complaint complaint) {
        Classification classification = complaint.getClassification();
        return SubmitComplaintResponse.builder()
                .complaintId(complaint.getId())
                .title(complaint.getTitle())
                .priority(complaint.getPriority().getLabel())
                .priorityScore(complaint.getPriorityScore())
                .category(complaint.getCategory().getLabel())
                .urgencyScore(classification != null ? classification.getUrgencyScore() : null)
                .assignedTo(complaint.getAssignedAuthority())
                .authorityEmail(complaint.getAuthorityEmail())
                .authorityDepartment(complaint.getAuthorityDepartment())
                .summary(classification != null ? classification.getSummary() : null)
                .status(complaint.getStatus().getLabel())
                .visibility(complaint.getVisibility().getLabel())
                .submittedAt(complaint.getSubmittedAt())
                .build();
    }

    public static StatusUpdateResponse toStatusResponse(StatusUpdateResult result) {
        StatusChange change = result.change();
        return StatusUpdateResponse.builder()
                .complaintId(change.getComplaintId())
                .oldStatus(change.getOldStatus().getLabel())
                .newStatus(change.getNewStatus().getLabel())
                .updatedBy(change.getActor())
                .reason(change.getReason())
                .resolvedAt(result.complaint().getResolvedAt())
                .timestamp(change.getTimestamp())
                .build();
    }

    public static StatusChangeDto toDto(StatusChange change) {
        return StatusChangeDto.builder()
                .oldStatus(change.getOldStatus().getLabel())
                .newStatus(change.getNewStatus().getLabel())
                .updatedBy(change.getActor())
                .reason(change.getReason())
                .timestamp(change.getTimestamp())
                .build();
    }

    public static PriorityRecalculationResponse toRecalculationResponse(PriorityRecalculation result) {
        return PriorityRecalculationResponse.builder()
                .complaintId(result.complaint().getId())
                .oldPriority(result.oldPriority().getLabel())
                .newPriority(result.newPriority().getLabel())
                .priorityScore(result.score())
                .priorityChanged(result.changed())
                .upvotes(result.complaint().getUpvotes())
                .downvotes(result.complaint().getDownvotes())
                .build();
    }

    static String preview(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
