package com.z254.campusvoice.voice.domain.service;

import com.z254.campusvoice.voice.domain.model.Visibility;
import lombok.Builder;
import lombok.Data;

/**
 * Complaint submission along with the submitter's profile details.
 */
@Data
@Builder
public class NewComplaint {
    private String submitterId;
    private String submitterName;
    private String submitterEmail;
    private String department;
    private String stayType;
    private String title;
    private String description;
    @Builder.Default
    private Visibility visibility = Visibility.PUBLIC;
    private String imageUrl;
}
