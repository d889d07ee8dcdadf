package com.z254.campusvoice.voice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured result of classifying a complaint.
 * <p>
 * Stored on the complaint as-is and reused for every later priority
 * recalculation. Values are kept as reported, so scoring must tolerate
 * missing or unknown labels.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Classification {

    public static final String FALLBACK_SUMMARY = "Complaint requires manual review";
    public static final String FALLBACK_AUTHORITY = "Student Affairs Officer";

    /** low, medium, high or critical */
    private String priority;

    private String category;

    /** positive, neutral or negative */
    private String sentiment;

    /** 0-100 */
    private Integer urgencyScore;

    /** individual, group or campus-wide */
    private String impactLevel;

    private String summary;

    @Builder.Default
    private List<String> keyIssues = new ArrayList<>();

    private String suggestedAuthority;

    /** True when this record came from the fallback branch rather than the classifier */
    private boolean fallback;

    /**
     * Fixed record used whenever the classifier is unavailable or misbehaves.
     */
    public static Classification fallback() {
        return Classification.builder()
                .priority("medium")
                .category("other")
                .sentiment("neutral")
                .urgencyScore(50)
                .impactLevel("individual")
                .summary(FALLBACK_SUMMARY)
                .keyIssues(new ArrayList<>(List.of("Manual review required")))
                .suggestedAuthority(FALLBACK_AUTHORITY)
                .fallback(true)
                .build();
    }

    public Classification copy() {
        return toBuilder()
                .keyIssues(keyIssues != null ? new ArrayList<>(keyIssues) : new ArrayList<>())
                .build();
    }

    /**
     * Whether the fields every consumer relies on are present.
     */
    public boolean hasRequiredFields() {
        return isPresent(priority) && isPresent(category) && isPresent(summary);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
