package com.z254.campusvoice.voice.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Complaint entity.
 * <p>
 * Counters, priority and status are only changed by the vote ledger and
 * the status workflow. Repositories hand out copies, so an edit is not
 * visible to anyone until it is saved.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Complaint {

    /** Unique complaint identifier */
    private String id;

    private String title;

    private String description;

    @Builder.Default
    private Visibility visibility = Visibility.PUBLIC;

    @Builder.Default
    private ComplaintStatus status = ComplaintStatus.RAISED;

    @Builder.Default
    private Priority priority = Priority.MEDIUM;

    /** Numeric priority score (0-2000) */
    private int priorityScore;

    private int upvotes;

    private int downvotes;

    @Builder.Default
    private Category category = Category.OTHER;

    /** Authority the complaint was routed to */
    private String assignedAuthority;

    private String authorityEmail;

    private String authorityDepartment;

    /** Classification payload captured at submission */
    private Classification classification;

    /** Roll number of the submitting student */
    private String submitterId;

    private String imageUrl;

    private Instant submittedAt;

    private Instant updatedAt;

    /** Set when the complaint is closed */
    private Instant resolvedAt;

    public int getNetVotes() {
        return upvotes - downvotes;
    }

    public int getTotalVotes() {
        return upvotes + downvotes;
    }

    public int countOf(VoteType type) {
        return type == VoteType.UPVOTE ? upvotes : downvotes;
    }

    /**
     * Adjust the counter for a vote type, never going below zero.
     */
    public void adjustCount(VoteType type, int delta) {
        if (type == VoteType.UPVOTE) {
            upvotes = Math.max(0, upvotes + delta);
        } else {
            downvotes = Math.max(0, downvotes + delta);
        }
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    public Complaint copy() {
        return toBuilder()
                .classification(classification != null ? classification.copy() : null)
                .build();
    }
}
