package com.z254.campusvoice.voice.scoring;

import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.domain.model.ImpactLevel;
import com.z254.campusvoice.voice.domain.model.Priority;
import org.springframework.stereotype.Component;

/**
 * Converts a classification and the current vote counts into a priority score.
 * <p>
 * Score composition:
 * <ul>
 *     <li>base score of the detected priority (low 100, medium 300, high 700, critical 1500)</li>
 *     <li>urgency score, 0-100, default 50</li>
 *     <li>impact bonus (individual 50, group 150, campus-wide 300)</li>
 *     <li>{@code max(0, upvotes - downvotes * 0.5) * 5}, truncated</li>
 * </ul>
 * The total is clamped to [0, 2000]. Unknown or missing labels fall back to
 * medium priority and individual impact. Stateless and free of I/O.
 */
@Component
public class PriorityScorer {

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 2000;
    public static final int DEFAULT_URGENCY = 50;
    static final int VOTE_WEIGHT = 5;
    static final double DOWNVOTE_FACTOR = 0.5;

    public PriorityScore score(Classification classification, int upvotes, int downvotes) {
        Classification source = classification != null ? classification : Classification.fallback();

        int base = Priority.fromReportedLabel(source.getPriority())
                .orElse(Priority.MEDIUM)
                .getBaseScore();
        int urgency = urgencyOf(source);
        int impact = ImpactLevel.fromLabel(source.getImpactLevel())
                .orElse(ImpactLevel.INDIVIDUAL)
                .getBonus();
        long votes = voteInfluence(upvotes, downvotes);

        int total = clamp(base + urgency + impact + votes);
        return new PriorityScore(total, Priority.forScore(total));
    }

    static long voteInfluence(int upvotes, int downvotes) {
        double net = Math.max(0.0, upvotes - downvotes * DOWNVOTE_FACTOR);
        return (long) (net * VOTE_WEIGHT);
    }

    private static int urgencyOf(Classification classification) {
        Integer urgency = classification.getUrgencyScore();
        if (urgency == null) {
            return DEFAULT_URGENCY;
        }
        return Math.max(0, Math.min(100, urgency));
    }

    private static int clamp(long score) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
