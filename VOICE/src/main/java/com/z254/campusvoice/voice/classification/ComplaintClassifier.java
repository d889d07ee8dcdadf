package com.z254.campusvoice.voice.classification;

import com.z254.campusvoice.voice.domain.model.Classification;
import reactor.core.publisher.Mono;

/**
 * External categorizer for complaint text.
 * <p>
 * Implementations may fail, time out or return incomplete records;
 * {@link ClassificationGateway} turns all of those into the fallback.
 */
public interface ComplaintClassifier {

    Mono<Classification> classify(String title, String description);

    /**
     * Identifier used in logs and health details.
     */
    String getClassifierId();
}
