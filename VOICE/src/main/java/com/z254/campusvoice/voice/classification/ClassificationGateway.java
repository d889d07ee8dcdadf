package com.z254.campusvoice.voice.classification;

import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.model.Classification;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for complaint classification.
 * <p>
 * Every call resolves to a classification: the classifier's answer when it
 * is complete and arrives within the timeout, otherwise the fixed
 * {@link Classification#fallback()} record. Errors never reach the caller.
 */
@Slf4j
@Component
public class ClassificationGateway {

    private final ComplaintClassifier classifier;
    private final Duration timeout;
    private final VoiceMetrics metrics;

    public ClassificationGateway(Optional<ComplaintClassifier> classifier,
                                 VoiceProperties properties,
                                 VoiceMetrics metrics) {
        this.classifier = classifier.orElse(null);
        this.timeout = properties.getClassifier().getTimeout();
        this.metrics = metrics;
        if (this.classifier == null) {
            log.info("No complaint classifier configured; all complaints get the fallback classification");
        }
    }

    public Mono<Classification> classify(String title, String description) {
        Timer.Sample sample = metrics.startClassification();
        if (classifier == null) {
            metrics.recordClassification(sample, true);
            return Mono.just(Classification.fallback());
        }

        return Mono.defer(() -> classifier.classify(title, description))
                .timeout(timeout)
                .flatMap(this::requireComplete)
                .switchIfEmpty(Mono.error(() -> new ClassificationException("Classifier returned no result")))
                .onErrorResume(error -> Mono.just(fallbackFor(error)))
                .doOnNext(result -> metrics.recordClassification(sample, result.isFallback()));
    }

    public boolean isClassifierConfigured() {
        return classifier != null;
    }

    public String getClassifierId() {
        return classifier != null ? classifier.getClassifierId() : "fallback";
    }

    private Mono<Classification> requireComplete(Classification result) {
        if (!result.hasRequiredFields()) {
            return Mono.error(new ClassificationException(
                    "Classification missing required fields (priority, category, summary)"));
        }
        return Mono.just(result);
    }

    private Classification fallbackFor(Throwable error) {
        String reason = error instanceof TimeoutException
                ? "timed out after " + timeout.toMillis() + "ms"
                : error.getClass().getSimpleName() + ": " + error.getMessage();
        log.warn("Classifier {} unavailable ({}); using fallback classification",
                classifier.getClassifierId(), reason);
        return Classification.fallback();
    }
}
