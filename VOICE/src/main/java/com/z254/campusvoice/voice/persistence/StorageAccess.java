package com.z254.campusvoice.voice.persistence;

import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.exception.PersistenceUnavailableException;
import com.z254.campusvoice.voice.domain.exception.TransientPersistenceException;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Storage-access boundary.
 * <p>
 * Retries units of work that fail with {@link TransientPersistenceException}
 * using bounded exponential backoff. Each unit must leave storage untouched
 * when it fails, so a retry starts from a clean state. Any other exception
 * propagates on the first attempt.
 */
@Slf4j
@Component
public class StorageAccess {

    private final Retry retry;
    private final VoiceMetrics metrics;

    public StorageAccess(VoiceProperties properties, VoiceMetrics metrics) {
        this.metrics = metrics;
        VoiceProperties.Persistence.Retry config = properties.getPersistence().getRetry();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        config.getInitialBackoff().toMillis(),
                        config.getMultiplier(),
                        config.getMaxBackoff().toMillis()))
                .retryExceptions(TransientPersistenceException.class)
                .build();

        this.retry = Retry.of("persistence", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> {
            metrics.recordPersistenceRetry();
            log.warn("Transient storage failure, attempt {} of {}: {}",
                    event.getNumberOfRetryAttempts(), config.getMaxAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown");
        });
    }

    /**
     * Run a unit of work, retrying transient failures.
     *
     * @throws PersistenceUnavailableException when every attempt failed transiently
     */
    public <T> T execute(String operation, Supplier<T> work) {
        try {
            return Retry.decorateSupplier(retry, work).get();
        } catch (TransientPersistenceException e) {
            metrics.recordPersistenceFailure();
            log.error("Storage operation {} failed after {} attempts", operation,
                    retry.getRetryConfig().getMaxAttempts(), e);
            throw new PersistenceUnavailableException(operation, e);
        }
    }
}
