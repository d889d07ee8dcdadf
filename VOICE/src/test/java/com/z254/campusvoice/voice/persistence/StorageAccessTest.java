package com.z254.campusvoice.voice.persistence;

import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.exception.ComplaintNotFoundException;
import com.z254.campusvoice.voice.domain.exception.PersistenceUnavailableException;
import com.z254.campusvoice.voice.domain.exception.TransientPersistenceException;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageAccessTest {

    private SimpleMeterRegistry meterRegistry;
    private StorageAccess storageAccess;

    @BeforeEach
    void setUp() {
        VoiceProperties properties = new VoiceProperties();
        properties.getPersistence().getRetry().setMaxAttempts(4);
        properties.getPersistence().getRetry().setInitialBackoff(Duration.ofMillis(1));
        properties.getPersistence().getRetry().setMaxBackoff(Duration.ofMillis(4));
        meterRegistry = new SimpleMeterRegistry();
        storageAccess = new StorageAccess(properties, new VoiceMetrics(meterRegistry));
    }

    @Test
    void transientFailuresAreRetried() {
        AtomicInteger calls = new AtomicInteger();

        String result = storageAccess.execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientPersistenceException("deadlock detected");
            }
            return "saved";
        });

        assertThat(result).isEqualTo("saved");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(meterRegistry.get("voice.persistence.retries").counter().count()).isEqualTo(2.0);
    }

    @Test
    void exhaustionBecomesUnavailable() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> storageAccess.execute("test", () -> {
            calls.incrementAndGet();
            throw new TransientPersistenceException("connection refused");
        }))
                .isInstanceOf(PersistenceUnavailableException.class)
                .hasCauseInstanceOf(TransientPersistenceException.class);

        assertThat(calls.get()).isEqualTo(4);
        assertThat(meterRegistry.get("voice.persistence.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void domainErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> storageAccess.execute("test", () -> {
            calls.incrementAndGet();
            throw new ComplaintNotFoundException("c-1");
        })).isInstanceOf(ComplaintNotFoundException.class);

        assertThat(calls.get()).isEqualTo(1);
    }
}
