package com.z254.campusvoice.voice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Configuration properties for the VOICE service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Complaint classifier endpoint and limits</li>
 *     <li>Realtime feed sweep and shutdown behaviour</li>
 *     <li>Storage retry policy</li>
 *     <li>Complaint feed paging</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "campusvoice")
public class VoiceProperties {

    @Valid
    private final Classifier classifier = new Classifier();

    @Valid
    private final Realtime realtime = new Realtime();

    @Valid
    private final Persistence persistence = new Persistence();

    @Valid
    private final Feed feed = new Feed();

    /**
     * OpenAI-compatible chat completion endpoint used to classify complaints.
     */
    @Data
    public static class Classifier {
        /** When false every complaint gets the fallback classification */
        private boolean enabled = false;

        @NotBlank
        private String baseUrl = "https://api.groq.com/openai/v1";

        private String apiKey;

        @NotBlank
        private String model = "llama-3.3-70b-versatile";

        private double temperature = 0.1;

        @Positive
        private int maxTokens = 500;

        /** Upper bound for one classification, after which the fallback applies */
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * WebSocket vote feed.
     */
    @Data
    public static class Realtime {
        private boolean sweepEnabled = true;

        /** Interval between liveness probes of every open channel */
        private Duration sweepInterval = Duration.ofMinutes(5);

        /** Close reason sent to every channel on shutdown */
        private String shutdownReason = "Server shutdown";

        /** Outbound frames queued per channel before a non-reading client is dropped */
        @Min(1)
        private int sendBufferSize = 256;
    }

    @Data
    public static class Persistence {
        @Valid
        private final Retry retry = new Retry();

        /**
         * Retry policy for transient storage failures.
         */
        @Data
        public static class Retry {
            @Min(1)
            private int maxAttempts = 3;

            private Duration initialBackoff = Duration.ofMillis(50);

            @DecimalMin("1.0")
            private double multiplier = 2.0;

            private Duration maxBackoff = Duration.ofSeconds(1);
        }
    }

    @Data
    public static class Feed {
        @Positive
        private int defaultPageSize = 50;

        @Positive
        private int maxPageSize = 100;

        /** Public feed descriptions are cut to this many characters */
        @Positive
        private int descriptionPreviewLength = 200;
    }
}
