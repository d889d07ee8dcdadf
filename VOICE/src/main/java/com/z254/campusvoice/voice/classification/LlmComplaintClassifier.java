package com.z254.campusvoice.voice.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.model.Classification;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Classifier backed by an OpenAI-compatible chat completion endpoint
 * (Groq by default) running in JSON mode.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "campusvoice.classifier", name = "enabled", havingValue = "true")
public class LlmComplaintClassifier implements ComplaintClassifier {

    private static final String CLASSIFIER_ID = "llm";
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    static final String SYSTEM_PROMPT = """
            You are an AI assistant that analyzes campus complaints for a college grievance system.
            Respond with a single JSON object with these fields:
            priority (low, medium, high or critical),
            category (food, infrastructure, academic, hostel, transport or other),
            sentiment (positive, neutral or negative),
            urgency_score (integer 0-100),
            impact_level (individual, group or campus-wide),
            summary (one sentence),
            key_issues (list of short strings),
            suggested_authority (who should handle it).
            Safety hazards and issues affecting many students deserve higher priority.""";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final VoiceProperties.Classifier config;

    public LlmComplaintClassifier(VoiceProperties properties,
                                  ObjectMapper objectMapper,
                                  WebClient.Builder webClientBuilder) {
        this.config = properties.getClassifier();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String getClassifierId() {
        return CLASSIFIER_ID;
    }

    @Override
    @CircuitBreaker(name = "classifier")
    public Mono<Classification> classify(String title, String description) {
        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH)
                .bodyValue(buildRequestBody(title, description))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(this::parseResponse)
                .doOnSuccess(result -> log.debug("Classified complaint '{}' as {}/{}",
                        title, result.getCategory(), result.getPriority()))
                .doOnError(e -> log.warn("Classifier call failed: {}", e.getMessage()));
    }

    Map<String, Object> buildRequestBody(String title, String description) {
        String userMessage = "Complaint title: " + title + "\n\nComplaint description: " + description;
        return Map.of(
                "model", config.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", userMessage)),
                "temperature", config.getTemperature(),
                "max_tokens", config.getMaxTokens(),
                "response_format", Map.of("type", "json_object"));
    }

    Classification parseResponse(JsonNode json) {
        JsonNode content = json.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new ClassificationException("Classifier response has no message content");
        }
        try {
            Classification classification = objectMapper.readValue(content.asText(), Classification.class);
            classification.setFallback(false);
            return classification;
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Classifier content is not valid JSON", e);
        }
    }
}
