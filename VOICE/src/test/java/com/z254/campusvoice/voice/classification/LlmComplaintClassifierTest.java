package com.z254.campusvoice.voice.classification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.domain.model.Classification;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmComplaintClassifierTest {

    private ObjectMapper objectMapper;
    private VoiceProperties properties;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        properties = new VoiceProperties();
        properties.getClassifier().setEnabled(true);
        properties.getClassifier().setBaseUrl("http://classifier.local/v1");
        properties.getClassifier().setApiKey("test-key");
        lastRequest = new AtomicReference<>();
    }

    private LlmComplaintClassifier classifierReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        return new LlmComplaintClassifier(properties, objectMapper, builder);
    }

    private String completion(String content) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }

    @Test
    void parsesJsonModeCompletion() throws Exception {
        String content = """
                {"priority": "high", "category": "food", "sentiment": "negative",
                 "urgency_score": 85, "impact_level": "campus-wide",
                 "summary": "Food poisoning after lunch", "key_issues": ["hygiene"],
                 "suggested_authority": "Mess Committee Head", "confidence": 0.9}""";
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.OK, completion(content));

        StepVerifier.create(classifier.classify("Food poisoning", "Several students fell ill after lunch"))
                .assertNext(result -> {
                    assertThat(result.isFallback()).isFalse();
                    assertThat(result.getPriority()).isEqualTo("high");
                    assertThat(result.getCategory()).isEqualTo("food");
                    assertThat(result.getUrgencyScore()).isEqualTo(85);
                    assertThat(result.getImpactLevel()).isEqualTo("campus-wide");
                    assertThat(result.getKeyIssues()).containsExactly("hygiene");
                })
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertThat(request.url().toString()).isEqualTo("http://classifier.local/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
    }

    @Test
    void upstreamErrorPropagates() {
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(classifier.classify("Broken fan", "The fan in room 204 does not work"))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    @Test
    void requestBodyUsesJsonModeAndConfiguredModel() {
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.OK, "{}");

        Map<String, Object> body = classifier.buildRequestBody("Broken fan", "The fan does not work");

        assertThat(body).containsEntry("model", "llama-3.3-70b-versatile")
                .containsEntry("max_tokens", 500)
                .containsEntry("response_format", Map.of("type", "json_object"));
        assertThat((List<?>) body.get("messages")).hasSize(2);
    }

    @Test
    void missingContentIsRejected() throws Exception {
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.OK, "{}");
        JsonNode empty = objectMapper.readTree("{\"choices\": []}");

        assertThatThrownBy(() -> classifier.parseResponse(empty))
                .isInstanceOf(ClassificationException.class);
    }

    @Test
    void nonJsonContentIsRejected() throws Exception {
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.OK, "{}");
        JsonNode prose = objectMapper.readTree(completion("I think this is a high priority issue."));

        assertThatThrownBy(() -> classifier.parseResponse(prose))
                .isInstanceOf(ClassificationException.class);
    }

    @Test
    void fallbackFlagIsNeverTakenFromTheModel() throws Exception {
        LlmComplaintClassifier classifier = classifierReturning(HttpStatus.OK, "{}");
        JsonNode node = objectMapper.readTree(completion(
                "{\"priority\": \"low\", \"category\": \"other\", \"summary\": \"x\", \"fallback\": true}"));

        Classification result = classifier.parseResponse(node);

        assertThat(result.isFallback()).isFalse();
    }
}
