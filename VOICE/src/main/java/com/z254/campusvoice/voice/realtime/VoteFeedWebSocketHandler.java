package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WebSocket handler for the live vote feed of a single complaint.
 * <p>
 * Path: {@value #PATH_PREFIX}{complaintId}. Query parameters of the
 * handshake are kept as client metadata. The client may send {@code ping}
 * (plain or as {@code {"type":"ping"}}) and receives a pong.
 */
@Slf4j
@Component
public class VoteFeedWebSocketHandler implements WebSocketHandler {

    public static final String PATH_PREFIX = "/api/v1/ws/votes/";
    public static final String PATH_PATTERN = PATH_PREFIX + "{complaintId}";

    private final BroadcastRegistry registry;
    private final ObjectMapper objectMapper;
    private final int sendBufferSize;

    public VoteFeedWebSocketHandler(BroadcastRegistry registry, ObjectMapper objectMapper,
                                    VoiceProperties properties) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.sendBufferSize = properties.getRealtime().getSendBufferSize();
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        URI uri = session.getHandshakeInfo().getUri();
        String complaintId = extractComplaintId(uri);
        if (complaintId == null) {
            log.warn("Rejecting vote feed session {} without complaint id: {}", session.getId(), uri);
            return session.close(CloseStatus.BAD_DATA.withReason("Complaint id required"));
        }

        WebSocketSubscriber subscriber = new WebSocketSubscriber(session, clientInfo(uri), sendBufferSize);
        log.info("Vote feed session opened: {} for complaint {}", session.getId(), complaintId);

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .doOnNext(text -> handleClientMessage(subscriber, complaintId, text))
                .then()
                .doFinally(signal -> subscriber.complete());

        Mono<Void> output = session.send(subscriber.outbound().map(session::textMessage));

        return Mono.fromRunnable(() -> registry.subscribe(subscriber, complaintId))
                .then(output.and(input))
                .doFinally(signalType -> {
                    registry.unsubscribe(subscriber, complaintId);
                    log.info("Vote feed session closed: {} for complaint {} - {}",
                            session.getId(), complaintId, signalType);
                });
    }

    private void handleClientMessage(WebSocketSubscriber subscriber, String complaintId, String text) {
        if (!isPing(text)) {
            log.debug("Ignoring client message on complaint {}: {}", complaintId, text);
            return;
        }
        try {
            subscriber.send(objectMapper.writeValueAsString(RealtimeEvents.pong()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize pong: {}", e.getMessage());
        } catch (ChannelClosedException e) {
            log.debug("Pong not delivered: {}", e.getMessage());
        }
    }

    private boolean isPing(String text) {
        String trimmed = text.trim();
        if (RealtimeEvents.PING.equalsIgnoreCase(trimmed)) {
            return true;
        }
        if (!trimmed.startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(trimmed);
            return RealtimeEvents.PING.equals(node.path("type").asText());
        } catch (JsonProcessingException e) {
            log.debug("Invalid JSON from client: {}", e.getMessage());
            return false;
        }
    }

    static String extractComplaintId(URI uri) {
        String path = uri.getPath();
        if (path == null || !path.startsWith(PATH_PREFIX)) {
            return null;
        }
        String id = path.substring(PATH_PREFIX.length());
        if (id.endsWith("/")) {
            id = id.substring(0, id.length() - 1);
        }
        return id.isBlank() || id.contains("/") ? null : id;
    }

    static Map<String, String> clientInfo(URI uri) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        Map<String, String> info = new LinkedHashMap<>();
        params.forEach((key, values) -> {
            if (!values.isEmpty() && values.get(0) != null) {
                info.put(key, values.get(0));
            }
        });
        return info;
    }
}
