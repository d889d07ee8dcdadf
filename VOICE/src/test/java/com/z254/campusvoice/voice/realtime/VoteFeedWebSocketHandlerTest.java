package com.z254.campusvoice.voice.realtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.campusvoice.voice.config.VoiceProperties;
import com.z254.campusvoice.voice.observability.VoiceMetrics;
import com.z254.campusvoice.voice.observability.VoiceStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.reactivestreams.Publisher;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link VoteFeedWebSocketHandler}.
 */
@ExtendWith(MockitoExtension.class)
class VoteFeedWebSocketHandlerTest {

    @Mock
    private WebSocketSession session;

    private ObjectMapper objectMapper;
    private BroadcastRegistry registry;
    private VoteFeedWebSocketHandler handler;
    private List<String> sentMessages;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        registry = new BroadcastRegistry(objectMapper, new VoiceMetrics(new SimpleMeterRegistry()),
                new VoiceStructuredLogger(), new VoiceProperties());
        handler = new VoteFeedWebSocketHandler(registry, objectMapper, new VoiceProperties());
        sentMessages = new CopyOnWriteArrayList<>();

        lenient().when(session.getId()).thenReturn("session-1");
        lenient().when(session.isOpen()).thenReturn(true);
        lenient().when(session.close(any())).thenReturn(Mono.empty());
        lenient().when(session.textMessage(anyString())).thenAnswer(inv -> {
            String payload = inv.getArgument(0);
            WebSocketMessage msg = mock(WebSocketMessage.class);
            lenient().when(msg.getPayloadAsText()).thenReturn(payload);
            return msg;
        });
        lenient().when(session.send(any())).thenAnswer(inv -> {
            Publisher<WebSocketMessage> messages = inv.getArgument(0);
            return Flux.from(messages)
                    .doOnNext(msg -> sentMessages.add(msg.getPayloadAsText()))
                    .then();
        });
    }

    private void connectTo(String uri) {
        when(session.getHandshakeInfo())
                .thenReturn(new HandshakeInfo(URI.create(uri), new HttpHeaders(), Mono.empty(), null));
    }

    private WebSocketMessage inbound(String text) {
        WebSocketMessage msg = mock(WebSocketMessage.class);
        when(msg.getPayloadAsText()).thenReturn(text);
        return msg;
    }

    private JsonNode parse(String payload) throws Exception {
        return objectMapper.readTree(payload);
    }

    @Nested
    @DisplayName("Connection Handling")
    class ConnectionHandlingTests {

        @Test
        @DisplayName("should acknowledge, register and release the session")
        void registersForSessionLifetime() throws Exception {
            connectTo("ws://localhost:8000/api/v1/ws/votes/c-1?client=web");
            Sinks.Many<WebSocketMessage> inboundSink = Sinks.many().unicast().onBackpressureBuffer();
            when(session.receive()).thenReturn(inboundSink.asFlux());

            StepVerifier.create(handler.handle(session))
                    .then(() -> {
                        assertThat(registry.getSubscriberCount("c-1")).isEqualTo(1);
                        assertThat(registry.getWatchers("c-1").get(0).getClientInfo())
                                .containsEntry("client", "web");
                        assertThat(registry.broadcastVote("c-1", RealtimeEvents.VoteUpdateEvent.builder()
                                .complaintId("c-1").upvotes(1).totalVotes(1)
                                .action("created").voteType("upvote").build())).isEqualTo(1);
                    })
                    .then(inboundSink::tryEmitComplete)
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(registry.isTracked("c-1")).isFalse();
            assertThat(sentMessages).hasSize(2);
            assertThat(parse(sentMessages.get(0)).path("type").asText()).isEqualTo("connection");
            assertThat(parse(sentMessages.get(1)).path("type").asText()).isEqualTo("vote_update");
        }

        @Test
        @DisplayName("should close sessions without a complaint id")
        void rejectsMissingComplaintId() {
            connectTo("ws://localhost:8000/api/v1/ws/votes/");

            StepVerifier.create(handler.handle(session)).verifyComplete();

            ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
            verify(session).close(status.capture());
            assertThat(status.getValue().getCode()).isEqualTo(CloseStatus.BAD_DATA.getCode());
            verify(session, never()).receive();
        }
    }

    @Nested
    @DisplayName("Message Handling")
    class MessageHandlingTests {

        @Test
        @DisplayName("should respond to plain and JSON pings with pong")
        void respondToPingWithPong() throws Exception {
            connectTo("ws://localhost:8000/api/v1/ws/votes/c-2");
            Flux<WebSocketMessage> messages = Flux.just(
                    inbound("ping"), inbound("{\"type\":\"ping\"}"), inbound("hello"));
            when(session.receive()).thenReturn(messages);

            StepVerifier.create(handler.handle(session))
                    .expectComplete()
                    .verify(Duration.ofSeconds(5));

            assertThat(sentMessages).hasSize(3);
            assertThat(parse(sentMessages.get(1)).path("type").asText()).isEqualTo("pong");
            assertThat(parse(sentMessages.get(2)).path("type").asText()).isEqualTo("pong");
        }
    }

    @Nested
    @DisplayName("Stalled clients")
    class StalledClientTests {

        private static final int BUFFER = 8;

        @Test
        @DisplayName("should refuse frames once the send buffer is full")
        void fullBufferRejectsSend() {
            WebSocketSubscriber subscriber = new WebSocketSubscriber(session, Map.of(), BUFFER);
            for (int i = 0; i < BUFFER; i++) {
                subscriber.send("frame-" + i);
            }

            assertThatThrownBy(() -> subscriber.send("one too many"))
                    .isInstanceOf(ChannelClosedException.class);
        }

        @Test
        @DisplayName("should drop a subscriber that never reads on the next sweeps")
        void sweepDropsNonReadingSubscriber() {
            WebSocketSubscriber subscriber = new WebSocketSubscriber(session, Map.of(), BUFFER);
            registry.subscribe(subscriber, "c-stalled");

            int sweeps = 0;
            int removed = 0;
            while (registry.getSubscriberCount("c-stalled") > 0 && sweeps < 100) {
                removed += registry.sweep();
                sweeps++;
            }

            assertThat(registry.getSubscriberCount("c-stalled")).isZero();
            assertThat(registry.isTracked("c-stalled")).isFalse();
            assertThat(removed).isEqualTo(1);
            assertThat(sweeps).isLessThanOrEqualTo(BUFFER);
            assertThat(subscriber.isClosed()).isTrue();
            verify(session).close(any(CloseStatus.class));
        }

        @Test
        @DisplayName("should keep a subscriber whose frames are drained")
        void drainedSubscriberSurvivesSweeps() {
            WebSocketSubscriber subscriber = new WebSocketSubscriber(session, Map.of(), BUFFER);
            List<String> received = new CopyOnWriteArrayList<>();
            subscriber.outbound().subscribe(received::add);
            registry.subscribe(subscriber, "c-live");

            for (int i = 0; i < BUFFER * 4; i++) {
                registry.sweep();
            }

            assertThat(registry.getSubscriberCount("c-live")).isEqualTo(1);
            assertThat(received).hasSize(1 + BUFFER * 4);
        }
    }

    @Nested
    @DisplayName("Path parsing")
    class PathParsingTests {

        @Test
        @DisplayName("should extract the complaint id from the path")
        void extractsComplaintId() {
            assertThat(VoteFeedWebSocketHandler.extractComplaintId(
                    URI.create("ws://host/api/v1/ws/votes/abc-123"))).isEqualTo("abc-123");
            assertThat(VoteFeedWebSocketHandler.extractComplaintId(
                    URI.create("ws://host/api/v1/ws/votes/abc-123/"))).isEqualTo("abc-123");
            assertThat(VoteFeedWebSocketHandler.extractComplaintId(
                    URI.create("ws://host/api/v1/ws/votes/a/b"))).isNull();
            assertThat(VoteFeedWebSocketHandler.extractComplaintId(
                    URI.create("ws://host/api/v1/other/abc"))).isNull();
        }

        @Test
        @DisplayName("should keep the first value of each query parameter")
        void parsesClientInfo() {
            assertThat(VoteFeedWebSocketHandler.clientInfo(
                    URI.create("ws://host/api/v1/ws/votes/x?client=android&client=ios&v=2")))
                    .containsEntry("client", "android")
                    .containsEntry("v", "2");
        }
    }
}
