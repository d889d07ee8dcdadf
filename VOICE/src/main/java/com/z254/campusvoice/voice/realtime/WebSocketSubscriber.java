package com.z254.campusvoice.voice.realtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link SubscriberChannel} backed by a reactive WebSocket session.
 * <p>
 * Messages go through a unicast sink that the session's outbound stream
 * drains, so frames queued before the stream subscribes are not lost.
 * The queue is bounded: once a client stops reading, {@link #send} fails
 * with {@link ChannelClosedException} and the registry drops the channel.
 */
@Slf4j
public class WebSocketSubscriber implements SubscriberChannel {

    private final WebSocketSession session;
    private final Instant connectedAt = Instant.now();
    private final Map<String, String> clientInfo;
    private final Sinks.Many<String> outbound;
    private final AtomicBoolean closed = new AtomicBoolean();

    public WebSocketSubscriber(WebSocketSession session, Map<String, String> clientInfo, int sendBufferSize) {
        this.session = session;
        this.clientInfo = Map.copyOf(clientInfo);
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(sendBufferSize).get());
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public Instant getConnectedAt() {
        return connectedAt;
    }

    @Override
    public Map<String, String> getClientInfo() {
        return clientInfo;
    }

    /**
     * Outbound frames for this session.
     */
    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    @Override
    public synchronized void send(String payload) {
        if (closed.get() || !session.isOpen()) {
            throw new ChannelClosedException(getId(), "session closed");
        }
        Sinks.EmitResult result = outbound.tryEmitNext(payload);
        if (result.isFailure()) {
            throw new ChannelClosedException(getId(), result.name());
        }
    }

    @Override
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            outbound.tryEmitComplete();
        }
        session.close(CloseStatus.GOING_AWAY.withReason(reason))
                .subscribe(null, e -> log.debug("Close of session {} failed: {}", getId(), e.getMessage()));
    }

    /**
     * Mark the channel finished after the client went away.
     */
    public void complete() {
        if (closed.compareAndSet(false, true)) {
            synchronized (this) {
                outbound.tryEmitComplete();
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
