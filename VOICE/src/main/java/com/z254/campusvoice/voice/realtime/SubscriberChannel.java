package com.z254.campusvoice.voice.realtime;

import java.time.Instant;
import java.util.Map;

/**
 * An open realtime connection that can receive text frames.
 */
public interface SubscriberChannel {

    String getId();

    Instant getConnectedAt();

    /**
     * Optional metadata supplied by the client when connecting.
     */
    Map<String, String> getClientInfo();

    /**
     * Deliver a text payload.
     *
     * @throws ChannelClosedException if the channel can no longer accept messages
     */
    void send(String payload);

    /**
     * Close the channel with the given reason. Closing twice is harmless.
     */
    void close(String reason);
}
