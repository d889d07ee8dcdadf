package com.z254.campusvoice.voice.realtime;

/**
 * Send attempted on a channel that is closed or can no longer buffer messages.
 */
public class ChannelClosedException extends RuntimeException {

    public ChannelClosedException(String channelId, String detail) {
        super("Channel " + channelId + " rejected message: " + detail);
    }
}
