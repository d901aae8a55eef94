package com.facilityhub.realtime.model.domain;

/**
 * Point-in-time view of one channel.
 *
 * @param state            current lifecycle state
 * @param attempt          consecutive failed or in-flight attempts since the last successful subscribe
 * @param lastError        message of the most recent failure, may be null
 * @param retriesExhausted true once the channel gave up and waits for an explicit restart
 */
public record ChannelSnapshot(ChannelState state, int attempt, String lastError, boolean retriesExhausted) {

    public static ChannelSnapshot connecting(int attempt) {
        return new ChannelSnapshot(ChannelState.CONNECTING, attempt, null, false);
    }
}
