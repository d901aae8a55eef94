package com.facilityhub.realtime.model.domain;

/**
 * Lifecycle state of a single channel subscription.
 */
public enum ChannelState {
    CONNECTING,
    SUBSCRIBED,
    FAILED,
    CLOSED
}
