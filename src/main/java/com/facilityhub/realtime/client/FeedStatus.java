package com.facilityhub.realtime.client;

/**
 * Connection signals reported by a change feed subscription.
 */
public enum FeedStatus {
    SUBSCRIBED,
    CHANNEL_ERROR,
    TIMED_OUT,
    CLOSED
}
