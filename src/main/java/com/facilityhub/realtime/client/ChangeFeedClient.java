package com.facilityhub.realtime.client;

import com.facilityhub.realtime.model.domain.ChannelSpec;

/**
 * Boundary to the change-data-capture source.
 * Allows swapping between the in-memory feed and the Kafka-backed feed.
 */
public interface ChangeFeedClient {

    /**
     * Starts a subscription for the channel's tables and returns without
     * waiting for it to be established; the outcome arrives through
     * {@link ChangeFeedListener#onStatus(FeedStatus, Throwable)}.
     */
    ChangeFeedSubscription subscribe(ChannelSpec spec, ChangeFeedListener listener);

    /**
     * Releases a subscription. Safe to call more than once.
     */
    void unsubscribe(ChangeFeedSubscription subscription);
}
