package com.facilityhub.realtime.client;

/**
 * Opaque reference to an open subscription, handed back to
 * {@link ChangeFeedClient#unsubscribe(ChangeFeedSubscription)}.
 */
public interface ChangeFeedSubscription {

    String channelName();
}
