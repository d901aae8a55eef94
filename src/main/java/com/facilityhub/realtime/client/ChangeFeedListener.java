package com.facilityhub.realtime.client;

import com.facilityhub.realtime.model.domain.ChangeEvent;

/**
 * Callbacks of one subscription. Implementations must return quickly; they run
 * on the feed's own threads.
 */
public interface ChangeFeedListener {

    void onEvent(ChangeEvent event);

    /**
     * @param status new connection status
     * @param cause  failure behind CHANNEL_ERROR or CLOSED, may be null
     */
    void onStatus(FeedStatus status, Throwable cause);
}
