package com.facilityhub.realtime.client.impl;

import com.facilityhub.realtime.client.ChangeFeedClient;
import com.facilityhub.realtime.client.ChangeFeedListener;
import com.facilityhub.realtime.client.ChangeFeedSubscription;
import com.facilityhub.realtime.client.FeedStatus;
import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChannelSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory change feed used by tests and the demo profile. Every subscription
 * sees every published event of its tables; connect behaviour is scriptable per
 * channel so that failures, timeouts and drops can be simulated.
 */
@Slf4j
@Service
@Profile({"test", "demo"})
public class MockChangeFeedClient implements ChangeFeedClient {

    public enum ConnectBehavior {
        /** Acknowledge the subscription immediately. */
        SUCCEED,
        /** Report CHANNEL_ERROR immediately. */
        FAIL,
        /** Never answer, so the caller's connect timeout fires. */
        SILENT
    }

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, MockSubscription> active = new ConcurrentHashMap<>();
    private final Map<String, ConnectBehavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, List<Instant>> attempts = new ConcurrentHashMap<>();

    public void setBehavior(String channelName, ConnectBehavior behavior) {
        behaviors.put(channelName, behavior);
    }

    @Override
    public ChangeFeedSubscription subscribe(ChannelSpec spec, ChangeFeedListener listener) {
        attempts.computeIfAbsent(spec.name(), k -> new CopyOnWriteArrayList<>()).add(Instant.now());
        MockSubscription subscription = new MockSubscription(ids.incrementAndGet(), spec, listener);
        ConnectBehavior behavior = behaviors.getOrDefault(spec.name(), ConnectBehavior.SUCCEED);
        log.debug("MOCK - subscribe {} (#{}) -> {}", spec.name(), subscription.id(), behavior);
        switch (behavior) {
            case SUCCEED -> {
                active.put(subscription.id(), subscription);
                listener.onStatus(FeedStatus.SUBSCRIBED, null);
            }
            case FAIL -> listener.onStatus(FeedStatus.CHANNEL_ERROR,
                    new IllegalStateException("Simulated connect failure for " + spec.name()));
            case SILENT -> active.put(subscription.id(), subscription);
        }
        return subscription;
    }

    @Override
    public void unsubscribe(ChangeFeedSubscription subscription) {
        if (subscription instanceof MockSubscription mock && active.remove(mock.id()) != null) {
            log.debug("MOCK - unsubscribe {} (#{})", mock.channelName(), mock.id());
        }
    }

    /**
     * Delivers an event to every open subscription listening to its table, on
     * the calling thread.
     */
    public void publish(ChangeEvent event) {
        for (MockSubscription subscription : active.values()) {
            if (subscription.spec().tables().contains(event.table())) {
                subscription.listener().onEvent(event);
            }
        }
    }

    /**
     * Simulates a dropped connection on every open subscription of a channel.
     */
    public void drop(String channelName) {
        for (MockSubscription subscription : new ArrayList<>(active.values())) {
            if (subscription.channelName().equals(channelName)) {
                active.remove(subscription.id());
                subscription.listener().onStatus(FeedStatus.CLOSED,
                        new IllegalStateException("Simulated connection drop"));
            }
        }
    }

    public List<Instant> connectAttempts(String channelName) {
        return List.copyOf(attempts.getOrDefault(channelName, List.of()));
    }

    public int openSubscriptions(String channelName) {
        return (int) active.values().stream().filter(s -> s.channelName().equals(channelName)).count();
    }

    public void reset() {
        active.clear();
        behaviors.clear();
        attempts.clear();
    }

    private record MockSubscription(long id, ChannelSpec spec, ChangeFeedListener listener)
            implements ChangeFeedSubscription {

        @Override
        public String channelName() {
            return spec.name();
        }
    }
}
