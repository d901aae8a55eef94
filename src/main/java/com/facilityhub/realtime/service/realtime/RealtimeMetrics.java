package com.facilityhub.realtime.service.realtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Counters for the realtime pipeline.
 */
@Slf4j
@Component
public class RealtimeMetrics {

    private final MeterRegistry registry;
    private final Counter dispatchFailed;
    private final Counter invalidationFailed;

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.dispatchFailed = registry.counter("realtime.dispatch.failed");
        this.invalidationFailed = registry.counter("realtime.invalidation.failed");
    }

    public void recordEventReceived(String channel) {
        registry.counter("realtime.events.received", "channel", channel).increment();
    }

    public void recordEventRouted(String channel, boolean notified) {
        registry.counter("realtime.events.routed", "channel", channel, "notified", String.valueOf(notified))
                .increment();
    }

    public void recordRetry(String channel) {
        registry.counter("realtime.channel.retries", "channel", channel).increment();
        log.debug("Recorded retry metric for channel {}", channel);
    }

    public void recordExhausted(String channel) {
        registry.counter("realtime.channel.exhausted", "channel", channel).increment();
    }

    public void recordDispatchFailure() {
        dispatchFailed.increment();
    }

    public void recordInvalidationFailure() {
        invalidationFailed.increment();
    }
}
