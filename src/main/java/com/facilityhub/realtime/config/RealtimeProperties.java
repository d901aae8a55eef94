package com.facilityhub.realtime.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Settings of the realtime layer, bound from {@code app.realtime.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.realtime")
public class RealtimeProperties {

    private Retry retry = new Retry();

    /** A channel not subscribed within this window counts as a failed attempt. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Upper bound on how long stop() waits for channel workers to exit. */
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    /** Lifetime of an SSE stream before the browser has to reconnect. */
    private Duration sseTimeout = Duration.ofMinutes(30);

    private AdminFeed adminFeed = new AdminFeed();
    private Notifications notifications = new Notifications();
    private Escalation escalation = new Escalation();
    private Kafka kafka = new Kafka();

    @Data
    public static class Retry {
        /** Delay before the first retry; later retries scale with the attempt number. */
        private Duration baseDelay = Duration.ofSeconds(1);
        private int maxAttempts = 3;
        private Backoff backoff = Backoff.LINEAR;
        /** Only used with EXPONENTIAL backoff. */
        private double multiplier = 2.0;
    }

    public enum Backoff {
        LINEAR,
        EXPONENTIAL
    }

    @Data
    public static class AdminFeed {
        private boolean enabled = true;
    }

    @Data
    public static class Notifications {
        private long briefMs = 4000;
        private long shortMs = 6000;
        private long standardMs = 8000;
        private long longMs = 10000;
        private long criticalMs = 12000;
        /** Threads rendering alerts; one keeps alerts in arrival order. */
        private int dispatchThreads = 1;
    }

    @Data
    public static class Escalation {
        private List<String> priorityFields = new ArrayList<>(List.of("priority", "urgency"));
        private Set<String> highValues = new TreeSet<>(Set.of("high"));
    }

    @Data
    public static class Kafka {
        /** Topic of table {@code t} is {@code topicPrefix + t}. */
        private String topicPrefix = "facilities.public.";
        /** Every subscription joins its own consumer group starting with this prefix. */
        private String groupPrefix = "facility-realtime-";
    }
}
