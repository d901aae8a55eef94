package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.client.ChangeFeedClient;
import com.facilityhub.realtime.config.RealtimeProperties;
import com.facilityhub.realtime.service.cache.CompositeCacheSynchronizer;
import com.facilityhub.realtime.service.cache.SpringCacheSynchronizer;
import com.facilityhub.realtime.service.notification.NotificationDispatcher;
import com.facilityhub.realtime.service.notification.SseEventStream;
import com.facilityhub.realtime.service.routing.EventRouter;
import com.facilityhub.realtime.service.routing.NotificationDurations;
import com.facilityhub.realtime.service.routing.RoutingTable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Builds subscription managers wired to the shared feed client, server cache
 * and notification executor. Alerts and invalidations go to the given stream.
 */
@Component
public class SubscriptionManagerFactory {

    private final ChangeFeedClient client;
    private final SpringCacheSynchronizer serverCache;
    private final RetryPolicy retryPolicy;
    private final NotificationDurations durations;
    private final Executor notificationExecutor;
    private final RealtimeProperties properties;
    private final RealtimeMetrics metrics;

    public SubscriptionManagerFactory(ChangeFeedClient client,
                                      SpringCacheSynchronizer serverCache,
                                      RetryPolicy retryPolicy,
                                      NotificationDurations durations,
                                      @Qualifier("realtimeNotificationExecutor") Executor notificationExecutor,
                                      RealtimeProperties properties,
                                      RealtimeMetrics metrics) {
        this.client = client;
        this.serverCache = serverCache;
        this.retryPolicy = retryPolicy;
        this.durations = durations;
        this.notificationExecutor = notificationExecutor;
        this.properties = properties;
        this.metrics = metrics;
    }

    public SubscriptionManager create(String name, RoutingTable routingTable, SseEventStream stream) {
        return new SubscriptionManager(name,
                client,
                new EventRouter(routingTable, durations),
                new NotificationDispatcher(stream, notificationExecutor, metrics),
                CompositeCacheSynchronizer.of(serverCache, stream),
                retryPolicy,
                properties.getShutdownTimeout(),
                metrics);
    }
}
