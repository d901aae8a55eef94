package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.model.domain.ManagerStatus;
import com.facilityhub.realtime.service.notification.SseEventStream;
import com.facilityhub.realtime.service.routing.RoutingTable;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * The shared admin dashboard feed. Subscribes once the application is ready
 * and unsubscribes on shutdown.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.realtime.admin-feed", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class AdminRealtimeFeed {

    private final SubscriptionManager manager;
    private final SseEventStream stream;

    public AdminRealtimeFeed(SubscriptionManagerFactory factory,
                             @Qualifier("adminRoutingTable") RoutingTable adminRoutingTable,
                             @Qualifier("adminEventStream") SseEventStream stream) {
        this.stream = stream;
        this.manager = factory.create("admin", adminRoutingTable, stream);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        log.info("Starting admin realtime feed");
        manager.start(RealtimeChannels.admin());
    }

    @PreDestroy
    public void stop() {
        manager.stop();
        stream.close();
    }

    public ManagerStatus status() {
        return manager.status();
    }

    /**
     * @throws IllegalArgumentException for an unknown channel
     * @throws IllegalStateException    if the feed is not running
     */
    public void restart(String channelName) {
        manager.restart(channelName);
    }

    public SseEmitter connect() {
        return stream.connect();
    }
}
