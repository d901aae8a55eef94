package com.facilityhub.realtime.service.notification;

import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.service.realtime.RealtimeMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands notifications to a {@link NotificationSink} without blocking the caller.
 *
 * <p>Repeated events produce repeated alerts; nothing is de-duplicated here.
 */
@Slf4j
public class NotificationDispatcher {

    private final NotificationSink sink;
    private final Executor executor;
    private final RealtimeMetrics metrics;
    private final AtomicReference<NotificationDescriptor> lastNotification = new AtomicReference<>();

    public NotificationDispatcher(NotificationSink sink, Executor executor, RealtimeMetrics metrics) {
        this.sink = sink;
        this.executor = executor;
        this.metrics = metrics;
    }

    public void dispatch(NotificationDescriptor notification) {
        if (notification == null) {
            return;
        }
        lastNotification.set(notification);
        try {
            executor.execute(() -> show(notification));
        } catch (RejectedExecutionException e) {
            metrics.recordDispatchFailure();
            log.warn("Notification '{}' rejected, dispatcher is shut down", notification.title());
        }
    }

    /**
     * The most recently dispatched notification, if any.
     */
    public Optional<NotificationDescriptor> lastNotification() {
        return Optional.ofNullable(lastNotification.get());
    }

    private void show(NotificationDescriptor notification) {
        try {
            sink.show(notification);
            log.debug("Shown {} notification '{}'", notification.severity(), notification.title());
        } catch (RuntimeException e) {
            metrics.recordDispatchFailure();
            log.warn("Failed to show notification '{}': {}", notification.title(), e.getMessage(), e);
        }
    }
}
