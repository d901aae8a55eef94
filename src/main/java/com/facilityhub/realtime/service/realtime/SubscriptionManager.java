package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.client.ChangeFeedClient;
import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChannelSnapshot;
import com.facilityhub.realtime.model.domain.ChannelSpec;
import com.facilityhub.realtime.model.domain.ManagerStatus;
import com.facilityhub.realtime.model.domain.RoutedAction;
import com.facilityhub.realtime.service.cache.CacheSynchronizer;
import com.facilityhub.realtime.service.notification.NotificationDispatcher;
import com.facilityhub.realtime.service.routing.EventRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the channels of one feed: opens them, retries each one independently,
 * reports aggregate status and tears everything down on {@link #stop()}.
 *
 * <p>Each channel runs its retry loop on its own worker and routes events on
 * its own lane, so a slow or failing channel never holds up another one.
 */
@Slf4j
public class SubscriptionManager {

    private final String name;
    private final ChangeFeedClient client;
    private final EventRouter router;
    private final NotificationDispatcher dispatcher;
    private final CacheSynchronizer cache;
    private final RetryPolicy retryPolicy;
    private final Duration shutdownTimeout;
    private final RealtimeMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, ChannelHandle> handles = new LinkedHashMap<>();
    private final Map<String, ChannelSnapshot> snapshots = new LinkedHashMap<>();
    private ExecutorService workers;
    private boolean running;

    public SubscriptionManager(String name,
                               ChangeFeedClient client,
                               EventRouter router,
                               NotificationDispatcher dispatcher,
                               CacheSynchronizer cache,
                               RetryPolicy retryPolicy,
                               Duration shutdownTimeout,
                               RealtimeMetrics metrics) {
        this.name = name;
        this.client = client;
        this.router = router;
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.retryPolicy = retryPolicy;
        this.shutdownTimeout = shutdownTimeout;
        this.metrics = metrics;
    }

    public String name() {
        return name;
    }

    /**
     * Opens one channel per {@link ChannelSpec} and returns without waiting for any of them.
     *
     * @throws IllegalArgumentException if two specs share a name
     * @throws IllegalStateException    if the manager is already running
     */
    public void start(List<ChannelSpec> specs) {
        Set<String> names = new LinkedHashSet<>();
        for (ChannelSpec spec : specs) {
            if (!names.add(spec.name())) {
                throw new IllegalArgumentException("Duplicate channel name: " + spec.name());
            }
        }
        List<ChannelHandle> opened = new ArrayList<>();
        ExecutorService pool;
        synchronized (lock) {
            if (running) {
                throw new IllegalStateException("Subscription manager " + name + " is already running");
            }
            CustomizableThreadFactory threads = new CustomizableThreadFactory("realtime-" + name + "-");
            threads.setDaemon(true);
            pool = Executors.newCachedThreadPool(threads);
            workers = pool;
            running = true;
            handles.clear();
            snapshots.clear();
            for (ChannelSpec spec : specs) {
                ChannelHandle handle = newHandle(spec);
                handles.put(spec.name(), handle);
                snapshots.put(spec.name(), ChannelSnapshot.connecting(0));
                opened.add(handle);
            }
        }
        log.info("[{}] Starting {} channel(s): {}", name, specs.size(), names);
        opened.forEach(handle -> handle.open(pool));
    }

    /**
     * Closes every channel and waits up to the shutdown timeout for their
     * workers to exit. Safe to call repeatedly.
     */
    public void stop() {
        List<ChannelHandle> closing;
        ExecutorService pool;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            closing = new ArrayList<>(handles.values());
            pool = workers;
            workers = null;
        }
        closing.forEach(ChannelHandle::close);
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Channel workers did not exit within {}", name, shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for channel workers", name);
        }
        log.info("[{}] Stopped {} channel(s)", name, closing.size());
    }

    /**
     * Replaces the named channel with a fresh handle for the same spec, starting
     * again from attempt zero.
     *
     * @throws IllegalStateException    if the manager is not running
     * @throws IllegalArgumentException if no channel has that name
     */
    public void restart(String channelName) {
        ChannelHandle previous;
        ChannelHandle replacement;
        ExecutorService pool;
        synchronized (lock) {
            if (!running) {
                throw new IllegalStateException("Subscription manager " + name + " is not running");
            }
            previous = handles.get(channelName);
            if (previous == null) {
                throw new IllegalArgumentException("Unknown channel: " + channelName);
            }
            replacement = newHandle(previous.spec());
            handles.put(channelName, replacement);
            snapshots.put(channelName, ChannelSnapshot.connecting(0));
            pool = workers;
        }
        log.info("[{}] Restarting channel {}", name, channelName);
        previous.close();
        replacement.open(pool);
    }

    public ManagerStatus status() {
        synchronized (lock) {
            return ManagerStatus.of(snapshots);
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private ChannelHandle newHandle(ChannelSpec spec) {
        ChannelHandle handle = new ChannelHandle(spec, client, retryPolicy, metrics, this::onTransition);
        handle.onEvent(event -> handleEvent(spec.name(), event));
        return handle;
    }

    private void onTransition(ChannelHandle handle, ChannelSnapshot snapshot) {
        synchronized (lock) {
            // a replaced handle may still report while it shuts down
            if (handles.get(handle.name()) == handle) {
                snapshots.put(handle.name(), snapshot);
            }
        }
        log.debug("[{}] Channel {} -> {} (attempt {})", name, handle.name(), snapshot.state(), snapshot.attempt());
    }

    private void handleEvent(String channelName, ChangeEvent event) {
        metrics.recordEventReceived(channelName);
        RoutedAction action = router.route(event);
        if (action.hasNotification()) {
            dispatcher.dispatch(action.notification());
        }
        for (String key : action.invalidationKeys()) {
            try {
                cache.invalidate(key);
            } catch (RuntimeException e) {
                metrics.recordInvalidationFailure();
                log.warn("[{}] Failed to invalidate '{}' after {}/{}: {}", name, key, event.table(),
                        event.operation(), e.getMessage());
            }
        }
        metrics.recordEventRouted(channelName, action.hasNotification());
    }
}
