package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.client.ChangeFeedClient;
import com.facilityhub.realtime.client.ChangeFeedListener;
import com.facilityhub.realtime.client.ChangeFeedSubscription;
import com.facilityhub.realtime.client.FeedStatus;
import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChannelSnapshot;
import com.facilityhub.realtime.model.domain.ChannelSpec;
import com.facilityhub.realtime.model.domain.ChannelState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Runtime state of one channel: a single retry loop that subscribes, waits for
 * the feed to acknowledge, waits for a drop and backs off between failures.
 *
 * <pre>
 * CONNECTING --ack--------> SUBSCRIBED
 * CONNECTING --error/timeout--> FAILED --backoff--> CONNECTING
 * SUBSCRIBED --drop-------> FAILED
 * any --close()-----------> CLOSED
 * </pre>
 *
 * Events are handed to the sink on a lane owned by this handle, so they keep
 * their receipt order and never wait on another channel.
 */
@Slf4j
public class ChannelHandle {

    private final ChannelSpec spec;
    private final ChangeFeedClient client;
    private final RetryPolicy retryPolicy;
    private final RealtimeMetrics metrics;
    private final BiConsumer<ChannelHandle, ChannelSnapshot> transitions;
    private final ExecutorService deliveryLane;
    private final BlockingQueue<FeedSignal> signals = new LinkedBlockingQueue<>();

    private final Object lock = new Object();
    private ChannelState state = ChannelState.CONNECTING;
    private int attempt;
    private String lastError;
    private boolean retriesExhausted;
    private boolean closed;
    private ChangeFeedSubscription current;
    private Future<?> worker;
    private volatile long generation;
    private volatile Consumer<ChangeEvent> sink;

    public ChannelHandle(ChannelSpec spec,
                         ChangeFeedClient client,
                         RetryPolicy retryPolicy,
                         RealtimeMetrics metrics,
                         BiConsumer<ChannelHandle, ChannelSnapshot> transitions) {
        this.spec = spec;
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.transitions = transitions;
        CustomizableThreadFactory threads = new CustomizableThreadFactory("realtime-" + spec.name() + "-events-");
        threads.setDaemon(true);
        this.deliveryLane = Executors.newSingleThreadExecutor(threads);
    }

    public ChannelSpec spec() {
        return spec;
    }

    public String name() {
        return spec.name();
    }

    /**
     * Registers the event sink. A handle has exactly one sink.
     */
    public void onEvent(Consumer<ChangeEvent> callback) {
        synchronized (lock) {
            if (sink != null) {
                throw new IllegalStateException("Channel " + name() + " already has an event sink");
            }
            sink = callback;
        }
    }

    /**
     * Starts the retry loop on {@code workers} and returns immediately. Opening
     * a handle that was already closed does nothing.
     */
    public void open(ExecutorService workers) {
        synchronized (lock) {
            if (closed) {
                log.debug("Channel {} was closed before it opened", name());
                return;
            }
            if (worker != null) {
                throw new IllegalStateException("Channel " + name() + " is already open");
            }
            try {
                worker = workers.submit(this::runLoop);
            } catch (RejectedExecutionException e) {
                log.warn("Channel {} could not be opened, worker pool is shut down", name());
                closed = true;
                state = ChannelState.CLOSED;
                report();
                deliveryLane.shutdownNow();
            }
        }
    }

    /**
     * Cancels any pending connect or backoff and releases the subscription.
     * Idempotent and never throws.
     */
    public void close() {
        ChangeFeedSubscription subscription;
        Future<?> running;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            subscription = current;
            current = null;
            running = worker;
            state = ChannelState.CLOSED;
            report();
        }
        if (running != null) {
            running.cancel(true);
        }
        releaseQuietly(subscription);
        deliveryLane.shutdownNow();
        log.debug("Channel {} closed", name());
    }

    public ChannelSnapshot snapshot() {
        synchronized (lock) {
            return new ChannelSnapshot(state, attempt, lastError, retriesExhausted);
        }
    }

    private void runLoop() {
        try {
            while (true) {
                long attemptGeneration = beginAttempt();
                if (attemptGeneration < 0) {
                    return;
                }
                FeedSignal signal = signals.poll(retryPolicy.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (signal != null && signal.status() == FeedStatus.SUBSCRIBED) {
                    if (!markSubscribed()) {
                        return;
                    }
                    do {
                        signal = signals.take();
                    } while (signal.status() == FeedStatus.SUBSCRIBED);
                }
                int failedAttempt = markFailed(describe(signal));
                if (failedAttempt < 0) {
                    return;
                }
                if (retryPolicy.isExhausted(failedAttempt)) {
                    markExhausted();
                    return;
                }
                if (failedAttempt > 0) {
                    long delay = retryPolicy.backoffMillis(failedAttempt);
                    metrics.recordRetry(name());
                    log.warn("Channel {} failed (attempt {}/{}), retrying in {} ms",
                            name(), failedAttempt, retryPolicy.maxAttempts(), delay);
                    Thread.sleep(delay);
                } else {
                    log.warn("Channel {} dropped, resubscribing", name());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Channel {} retry loop interrupted", name());
        }
    }

    /**
     * @return the generation of the new subscription, or -1 when closed
     */
    private long beginAttempt() {
        long gen;
        synchronized (lock) {
            if (closed) {
                return -1;
            }
            attempt++;
            state = ChannelState.CONNECTING;
            signals.clear();
            gen = ++generation;
            report();
        }
        // subscribe may block, so close() must not wait on it
        ChangeFeedSubscription subscription;
        try {
            subscription = client.subscribe(spec, new GenerationListener(gen));
        } catch (RuntimeException e) {
            log.warn("Channel {} subscribe call failed: {}", name(), e.getMessage());
            signals.offer(new FeedSignal(FeedStatus.CHANNEL_ERROR, e));
            return gen;
        }
        synchronized (lock) {
            if (!closed) {
                current = subscription;
                return gen;
            }
        }
        log.debug("Channel {} closed while subscribing, releasing the new subscription", name());
        releaseQuietly(subscription);
        return -1;
    }

    private boolean markSubscribed() {
        synchronized (lock) {
            if (closed) {
                return false;
            }
            attempt = 0;
            lastError = null;
            state = ChannelState.SUBSCRIBED;
            report();
        }
        log.info("Channel {} subscribed", name());
        return true;
    }

    /**
     * @return the number of consecutive failed attempts, or -1 when closed
     */
    private int markFailed(String reason) {
        ChangeFeedSubscription subscription;
        int failed;
        synchronized (lock) {
            if (closed) {
                return -1;
            }
            subscription = current;
            current = null;
            // invalidates callbacks still in flight from the released subscription
            generation++;
            lastError = reason;
            state = ChannelState.FAILED;
            failed = attempt;
            report();
        }
        releaseQuietly(subscription);
        return failed;
    }

    private void markExhausted() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            retriesExhausted = true;
            report();
        }
        metrics.recordExhausted(name());
        log.error("Channel {} gave up after {} attempts: {}", name(), retryPolicy.maxAttempts(), lastError);
    }

    private String describe(FeedSignal signal) {
        if (signal == null) {
            return "Timed out after " + retryPolicy.connectTimeout().toMillis() + " ms";
        }
        if (signal.cause() != null && signal.cause().getMessage() != null) {
            return signal.status() + ": " + signal.cause().getMessage();
        }
        return signal.status().name();
    }

    private void report() {
        transitions.accept(this, new ChannelSnapshot(state, attempt, lastError, retriesExhausted));
    }

    private void releaseQuietly(ChangeFeedSubscription subscription) {
        if (subscription == null) {
            return;
        }
        try {
            client.unsubscribe(subscription);
        } catch (RuntimeException e) {
            log.warn("Channel {} unsubscribe failed: {}", name(), e.getMessage());
        }
    }

    private void deliver(ChangeEvent event) {
        Consumer<ChangeEvent> target = sink;
        if (target == null) {
            return;
        }
        try {
            target.accept(event);
        } catch (RuntimeException e) {
            log.warn("Channel {} sink failed for {}/{}: {}", name(), event.table(), event.operation(),
                    e.getMessage(), e);
        }
    }

    private record FeedSignal(FeedStatus status, Throwable cause) { }

    private final class GenerationListener implements ChangeFeedListener {

        private final long gen;

        private GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onEvent(ChangeEvent event) {
            if (gen != generation || !spec.accepts(event)) {
                return;
            }
            try {
                deliveryLane.execute(() -> deliver(event));
            } catch (RejectedExecutionException e) {
                log.debug("Channel {} is closed, dropping {}/{}", name(), event.table(), event.operation());
            }
        }

        @Override
        public void onStatus(FeedStatus status, Throwable cause) {
            if (gen != generation) {
                log.debug("Channel {} ignoring {} from a released subscription", name(), status);
                return;
            }
            signals.offer(new FeedSignal(status, cause));
        }
    }
}
