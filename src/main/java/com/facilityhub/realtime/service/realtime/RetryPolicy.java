package com.facilityhub.realtime.service.realtime;

import com.facilityhub.realtime.config.RealtimeProperties;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Bounded retry schedule for channel subscriptions.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final Duration connectTimeout;

    public RetryPolicy(int maxAttempts, IntervalFunction backoff, Duration connectTimeout) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.connectTimeout = connectTimeout;
    }

    /**
     * {@code baseDelay * attempt}: 1s, 2s, 3s ... for a one second base.
     */
    public static RetryPolicy linear(Duration baseDelay, int maxAttempts, Duration connectTimeout) {
        long base = baseDelay.toMillis();
        return new RetryPolicy(maxAttempts, attempt -> base * attempt, connectTimeout);
    }

    public static RetryPolicy from(RealtimeProperties properties) {
        RealtimeProperties.Retry retry = properties.getRetry();
        if (retry.getBackoff() == RealtimeProperties.Backoff.EXPONENTIAL) {
            return new RetryPolicy(retry.getMaxAttempts(),
                    IntervalFunction.ofExponentialBackoff(retry.getBaseDelay(), retry.getMultiplier()),
                    properties.getConnectTimeout());
        }
        return linear(retry.getBaseDelay(), retry.getMaxAttempts(), properties.getConnectTimeout());
    }

    /**
     * Delay before retrying after the given failed attempt (1-based).
     */
    public long backoffMillis(int failedAttempt) {
        return backoff.apply(failedAttempt);
    }

    public boolean isExhausted(int failedAttempts) {
        return failedAttempts >= maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }
}
