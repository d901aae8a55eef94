package com.facilityhub.realtime.service.routing;

import java.util.EnumMap;
import java.util.Map;

/**
 * Resolves duration tiers to milliseconds.
 */
public final class NotificationDurations {

    private final Map<DurationTier, Long> millis;

    public NotificationDurations(long briefMs, long shortMs, long standardMs, long longMs, long criticalMs) {
        this.millis = new EnumMap<>(DurationTier.class);
        millis.put(DurationTier.BRIEF, positive(briefMs));
        millis.put(DurationTier.SHORT, positive(shortMs));
        millis.put(DurationTier.STANDARD, positive(standardMs));
        millis.put(DurationTier.LONG, positive(longMs));
        millis.put(DurationTier.CRITICAL, positive(criticalMs));
    }

    public static NotificationDurations defaults() {
        return new NotificationDurations(4000, 6000, 8000, 10000, 12000);
    }

    public long millis(DurationTier tier) {
        return millis.get(tier);
    }

    private static long positive(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Notification durations must be positive, got " + value);
        }
        return value;
    }
}
