package com.facilityhub.realtime.service.routing;

/**
 * Named on-screen durations. The millisecond value of each tier comes from
 * configuration, see {@link NotificationDurations}.
 */
public enum DurationTier {
    BRIEF,
    SHORT,
    STANDARD,
    LONG,
    CRITICAL
}
