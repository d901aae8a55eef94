package com.facilityhub.realtime.model.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Downstream effects of one change event.
 *
 * @param notification     alert to show, null when the event is silent
 * @param invalidationKeys cached views that must be refreshed
 */
public record RoutedAction(NotificationDescriptor notification, Set<String> invalidationKeys) {

    public static final RoutedAction EMPTY = new RoutedAction(null, Set.of());

    public RoutedAction {
        invalidationKeys = invalidationKeys == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(invalidationKeys));
    }

    public boolean hasNotification() {
        return notification != null;
    }

    public boolean isEmpty() {
        return notification == null && invalidationKeys.isEmpty();
    }
}
