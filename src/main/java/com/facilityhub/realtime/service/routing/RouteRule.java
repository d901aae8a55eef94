package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.Operation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routing entry for one {@code (table, operation)} pair. Notification rules are
 * evaluated in order and the first match wins; invalidation keys always apply.
 */
public record RouteRule(
        String table,
        Operation operation,
        List<NotificationRule> notifications,
        Set<String> invalidationKeys
) {

    public RouteRule {
        notifications = List.copyOf(notifications);
        invalidationKeys = Collections.unmodifiableSet(new LinkedHashSet<>(invalidationKeys));
    }
}
