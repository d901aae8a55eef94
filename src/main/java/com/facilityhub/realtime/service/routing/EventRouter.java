package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.model.domain.RoutedAction;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Maps change events to routed actions using a static {@link RoutingTable}.
 *
 * <p>Routing is total and deterministic: an event with no route, or one that
 * cannot be evaluated, yields {@link RoutedAction#EMPTY}. Nothing escapes
 * {@link #route(ChangeEvent)}, so a malformed event never stops the events behind it.
 */
@Slf4j
public class EventRouter {

    private final RoutingTable table;
    private final NotificationDurations durations;

    public EventRouter(RoutingTable table, NotificationDurations durations) {
        this.table = table;
        this.durations = durations;
    }

    public RoutedAction route(ChangeEvent event) {
        if (event == null) {
            log.warn("[{}] Ignoring null change event", table.name());
            return RoutedAction.EMPTY;
        }
        try {
            Optional<RouteRule> rule = table.lookup(event.table(), event.operation());
            if (rule.isEmpty()) {
                log.debug("[{}] No route for {}/{}", table.name(), event.table(), event.operation());
                return RoutedAction.EMPTY;
            }
            RouteRule route = rule.get();
            return new RoutedAction(selectNotification(route, event), route.invalidationKeys());
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to route {}/{}, dropping event: {}",
                    table.name(), event.table(), event.operation(), e.getMessage(), e);
            return RoutedAction.EMPTY;
        }
    }

    public RoutingTable table() {
        return table;
    }

    private NotificationDescriptor selectNotification(RouteRule route, ChangeEvent event) {
        for (NotificationRule rule : route.notifications()) {
            if (rule.condition().test(event)) {
                return rule.template().render(event, durations);
            }
        }
        return null;
    }
}
