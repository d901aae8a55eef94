package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.NotificationDescriptor;
import com.facilityhub.realtime.model.domain.Severity;

import java.util.Objects;

/**
 * Declarative shape of an alert; rendered against a change event by the router.
 */
public record NotificationTemplate(
        Severity severity,
        MessageTemplate title,
        MessageTemplate message,
        DurationTier duration,
        MessageTemplate navigateTo,
        IconLookup icon,
        String actionLabel
) {

    public NotificationTemplate {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(duration, "duration");
    }

    public static NotificationTemplate of(Severity severity, String title, String message, DurationTier duration) {
        return new NotificationTemplate(severity, MessageTemplate.of(title), MessageTemplate.of(message),
                duration, null, null, null);
    }

    public NotificationTemplate action(String label, String navigateTo) {
        return new NotificationTemplate(severity, title, message, duration, MessageTemplate.of(navigateTo), icon, label);
    }

    public NotificationTemplate icon(String fixedIcon) {
        return icon(IconLookup.fixed(fixedIcon));
    }

    public NotificationTemplate icon(IconLookup lookup) {
        return new NotificationTemplate(severity, title, message, duration, navigateTo, lookup, actionLabel);
    }

    NotificationDescriptor render(ChangeEvent event, NotificationDurations durations) {
        String route = navigateTo == null ? null : navigateTo.render(event);
        return new NotificationDescriptor(
                severity,
                title.render(event),
                message.render(event),
                durations.millis(duration),
                route == null || route.isBlank() ? null : route,
                icon == null ? null : icon.resolve(event),
                actionLabel);
    }
}
