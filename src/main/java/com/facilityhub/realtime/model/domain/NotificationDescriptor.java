package com.facilityhub.realtime.model.domain;

import java.util.Objects;

/**
 * Everything the host UI needs to render one alert.
 *
 * @param severity    alert style
 * @param title       headline
 * @param message     body text
 * @param durationMs  how long the alert stays on screen
 * @param navigateTo  route the action button opens, may be null
 * @param icon        icon shown with the alert, may be null
 * @param actionLabel label of the action button, may be null
 */
public record NotificationDescriptor(
        Severity severity,
        String title,
        String message,
        long durationMs,
        String navigateTo,
        String icon,
        String actionLabel
) {

    public NotificationDescriptor {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(title, "title");
        if (durationMs <= 0) {
            throw new IllegalArgumentException("durationMs must be positive");
        }
    }

    public boolean hasAction() {
        return navigateTo != null && !navigateTo.isBlank();
    }
}
