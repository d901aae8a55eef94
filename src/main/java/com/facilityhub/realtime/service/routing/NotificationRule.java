package com.facilityhub.realtime.service.routing;

import java.util.Objects;

/**
 * Shows {@code template} when {@code condition} holds.
 */
public record NotificationRule(RowCondition condition, NotificationTemplate template) {

    public NotificationRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(template, "template");
    }
}
