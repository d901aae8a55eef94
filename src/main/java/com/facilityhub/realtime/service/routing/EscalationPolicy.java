package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.Operation;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a row is tagged high priority. The fields inspected and the
 * values that count as "high" are configuration, not per-route code.
 *
 * @param priorityFields columns checked in order, e.g. {@code priority}, {@code urgency}
 * @param highValues     values (case-insensitive) that trigger escalation
 */
public record EscalationPolicy(List<String> priorityFields, Set<String> highValues) {

    public EscalationPolicy {
        priorityFields = List.copyOf(priorityFields);
        highValues = highValues.stream()
                .map(v -> v.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public static EscalationPolicy defaults() {
        return new EscalationPolicy(List.of("priority", "urgency"), Set.of("high"));
    }

    public boolean isEscalated(ChangeEvent event) {
        ChangeEvent.RowSide side = event.operation() == Operation.DELETE
                ? ChangeEvent.RowSide.OLD
                : ChangeEvent.RowSide.NEW;
        for (String field : priorityFields) {
            Object value = event.value(side, field);
            if (value != null && highValues.contains(String.valueOf(value).toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
