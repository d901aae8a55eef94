package com.facilityhub.realtime.model.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One table pattern of a channel: the table, the operations of interest and an
 * optional row filter.
 */
public record TopicSpec(String table, Set<Operation> operations, RowFilter rowFilter) {

    public TopicSpec {
        Objects.requireNonNull(table, "table");
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("Topic " + table + " must name at least one operation");
        }
        operations = Collections.unmodifiableSet(EnumSet.copyOf(operations));
    }

    public static TopicSpec of(String table, Operation first, Operation... rest) {
        return new TopicSpec(table, EnumSet.of(first, rest), null);
    }

    public static TopicSpec all(String table) {
        return new TopicSpec(table, EnumSet.allOf(Operation.class), null);
    }

    public TopicSpec filteredBy(RowFilter filter) {
        return new TopicSpec(table, operations, filter);
    }

    public boolean matches(ChangeEvent event) {
        if (!table.equals(event.table()) || !operations.contains(event.operation())) {
            return false;
        }
        return rowFilter == null || rowFilter.matches(event);
    }
}
