package com.facilityhub.realtime.model.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Equality filter on a single column, e.g. {@code user_id = <id>}.
 * Inserts and updates are matched on the new row, deletes on the old row.
 */
public record RowFilter(String column, String value) {

    public RowFilter {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
    }

    public static RowFilter eq(String column, String value) {
        return new RowFilter(column, value);
    }

    public boolean matches(ChangeEvent event) {
        Map<String, Object> row = event.operation() == Operation.DELETE ? event.oldRow() : event.newRow();
        if (row == null) {
            return false;
        }
        Object actual = row.get(column);
        return actual != null && value.equals(String.valueOf(actual));
    }

    @Override
    public String toString() {
        return column + "=eq." + value;
    }
}
