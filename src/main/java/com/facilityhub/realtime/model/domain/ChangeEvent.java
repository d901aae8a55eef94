package com.facilityhub.realtime.model.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A captured row change. Rows are copied deeply on construction, so nested
 * maps and lists can not be changed behind the router's back.
 *
 * @param table      table the row belongs to
 * @param operation  INSERT, UPDATE or DELETE
 * @param oldRow     row before the change, null for inserts or when the source does not send it
 * @param newRow     row after the change, null for deletes
 * @param receivedAt time the event reached this service; never used for routing
 */
public record ChangeEvent(
        String table,
        Operation operation,
        Map<String, Object> oldRow,
        Map<String, Object> newRow,
        Instant receivedAt
) {

    public ChangeEvent {
        oldRow = copy(oldRow);
        newRow = copy(newRow);
    }

    public static ChangeEvent insert(String table, Map<String, Object> newRow) {
        return new ChangeEvent(table, Operation.INSERT, null, newRow, Instant.now());
    }

    public static ChangeEvent update(String table, Map<String, Object> oldRow, Map<String, Object> newRow) {
        return new ChangeEvent(table, Operation.UPDATE, oldRow, newRow, Instant.now());
    }

    public static ChangeEvent delete(String table, Map<String, Object> oldRow) {
        return new ChangeEvent(table, Operation.DELETE, oldRow, null, Instant.now());
    }

    /**
     * Looks up a value on one side of the change. Dotted paths walk into nested
     * maps, so {@code metadata.action_url} reads {@code newRow.metadata.action_url}.
     */
    public Object value(RowSide side, String path) {
        Map<String, Object> row = side == RowSide.OLD ? oldRow : newRow;
        if (row == null || path == null) {
            return null;
        }
        Object current = row;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static Map<String, Object> copy(Map<String, Object> row) {
        if (row == null) {
            return null;
        }
        // rows routinely carry null columns, so Map.copyOf is not an option
        Map<String, Object> copy = new LinkedHashMap<>();
        row.forEach((column, value) -> copy.put(column, freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, freeze(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(freeze(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public enum RowSide {
        OLD,
        NEW
    }
}
