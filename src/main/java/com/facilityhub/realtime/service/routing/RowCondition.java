package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.ChangeEvent;
import com.facilityhub.realtime.model.domain.ChangeEvent.RowSide;

import java.util.List;
import java.util.Objects;

/**
 * Declarative predicate over a change event. Implementations are value types so
 * that routing tables can be compared and printed.
 */
public interface RowCondition {

    boolean test(ChangeEvent event);

    static RowCondition always() {
        return Always.INSTANCE;
    }

    static RowCondition fieldEquals(String field, Object value) {
        return new FieldEquals(field, String.valueOf(value));
    }

    /**
     * Matches when any of the fields differs between the old and the new row.
     */
    static RowCondition fieldChanged(String... fields) {
        return new FieldChanged(List.of(fields));
    }

    /**
     * Matches a transition into {@code value}. Without an old row only the new
     * value is checked.
     */
    static RowCondition changedTo(String field, String value) {
        return new ChangedTo(field, value);
    }

    static RowCondition escalated(EscalationPolicy policy) {
        return new Escalated(policy);
    }

    enum Always implements RowCondition {
        INSTANCE;

        @Override
        public boolean test(ChangeEvent event) {
            return true;
        }
    }

    record FieldEquals(String field, String value) implements RowCondition {
        @Override
        public boolean test(ChangeEvent event) {
            Object actual = event.value(RowSide.NEW, field);
            return actual != null && value.equals(String.valueOf(actual));
        }
    }

    record FieldChanged(List<String> fields) implements RowCondition {
        public FieldChanged {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("fieldChanged needs at least one field");
            }
            fields = List.copyOf(fields);
        }

        @Override
        public boolean test(ChangeEvent event) {
            if (event.oldRow() == null || event.newRow() == null) {
                return false;
            }
            for (String field : fields) {
                if (!Objects.equals(event.value(RowSide.OLD, field), event.value(RowSide.NEW, field))) {
                    return true;
                }
            }
            return false;
        }
    }

    record ChangedTo(String field, String value) implements RowCondition {
        @Override
        public boolean test(ChangeEvent event) {
            Object current = event.value(RowSide.NEW, field);
            if (current == null || !value.equals(String.valueOf(current))) {
                return false;
            }
            if (event.oldRow() == null) {
                return true;
            }
            Object previous = event.value(RowSide.OLD, field);
            return previous == null || !value.equals(String.valueOf(previous));
        }
    }

    record Escalated(EscalationPolicy policy) implements RowCondition {
        @Override
        public boolean test(ChangeEvent event) {
            return policy.isEscalated(event);
        }
    }
}
