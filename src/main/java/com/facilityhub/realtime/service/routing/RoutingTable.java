package com.facilityhub.realtime.service.routing;

import com.facilityhub.realtime.model.domain.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static map from {@code (table, operation)} to a {@link RouteRule}.
 *
 * <pre>{@code
 * RoutingTable.builder("admin")
 *     .on("issues", "INSERT")
 *         .when(RowCondition.escalated(policy), critical)
 *         .otherwise(standard)
 *         .invalidate("adminNotifications", "issues")
 *     .build();
 * }</pre>
 */
public final class RoutingTable {

    private final String name;
    private final Map<Key, RouteRule> rules;

    private RoutingTable(String name, Map<Key, RouteRule> rules) {
        this.name = name;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Optional<RouteRule> lookup(String table, Operation operation) {
        if (table == null || operation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(new Key(table, operation)));
    }

    public Collection<RouteRule> rules() {
        return rules.values();
    }

    public Set<String> tables() {
        Set<String> tables = new LinkedHashSet<>();
        rules.keySet().forEach(k -> tables.add(k.table()));
        return tables;
    }

    /**
     * Every invalidation key any rule can emit.
     */
    public Set<String> invalidationKeys() {
        Set<String> keys = new LinkedHashSet<>();
        rules.values().forEach(r -> keys.addAll(r.invalidationKeys()));
        return keys;
    }

    private record Key(String table, Operation operation) { }

    public static final class Builder {

        private final String name;
        private final Map<Key, RouteRule> rules = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Starts a route for a table. {@code operations} are names such as
         * {@code "INSERT"}, or {@code "*"} for all three.
         */
        public RouteBuilder on(String table, String... operations) {
            if (operations.length == 0) {
                throw new IllegalArgumentException("Route for " + table + " needs at least one operation");
            }
            Set<Operation> ops = EnumSet.noneOf(Operation.class);
            for (String op : operations) {
                ops.addAll(Operation.parse(op));
            }
            return new RouteBuilder(this, table, ops);
        }

        public RoutingTable build() {
            return new RoutingTable(name, rules);
        }

        private void add(String table, Set<Operation> operations, List<NotificationRule> notifications,
                         Set<String> keys) {
            for (Operation op : operations) {
                Key key = new Key(table, op);
                if (rules.containsKey(key)) {
                    throw new IllegalStateException("Duplicate route for " + table + "/" + op + " in table " + name);
                }
                rules.put(key, new RouteRule(table, op, notifications, keys));
            }
        }
    }

    public static final class RouteBuilder {

        private final Builder parent;
        private final String table;
        private final Set<Operation> operations;
        private final List<NotificationRule> notifications = new ArrayList<>();
        private final Set<String> keys = new LinkedHashSet<>();

        private RouteBuilder(Builder parent, String table, Set<Operation> operations) {
            this.parent = parent;
            this.table = table;
            this.operations = operations;
        }

        public RouteBuilder when(RowCondition condition, NotificationTemplate template) {
            notifications.add(new NotificationRule(condition, template));
            return this;
        }

        public RouteBuilder otherwise(NotificationTemplate template) {
            return when(RowCondition.always(), template);
        }

        /**
         * Completes the route with the cache keys every matching event refreshes.
         */
        public Builder invalidate(String... invalidationKeys) {
            keys.addAll(List.of(invalidationKeys));
            parent.add(table, operations, notifications, keys);
            return parent;
        }
    }
}
