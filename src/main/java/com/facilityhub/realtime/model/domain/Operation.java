package com.facilityhub.realtime.model.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Row-level operation captured by the change feed.
 */
public enum Operation {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Parses an operation declaration. {@code "*"} stands for every operation.
     */
    public static Set<Operation> parse(String declaration) {
        if (declaration == null || declaration.isBlank()) {
            throw new IllegalArgumentException("Operation declaration must not be blank");
        }
        if ("*".equals(declaration.trim())) {
            return EnumSet.allOf(Operation.class);
        }
        return EnumSet.of(Operation.valueOf(declaration.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Maps a Debezium op code (c, u, d, r) to an operation. Snapshot reads are
     * reported as inserts. Returns null for anything else.
     */
    public static Operation fromCdcCode(String code) {
        if (code == null) {
            return null;
        }
        return switch (code) {
            case "c", "r" -> INSERT;
            case "u" -> UPDATE;
            case "d" -> DELETE;
            default -> null;
        };
    }
}
