package com.vibeflows.dataserver.core;

import java.util.List;

/**
 * Declarative index definition. Compound indexes are ascending on every field.
 *
 * @param fields    indexed fields, in key order
 * @param direction 1 for ascending, -1 for descending
 * @param unique    whether the index enforces uniqueness
 */
public record IndexSpec(List<String> fields, int direction, boolean unique) {

    public IndexSpec {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("An index needs at least one field");
        }
        if (direction != 1 && direction != -1) {
            throw new IllegalArgumentException("Index direction must be 1 or -1, got " + direction);
        }
        fields = List.copyOf(fields);
    }

    public static IndexSpec ascending(String... fields) {
        return new IndexSpec(List.of(fields), 1, false);
    }

    public static IndexSpec descending(String field) {
        return new IndexSpec(List.of(field), -1, false);
    }

    public static IndexSpec unique(String... fields) {
        return new IndexSpec(List.of(fields), 1, true);
    }
}
