package com.e2eq.aiql.ast;

import java.util.*;

/**
 * Shared argument checks for node constructors.
 */
final class AstChecks {
    private AstChecks() {}

    static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }

    static Optional<Double> unitInterval(Optional<Double> value, String name) {
        Objects.requireNonNull(value, name);
        value.ifPresent(v -> require(v >= 0.0 && v <= 1.0, name + " must be within [0, 1], was " + v));
        return value;
    }

    static <K, V> Map<K, V> orderedCopy(Map<K, V> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    static <T> List<T> listCopy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
