package com.e2eq.aiql.inference;

import java.util.*;

/**
 * Variable bindings produced by unification. Keys are pattern variables, values are the
 * terms they were matched against. Instances are immutable; {@link #bind} returns a copy.
 */
public record Substitution(Map<String, String> bindings) {

    private static final Substitution EMPTY = new Substitution(Map.of());

    public Substitution {
        Objects.requireNonNull(bindings, "bindings");
        bindings = bindings.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public static Substitution empty() {
        return EMPTY;
    }

    public Optional<String> get(String variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public boolean isBound(String variable) {
        return bindings.containsKey(variable);
    }

    public Substitution bind(String variable, String term) {
        Map<String, String> copy = new LinkedHashMap<>(bindings);
        copy.put(variable, term);
        return new Substitution(copy);
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }
}
