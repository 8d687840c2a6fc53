package com.e2eq.aiql.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * The predicate of a statement, stored without brackets ({@code [is_a]} has name {@code is_a}).
 */
public record Relation(String name, Optional<Tense> tense) {

    public Relation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tense, "tense");
    }

    public static Relation of(String name) {
        return new Relation(name, Optional.empty());
    }

    public Relation withName(String newName) {
        return new Relation(newName, tense);
    }
}
