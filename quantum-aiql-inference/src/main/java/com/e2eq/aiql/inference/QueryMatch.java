package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;

import java.util.Objects;

/**
 * A fact matching a query pattern together with the bindings that made it match.
 */
public record QueryMatch(LogicalNode fact, Substitution substitution) {

    public QueryMatch {
        Objects.requireNonNull(fact, "fact");
        Objects.requireNonNull(substitution, "substitution");
    }
}
