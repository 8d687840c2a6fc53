package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;

import java.util.Objects;

/**
 * Two knowledge base entries that cannot both hold.
 */
public record Contradiction(LogicalNode first, LogicalNode second, String reason) {

    public static final String DIRECT = "Direct contradiction: A and ¬A both asserted";
    public static final String IMPLICATIONS = "Contradictory implications: A → B and A → ¬B";

    public Contradiction {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Objects.requireNonNull(reason, "reason");
    }
}
