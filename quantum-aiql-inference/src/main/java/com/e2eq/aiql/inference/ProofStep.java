package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;

import java.util.*;

/**
 * One justified conclusion in a proof.
 *
 * @param conclusion   the node established by this step
 * @param rule         {@code fact}, a rule id, or the name of a structural inference rule
 * @param premises     nodes the conclusion was derived from
 * @param substitution bindings used when a rule was matched
 */
public record ProofStep(LogicalNode conclusion, String rule, List<LogicalNode> premises,
                        Optional<Substitution> substitution) {

    public ProofStep {
        Objects.requireNonNull(conclusion, "conclusion");
        Objects.requireNonNull(rule, "rule");
        premises = premises == null ? List.of() : List.copyOf(premises);
        Objects.requireNonNull(substitution, "substitution");
    }

    public static ProofStep of(LogicalNode conclusion, String rule, LogicalNode... premises) {
        return new ProofStep(conclusion, rule, List.of(premises), Optional.empty());
    }
}
