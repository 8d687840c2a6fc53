package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;

import java.util.*;

/**
 * A successful derivation of {@code goal}. Steps run from the leaves to the goal, so the
 * last step always concludes the goal itself.
 */
public record Proof(LogicalNode goal, List<ProofStep> steps, boolean valid, ProofMethod method) {

    public Proof {
        Objects.requireNonNull(goal, "goal");
        steps = steps == null ? List.of() : List.copyOf(steps);
        Objects.requireNonNull(method, "method");
    }

    public Optional<ProofStep> lastStep() {
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }
}
