package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;

import java.util.List;

/**
 * A conclusion proposed by a rule, with the facts it was drawn from.
 */
record Derivation(String rule, LogicalNode conclusion, List<LogicalNode> premises) {

    Derivation {
        premises = List.copyOf(premises);
    }
}
