package com.e2eq.aiql.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code forall x in Domain: body} or {@code exists x: body}.
 */
public record QuantifiedExpression(Quantifier quantifier, String variable, Optional<String> domain,
                                   LogicalNode body) implements LogicalNode {

    public QuantifiedExpression {
        Objects.requireNonNull(quantifier, "quantifier");
        AstChecks.require(variable != null && !variable.isBlank(), "Quantified variable must be non-empty");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public NodeType type() {
        return NodeType.QUANTIFIED_EXPRESSION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitQuantifiedExpression(this);
    }
}
