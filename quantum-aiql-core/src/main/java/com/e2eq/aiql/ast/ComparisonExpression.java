package com.e2eq.aiql.ast;

import java.util.Objects;

/**
 * A relational comparison. Attribute constraints such as {@code year: > 2000} are
 * represented with the attribute key as an {@link Identifier} on the left.
 */
public record ComparisonExpression(Expression left, ComparisonOperator operator, Expression right) implements Expression {

    public ComparisonExpression {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.COMPARISON;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
