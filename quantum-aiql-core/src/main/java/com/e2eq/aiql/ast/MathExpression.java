package com.e2eq.aiql.ast;

import java.util.Objects;

public record MathExpression(MathOperator operator, Expression left, Expression right) implements Expression {

    public MathExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.MATH;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMath(this);
    }
}
