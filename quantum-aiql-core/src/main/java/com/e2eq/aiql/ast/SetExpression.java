package com.e2eq.aiql.ast;

import java.util.Objects;

public record SetExpression(SetOperator operator, Expression left, Expression right) implements Expression {

    public SetExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.SET;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSet(this);
    }
}
