package com.e2eq.aiql.ast;

import java.util.Objects;

public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {

    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.UNARY;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
