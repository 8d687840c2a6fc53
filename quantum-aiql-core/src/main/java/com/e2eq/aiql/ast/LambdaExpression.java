package com.e2eq.aiql.ast;

import java.util.List;
import java.util.Objects;

public record LambdaExpression(List<String> parameters, Expression body) implements Expression {

    public LambdaExpression {
        parameters = List.copyOf(parameters);
        Objects.requireNonNull(body, "body");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.LAMBDA;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLambda(this);
    }
}
