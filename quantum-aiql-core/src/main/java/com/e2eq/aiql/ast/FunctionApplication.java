package com.e2eq.aiql.ast;

import java.util.List;
import java.util.Objects;

/**
 * A call such as {@code max(<A>, <B>, 10)}. Summations and integrals use the function
 * names {@code sum} and {@code integral}; bracketed list literals use {@link #LIST}.
 */
public record FunctionApplication(String function, List<Expression> arguments) implements Expression {

    public static final String LIST = "list";

    public FunctionApplication {
        Objects.requireNonNull(function, "function");
        arguments = List.copyOf(arguments);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.FUNCTION_APPLICATION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFunctionApplication(this);
    }
}
