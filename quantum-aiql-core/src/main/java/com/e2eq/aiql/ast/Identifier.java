package com.e2eq.aiql.ast;

import java.util.Objects;

/**
 * A bare name: a bound or free variable, a lambda parameter or an attribute key.
 */
public record Identifier(String name) implements Expression {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.IDENTIFIER;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
