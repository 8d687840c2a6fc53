package com.e2eq.aiql.ast;

import java.util.Objects;

/**
 * A named entity, kept with its angle brackets, e.g. {@code <Python>}.
 */
public record Concept(String name) implements Expression {

    public Concept {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.CONCEPT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConcept(this);
    }
}
