package com.e2eq.aiql.ast;

import java.util.Objects;

/**
 * A string, number or boolean constant. Numbers are always held as {@link Double}.
 */
public record Literal(Object value) implements Expression {

    public Literal {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String) && !(value instanceof Double) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported literal value type: " + value.getClass().getName());
        }
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    public boolean isNumber() {
        return value instanceof Double;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public double asDouble() {
        if (!isNumber()) {
            throw new IllegalStateException("Literal is not numeric: " + value);
        }
        return (Double) value;
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.LITERAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
