package com.e2eq.aiql.ast;

import java.util.List;
import java.util.Objects;

/**
 * A location, either literal coordinates ({@code space:literal(37.7749, -122.4194)}) or a
 * reference to a named region ({@code space:variable(sector_7)}).
 */
public record SpatialExpression(Kind kind, List<Double> coordinates, String variable) implements Expression {

    public enum Kind {
        LITERAL,
        VARIABLE
    }

    public SpatialExpression {
        Objects.requireNonNull(kind, "kind");
        coordinates = List.copyOf(coordinates);
        if (kind == Kind.LITERAL && coordinates.isEmpty()) {
            throw new IllegalArgumentException("Literal spatial expression requires coordinates");
        }
        if (kind == Kind.VARIABLE && (variable == null || variable.isBlank())) {
            throw new IllegalArgumentException("Spatial variable requires a name");
        }
    }

    public static SpatialExpression literal(List<Double> coordinates) {
        return new SpatialExpression(Kind.LITERAL, coordinates, null);
    }

    public static SpatialExpression variable(String name) {
        return new SpatialExpression(Kind.VARIABLE, List.of(), name);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.SPATIAL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSpatial(this);
    }
}
