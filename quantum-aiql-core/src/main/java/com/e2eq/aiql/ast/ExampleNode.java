package com.e2eq.aiql.ast;

import java.util.*;

/**
 * Illustrative statements for a concept, relation or pattern. {@code target} is the
 * concept, relation or pattern name being illustrated; {@code contextType} may be {@code null}.
 */
public record ExampleNode(ExampleType exampleType,
                          String target,
                          String contextType,
                          List<Statement> statements,
                          Optional<Double> confidence,
                          Map<String, String> metadata) implements LogicalNode {

    public ExampleNode {
        Objects.requireNonNull(exampleType, "exampleType");
        statements = AstChecks.listCopy(statements);
        confidence = AstChecks.unitInterval(confidence, "confidence");
        metadata = AstChecks.orderedCopy(metadata);
    }

    @Override
    public NodeType type() {
        return NodeType.EXAMPLE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExample(this);
    }
}
