package com.e2eq.aiql.ast;

import java.util.*;

/**
 * Links two identified statements, e.g.
 * {@code !Relationship(type:temporal, source:$id:a, target:$id:b) { <X> [before] <Y> }}.
 * Source and target hold the referenced ids without the {@code $id:} prefix.
 */
public record RelationshipNode(RelationshipType relationshipType,
                               String source,
                               String target,
                               String relationName,
                               List<Statement> statements,
                               Optional<Double> confidence,
                               boolean bidirectional,
                               Map<String, String> metadata) implements LogicalNode {

    public RelationshipNode {
        Objects.requireNonNull(relationshipType, "relationshipType");
        AstChecks.require(source != null && !source.isBlank(), "Relationship source must be non-empty");
        AstChecks.require(target != null && !target.isBlank(), "Relationship target must be non-empty");
        statements = AstChecks.listCopy(statements);
        confidence = AstChecks.unitInterval(confidence, "confidence");
        metadata = AstChecks.orderedCopy(metadata);
    }

    @Override
    public NodeType type() {
        return NodeType.RELATIONSHIP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRelationship(this);
    }
}
