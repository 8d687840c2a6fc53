package com.e2eq.aiql.ast;

/**
 * A top-level item of an AIQL program and the unit the inference engine stores.
 * <p>
 * The implementations form a closed set of immutable records. Structural equality
 * ({@code equals}/{@code hashCode}) is what the knowledge base uses to detect
 * duplicates. Code that must treat every variant implements {@link Visitor}.
 * </p>
 */
public interface LogicalNode {
    NodeType type();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitIntent(Intent intent);

        R visitLogicalExpression(LogicalExpression expression);

        R visitQuantifiedExpression(QuantifiedExpression expression);

        R visitRuleDefinition(RuleDefinition rule);

        R visitRelationship(RelationshipNode relationship);

        R visitExample(ExampleNode example);
    }
}
