package com.e2eq.aiql.ast;

import java.util.*;

/**
 * A goal-tagged group of statements, e.g. {@code !Assert { <Python> [is_a] <Language> } @0.9}.
 *
 * @param intentType    the name following {@code !}, such as {@code Assert} or {@code Query}
 * @param contextParams parameters from the parenthesised list after the intent name
 * @param statements    statements in source order
 * @param confidence    trailing {@code @} confidence, within [0, 1]
 * @param coherence     trailing {@code @coherence:} value, within [0, 1]
 * @param metadata      sigil markers written before the intent
 * @param security      security labels, carried but not interpreted
 */
public record Intent(String intentType,
                     Map<String, String> contextParams,
                     List<Statement> statements,
                     Optional<Double> confidence,
                     Optional<Double> coherence,
                     IntentMetadata metadata,
                     Map<String, String> security) implements LogicalNode {

    public Intent {
        AstChecks.require(intentType != null && !intentType.isBlank(), "Intent type must be non-empty");
        contextParams = AstChecks.orderedCopy(contextParams);
        statements = AstChecks.listCopy(statements);
        confidence = AstChecks.unitInterval(confidence, "confidence");
        coherence = AstChecks.unitInterval(coherence, "coherence");
        Objects.requireNonNull(metadata, "metadata");
        security = AstChecks.orderedCopy(security);
    }

    public static Intent of(String intentType, List<Statement> statements) {
        return new Intent(intentType, Map.of(), statements, Optional.empty(), Optional.empty(), IntentMetadata.EMPTY, Map.of());
    }

    public static Intent of(String intentType, Statement... statements) {
        return of(intentType, List.of(statements));
    }

    public Intent withStatements(List<Statement> replacement) {
        return new Intent(intentType, contextParams, replacement, confidence, coherence, metadata, security);
    }

    public Intent withConfidence(double value) {
        return new Intent(intentType, contextParams, statements, Optional.of(value), coherence, metadata, security);
    }

    public boolean isType(String name) {
        return intentType.equalsIgnoreCase(name);
    }

    @Override
    public NodeType type() {
        return NodeType.INTENT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitIntent(this);
    }
}
