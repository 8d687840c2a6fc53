package com.e2eq.aiql.ast;

import java.util.Map;
import java.util.Objects;

/**
 * A subject / relation / object triple with optional attributes.
 */
public record Statement(Expression subject, Relation relation, Expression object, Map<String, Expression> attributes) {

    public Statement {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(object, "object");
        attributes = AstChecks.orderedCopy(attributes);
    }

    public static Statement of(Expression subject, String relation, Expression object) {
        return new Statement(subject, Relation.of(relation), object, Map.of());
    }
}
