package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.Statement;

import java.util.List;
import java.util.Optional;

/**
 * Domain knowledge used to find conflicts that are not plain {@code A and not A}, such as
 * an entity classified under two disjoint classes. Implementations may be provided as CDI
 * beans; without one the engine uses {@link #noop()}.
 */
public interface OntologyReasoner {

    /**
     * Learns class hierarchy facts ({@code is_a}, {@code subclass_of} and similar) from the
     * statements of a knowledge base.
     */
    void learnHierarchy(List<Statement> statements);

    List<SemanticConflict> detectAllConflicts(List<Statement> statements);

    Optional<SemanticConflict> detectSemanticConflict(Statement first, Statement second);

    static OntologyReasoner noop() {
        return NoopOntologyReasoner.INSTANCE;
    }
}
