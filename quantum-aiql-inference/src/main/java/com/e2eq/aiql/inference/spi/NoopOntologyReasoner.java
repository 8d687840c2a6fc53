package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.Statement;

import java.util.List;
import java.util.Optional;

final class NoopOntologyReasoner implements OntologyReasoner {

    static final NoopOntologyReasoner INSTANCE = new NoopOntologyReasoner();

    private NoopOntologyReasoner() {}

    @Override
    public void learnHierarchy(List<Statement> statements) {
        // nothing to learn
    }

    @Override
    public List<SemanticConflict> detectAllConflicts(List<Statement> statements) {
        return List.of();
    }

    @Override
    public Optional<SemanticConflict> detectSemanticConflict(Statement first, Statement second) {
        return Optional.empty();
    }
}
