package com.e2eq.aiql.ast;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed AIQL source: the ordered top-level nodes plus document provenance.
 */
public record Program(List<LogicalNode> body, Provenance provenance) {

    public Program {
        body = List.copyOf(body);
        Objects.requireNonNull(provenance, "provenance");
    }

    public static Program of(List<LogicalNode> body) {
        return new Program(body, Provenance.EMPTY);
    }

    public String version() {
        return provenance.version();
    }

    public String origin() {
        return provenance.origin();
    }

    public List<String> citations() {
        return provenance.citations();
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }
}
