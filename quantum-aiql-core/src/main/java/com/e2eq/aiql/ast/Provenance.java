package com.e2eq.aiql.ast;

import java.util.List;

/**
 * Source attribution from {@code @version:}, {@code @origin:} and {@code @cite:} markers.
 * {@code version} and {@code origin} are {@code null} when absent.
 */
public record Provenance(String version, String origin, List<String> citations) {

    public static final Provenance EMPTY = new Provenance(null, null, List.of());

    public Provenance {
        citations = AstChecks.listCopy(citations);
    }

    public boolean isEmpty() {
        return version == null && origin == null && citations.isEmpty();
    }

    public Provenance withVersion(String v) {
        return new Provenance(v, origin, citations);
    }

    public Provenance withOrigin(String o) {
        return new Provenance(version, o, citations);
    }

    public Provenance withCitations(List<String> c) {
        return new Provenance(version, origin, c);
    }
}
