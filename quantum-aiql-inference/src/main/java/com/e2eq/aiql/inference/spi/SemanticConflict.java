package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.Statement;

import java.util.*;

/**
 * A pair of statements an ontology reasoner judged incompatible.
 *
 * @param details free-form evidence; the {@code domain} key, when present, names the
 *                knowledge domain the conflict belongs to
 */
public record SemanticConflict(Statement first,
                               Statement second,
                               ConflictType conflictType,
                               ConflictSeverity severity,
                               String reason,
                               Map<String, String> details) {

    public static final String DEFAULT_REASON = "Semantic conflict detected";

    public SemanticConflict {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Objects.requireNonNull(conflictType, "conflictType");
        Objects.requireNonNull(severity, "severity");
        if (reason == null || reason.isBlank()) {
            reason = DEFAULT_REASON;
        }
        details = details == null || details.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String domain() {
        return details.getOrDefault("domain", "general");
    }
}
