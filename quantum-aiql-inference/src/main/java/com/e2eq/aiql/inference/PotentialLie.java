package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.Intent;

import java.util.List;
import java.util.Objects;

/**
 * An assertion from a less trusted source that contradicts better supported assertions.
 */
public record PotentialLie(Intent statement, List<Intent> contradicts, double trustDelta,
                           double weightedConfidenceDelta, String reason) {

    public static final String DEFAULT_REASON = "Low-trust source contradicts high-trust source";

    public PotentialLie {
        Objects.requireNonNull(statement, "statement");
        contradicts = List.copyOf(contradicts);
        if (reason == null || reason.isBlank()) {
            reason = DEFAULT_REASON;
        }
    }
}
