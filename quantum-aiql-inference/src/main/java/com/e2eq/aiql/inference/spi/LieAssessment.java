package com.e2eq.aiql.inference.spi;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of comparing a trusted claim with a contradicting one.
 *
 * @param trustDelta              trust of the first source minus trust of the second
 * @param weightedConfidenceDelta weighted confidence of the first claim minus the second's
 */
public record LieAssessment(boolean potentialLie, double trustDelta, double weightedConfidenceDelta,
                            Optional<String> reason) {

    public LieAssessment {
        Objects.requireNonNull(reason, "reason");
    }

    public static LieAssessment none() {
        return new LieAssessment(false, 0.0, 0.0, Optional.empty());
    }
}
