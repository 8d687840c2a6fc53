package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.Intent;
import com.e2eq.aiql.ast.Statement;

import java.util.List;
import java.util.Optional;

final class NoopTrustRegistry implements TrustRegistry {

    static final NoopTrustRegistry INSTANCE = new NoopTrustRegistry();

    private NoopTrustRegistry() {}

    @Override
    public int loadFromKnowledgeBase(List<Statement> statements) {
        return 0;
    }

    @Override
    public double weightedConfidence(Optional<Double> confidence, String origin) {
        return confidence.orElse(1.0);
    }

    @Override
    public LieAssessment assess(Intent highTrust, Intent lowTrust, double threshold) {
        return LieAssessment.none();
    }
}
