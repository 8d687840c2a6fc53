package com.e2eq.aiql.inference.spi;

import com.e2eq.aiql.ast.Intent;
import com.e2eq.aiql.ast.Statement;

import java.util.List;
import java.util.Optional;

/**
 * Per-source trust scores used to weigh contradicting assertions.
 */
public interface TrustRegistry {

    /**
     * Registers scores stated in the knowledge base itself.
     *
     * @return the number of scores loaded
     */
    int loadFromKnowledgeBase(List<Statement> statements);

    /**
     * Statement confidence (1.0 when absent) multiplied by the trust of {@code origin}.
     */
    double weightedConfidence(Optional<Double> confidence, String origin);

    /**
     * Decides whether {@code lowTrust} is a likely lie given that it contradicts
     * {@code highTrust}.
     */
    LieAssessment assess(Intent highTrust, Intent lowTrust, double threshold);

    static TrustRegistry noop() {
        return NoopTrustRegistry.INSTANCE;
    }
}
