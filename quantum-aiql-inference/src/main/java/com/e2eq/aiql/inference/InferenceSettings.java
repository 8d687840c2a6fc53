package com.e2eq.aiql.inference;

/**
 * Bounds and thresholds for an {@link InferenceEngine}.
 *
 * @param maxForwardSteps            rounds run by {@code forwardChain()} without an argument
 * @param maxProofDepth              deepest subgoal backward chaining will expand
 * @param conjunctionIntroductionCap how many leading intent facts conjunction introduction pairs up
 * @param proveForwardSteps          forward chaining rounds {@code prove} falls back to
 * @param lieThreshold               weighted confidence delta above which a contradiction counts as a lie
 */
public record InferenceSettings(int maxForwardSteps,
                                int maxProofDepth,
                                int conjunctionIntroductionCap,
                                int proveForwardSteps,
                                double lieThreshold) {

    public static final int DEFAULT_MAX_FORWARD_STEPS = 100;
    public static final int DEFAULT_MAX_PROOF_DEPTH = 20;
    public static final int DEFAULT_CONJUNCTION_INTRODUCTION_CAP = 10;
    public static final int DEFAULT_PROVE_FORWARD_STEPS = 50;
    public static final double DEFAULT_LIE_THRESHOLD = 0.3;

    public InferenceSettings {
        require(maxForwardSteps > 0, "maxForwardSteps must be > 0, was " + maxForwardSteps);
        require(maxProofDepth >= 0, "maxProofDepth must be >= 0, was " + maxProofDepth);
        require(conjunctionIntroductionCap >= 0, "conjunctionIntroductionCap must be >= 0, was " + conjunctionIntroductionCap);
        require(proveForwardSteps > 0, "proveForwardSteps must be > 0, was " + proveForwardSteps);
        require(lieThreshold >= 0.0 && lieThreshold <= 1.0, "lieThreshold must be within [0, 1], was " + lieThreshold);
    }

    public static InferenceSettings defaults() {
        return new InferenceSettings(DEFAULT_MAX_FORWARD_STEPS, DEFAULT_MAX_PROOF_DEPTH,
                DEFAULT_CONJUNCTION_INTRODUCTION_CAP, DEFAULT_PROVE_FORWARD_STEPS, DEFAULT_LIE_THRESHOLD);
    }

    public InferenceSettings withMaxProofDepth(int depth) {
        return new InferenceSettings(maxForwardSteps, depth, conjunctionIntroductionCap, proveForwardSteps, lieThreshold);
    }

    public InferenceSettings withConjunctionIntroductionCap(int cap) {
        return new InferenceSettings(maxForwardSteps, maxProofDepth, cap, proveForwardSteps, lieThreshold);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
