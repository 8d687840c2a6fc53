package com.e2eq.aiql.inference;

import java.util.Objects;
import java.util.Optional;

public record ProofResult(boolean provable, Optional<Proof> proof, Optional<String> reason) {

    public static final String NOT_DERIVABLE = "Goal not derivable from knowledge base";

    public ProofResult {
        Objects.requireNonNull(proof, "proof");
        Objects.requireNonNull(reason, "reason");
    }

    public static ProofResult proven(Proof proof) {
        return new ProofResult(true, Optional.of(proof), Optional.empty());
    }

    public static ProofResult notDerivable() {
        return new ProofResult(false, Optional.empty(), Optional.of(NOT_DERIVABLE));
    }
}
