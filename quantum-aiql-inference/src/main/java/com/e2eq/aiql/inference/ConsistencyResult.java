package com.e2eq.aiql.inference;

import java.util.List;

public record ConsistencyResult(boolean consistent, List<Contradiction> contradictions) {

    public ConsistencyResult {
        contradictions = contradictions == null ? List.of() : List.copyOf(contradictions);
    }

    public static ConsistencyResult of(List<Contradiction> contradictions) {
        return new ConsistencyResult(contradictions.isEmpty(), contradictions);
    }
}
