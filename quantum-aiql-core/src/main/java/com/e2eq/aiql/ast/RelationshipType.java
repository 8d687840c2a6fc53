package com.e2eq.aiql.ast;

import java.util.*;

public enum RelationshipType {
    TEMPORAL,
    CAUSAL,
    LOGICAL;

    public static Optional<RelationshipType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
