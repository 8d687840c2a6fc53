package com.e2eq.aiql.ast;

import java.util.*;

public enum ExampleType {
    CONCEPT,
    RELATION,
    PATTERN,
    POSITIVE,
    NEGATIVE;

    public static Optional<ExampleType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
