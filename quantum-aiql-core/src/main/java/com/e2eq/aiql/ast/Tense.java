package com.e2eq.aiql.ast;

import java.util.*;

/**
 * Grammatical tense that may qualify a relation, written {@code [name@tense:past]}.
 */
public enum Tense {
    PAST,
    PRESENT,
    FUTURE,
    PAST_PERFECT,
    PRESENT_PERFECT,
    FUTURE_PERFECT,
    PAST_PROGRESSIVE,
    PRESENT_PROGRESSIVE,
    FUTURE_PROGRESSIVE,
    PAST_PERFECT_PROGRESSIVE,
    PRESENT_PERFECT_PROGRESSIVE,
    FUTURE_PERFECT_PROGRESSIVE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Tense> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (Tense t : values()) {
            if (t.name().equals(normalized)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
