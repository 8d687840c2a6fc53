package com.e2eq.aiql.inference.spi;

public enum ConflictSeverity {
    CRITICAL,
    MAJOR,
    MINOR,
    INFORMATIONAL
}
