package com.e2eq.aiql.inference.spi;

public enum ConflictType {
    TAXONOMY,
    PROPERTY,
    CARDINALITY,
    TYPE,
    DISJOINT_VALUES
}
