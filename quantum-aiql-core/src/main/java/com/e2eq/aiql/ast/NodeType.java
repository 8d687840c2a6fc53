package com.e2eq.aiql.ast;

public enum NodeType {
    INTENT,
    LOGICAL_EXPRESSION,
    QUANTIFIED_EXPRESSION,
    RULE_DEFINITION,
    RELATIONSHIP,
    EXAMPLE
}
