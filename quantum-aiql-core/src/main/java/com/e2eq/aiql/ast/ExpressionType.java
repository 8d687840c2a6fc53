package com.e2eq.aiql.ast;

public enum ExpressionType {
    CONCEPT,
    LITERAL,
    IDENTIFIER,
    MATH,
    SET,
    FUNCTION_APPLICATION,
    LAMBDA,
    UNARY,
    COMPARISON,
    SPATIAL
}
