package com.e2eq.aiql.lexer;

/**
 * Coarse grouping of token types, used by tooling that only cares about the
 * family a token belongs to (highlighting, error hints, metadata collection).
 */
public enum TokenCategory {
    CORE_SYNTAX,
    STATEMENT_METADATA,
    PROVENANCE,
    LOGIC_OPERATOR,
    QUANTIFIER,
    PROOF_OPERATOR,
    LOGIC_KEYWORD,
    MATH,
    COMPARISON,
    PRIMITIVE,
    TRIVIA
}
