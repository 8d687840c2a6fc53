package com.e2eq.aiql.lexer;

import java.util.*;

/**
 * Every kind of token the AIQL lexer produces. Keyword types carry the lowercase
 * spelling they are recognized from.
 */
public enum TokenType {
    // core syntax
    INTENT(TokenCategory.CORE_SYNTAX),
    CONCEPT(TokenCategory.CORE_SYNTAX),
    RELATION(TokenCategory.CORE_SYNTAX),
    SYMBOL(TokenCategory.CORE_SYNTAX),
    DIRECTIVE(TokenCategory.CORE_SYNTAX),
    EXAMPLE_MARKER(TokenCategory.CORE_SYNTAX),
    EXAMPLE_PATTERN(TokenCategory.CORE_SYNTAX),

    // statement metadata
    CONFIDENCE(TokenCategory.STATEMENT_METADATA),
    COHERENCE(TokenCategory.STATEMENT_METADATA),
    TEMPERATURE(TokenCategory.STATEMENT_METADATA),
    ENTROPY(TokenCategory.STATEMENT_METADATA),
    SEQ_NUM(TokenCategory.STATEMENT_METADATA),
    GROUP_ID(TokenCategory.STATEMENT_METADATA),
    ID_MARKER(TokenCategory.STATEMENT_METADATA),

    // provenance
    VERSION(TokenCategory.PROVENANCE),
    ORIGIN(TokenCategory.PROVENANCE),
    CITE(TokenCategory.PROVENANCE),

    AND(TokenCategory.LOGIC_OPERATOR, "and"),
    OR(TokenCategory.LOGIC_OPERATOR, "or"),
    NOT(TokenCategory.LOGIC_OPERATOR, "not"),
    IMPLIES(TokenCategory.LOGIC_OPERATOR, "implies"),
    IFF(TokenCategory.LOGIC_OPERATOR, "iff"),

    FORALL(TokenCategory.QUANTIFIER, "forall"),
    EXISTS(TokenCategory.QUANTIFIER, "exists"),

    PROVES(TokenCategory.PROOF_OPERATOR, "proves"),
    ENTAILS(TokenCategory.PROOF_OPERATOR, "entails"),

    IN(TokenCategory.LOGIC_KEYWORD, "in"),
    THEN(TokenCategory.LOGIC_KEYWORD, "then"),
    TRUE(TokenCategory.LOGIC_KEYWORD, "true"),
    FALSE(TokenCategory.LOGIC_KEYWORD, "false"),

    // math
    PLUS(TokenCategory.MATH),
    MINUS(TokenCategory.MATH),
    MULTIPLY(TokenCategory.MATH),
    DIVIDE(TokenCategory.MATH),
    MODULO(TokenCategory.MATH),
    POWER(TokenCategory.MATH),
    UNION(TokenCategory.MATH, "union"),
    INTERSECT(TokenCategory.MATH, "intersect"),
    LAMBDA(TokenCategory.MATH, "lambda"),
    SUMMATION(TokenCategory.MATH, "sum"),
    INTEGRAL(TokenCategory.MATH, "integral"),
    PI(TokenCategory.MATH, "pi"),
    INFINITY(TokenCategory.MATH, "infinity", "inf"),
    EULER(TokenCategory.MATH, "e"),

    // comparison
    GT(TokenCategory.COMPARISON),
    LT(TokenCategory.COMPARISON),
    GTE(TokenCategory.COMPARISON),
    LTE(TokenCategory.COMPARISON),
    EQ(TokenCategory.COMPARISON),
    NEQ(TokenCategory.COMPARISON),
    ASSIGN(TokenCategory.COMPARISON),

    // primitives
    STRING(TokenCategory.PRIMITIVE),
    NUMBER(TokenCategory.PRIMITIVE),
    IDENTIFIER(TokenCategory.PRIMITIVE),

    WHITESPACE(TokenCategory.TRIVIA),
    COMMENT(TokenCategory.TRIVIA),
    EOF(TokenCategory.TRIVIA);

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            for (String keyword : type.keywords) {
                KEYWORDS.put(keyword, type);
            }
        }
    }

    private final TokenCategory category;
    private final String[] keywords;

    TokenType(TokenCategory category, String... keywords) {
        this.category = category;
        this.keywords = keywords;
    }

    public TokenCategory category() {
        return category;
    }

    /**
     * Looks up the keyword type for an identifier, ignoring case.
     */
    public static Optional<TokenType> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }

    public boolean isLogicOperator() {
        return category == TokenCategory.LOGIC_OPERATOR;
    }

    public boolean isQuantifier() {
        return category == TokenCategory.QUANTIFIER;
    }

    public boolean isProofOperator() {
        return category == TokenCategory.PROOF_OPERATOR;
    }

    public boolean isMetadata() {
        return category == TokenCategory.STATEMENT_METADATA || category == TokenCategory.PROVENANCE;
    }

    public boolean isComparison() {
        return category == TokenCategory.COMPARISON && this != ASSIGN;
    }

    public boolean isTrivia() {
        return category == TokenCategory.TRIVIA && this != EOF;
    }
}
