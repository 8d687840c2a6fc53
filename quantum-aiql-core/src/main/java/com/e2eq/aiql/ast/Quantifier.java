package com.e2eq.aiql.ast;

public enum Quantifier {
    FORALL("forall", "∀"),
    EXISTS("exists", "∃");

    private final String keyword;
    private final String symbol;

    Quantifier(String keyword, String symbol) {
        this.keyword = keyword;
        this.symbol = symbol;
    }

    public String keyword() {
        return keyword;
    }

    public String symbol() {
        return symbol;
    }
}
