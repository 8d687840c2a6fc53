package com.e2eq.aiql.ast;

public enum SetOperator {
    UNION("union"),
    INTERSECT("intersect");

    private final String keyword;

    SetOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
