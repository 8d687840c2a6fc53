package com.e2eq.aiql.ast;

import java.util.Objects;

/**
 * A propositional connective. {@code right} is {@code null} exactly when the operator is {@code not}.
 */
public record LogicalExpression(LogicalOperator operator, LogicalNode left, LogicalNode right) implements LogicalNode {

    public LogicalExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        if (operator.isUnary()) {
            AstChecks.require(right == null, "'not' takes exactly one operand");
        } else {
            AstChecks.require(right != null, "'" + operator.keyword() + "' requires two operands");
        }
    }

    public static LogicalExpression not(LogicalNode operand) {
        return new LogicalExpression(LogicalOperator.NOT, operand, null);
    }

    public static LogicalExpression and(LogicalNode left, LogicalNode right) {
        return new LogicalExpression(LogicalOperator.AND, left, right);
    }

    public static LogicalExpression or(LogicalNode left, LogicalNode right) {
        return new LogicalExpression(LogicalOperator.OR, left, right);
    }

    public static LogicalExpression implies(LogicalNode left, LogicalNode right) {
        return new LogicalExpression(LogicalOperator.IMPLIES, left, right);
    }

    public static LogicalExpression iff(LogicalNode left, LogicalNode right) {
        return new LogicalExpression(LogicalOperator.IFF, left, right);
    }

    public boolean is(LogicalOperator op) {
        return operator == op;
    }

    @Override
    public NodeType type() {
        return NodeType.LOGICAL_EXPRESSION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLogicalExpression(this);
    }
}
