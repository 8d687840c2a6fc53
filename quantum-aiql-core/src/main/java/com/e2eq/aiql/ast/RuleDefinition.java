package com.e2eq.aiql.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * A named inference rule: whenever {@code premises} holds, {@code conclusion} follows.
 * A bidirectional rule also licenses {@code premises} from {@code conclusion}.
 */
public record RuleDefinition(String ruleId, Optional<String> domain, LogicalNode premises, LogicalNode conclusion,
                             boolean bidirectional, double confidence) implements LogicalNode {

    public RuleDefinition {
        AstChecks.require(ruleId != null && !ruleId.isBlank(), "Rule id must be non-empty");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(premises, "premises");
        Objects.requireNonNull(conclusion, "conclusion");
        AstChecks.require(confidence >= 0.0 && confidence <= 1.0, "Rule confidence must be within [0, 1], was " + confidence);
    }

    public static RuleDefinition of(String ruleId, LogicalNode premises, LogicalNode conclusion) {
        return new RuleDefinition(ruleId, Optional.empty(), premises, conclusion, false, 1.0);
    }

    @Override
    public NodeType type() {
        return NodeType.RULE_DEFINITION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRuleDefinition(this);
    }
}
