package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;
import org.apache.commons.lang3.math.NumberUtils;

import java.util.*;

/**
 * First-order style matching of a pattern node against a target node.
 * <p>
 * Terms are compared by their printed form ({@link AiqlPrinter#print(Expression)} for
 * subjects and objects, the bracketed name for relations). A term is a variable when it is
 * not wrapped in {@code <...>} or {@code [...]} and starts with a lowercase ASCII letter, so
 * {@code x} is a variable while {@code <X>}, {@code [is_a]} and {@code Socrates} are not.
 * Variables are only recognised on the pattern side.
 * Only intents, connectives and quantified expressions unify; rules, relationships and
 * examples never match anything.
 * </p>
 */
public final class Unifier {
    private Unifier() {}

    public static Optional<Substitution> unify(LogicalNode pattern, LogicalNode target) {
        return unify(pattern, target, Substitution.empty());
    }

    /**
     * Unifies {@code pattern} with {@code target}, extending {@code initial}. Bindings are
     * shared across the whole node, so a variable seen twice must match the same term twice.
     *
     * @return the extended substitution, or empty when the nodes do not match
     */
    public static Optional<Substitution> unify(LogicalNode pattern, LogicalNode target, Substitution initial) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(initial, "initial");
        Map<String, String> bindings = new LinkedHashMap<>(initial.bindings());
        if (!nodes(pattern, target, bindings)) {
            return Optional.empty();
        }
        return Optional.of(new Substitution(bindings));
    }

    public static boolean isVariable(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        if (term.startsWith("<") && term.endsWith(">")) {
            return false;
        }
        if (term.startsWith("[") && term.endsWith("]")) {
            return false;
        }
        char first = term.charAt(0);
        return first >= 'a' && first <= 'z';
    }

    public static String term(Expression expression) {
        return AiqlPrinter.print(expression);
    }

    public static String term(Relation relation) {
        return "[" + relation.name() + "]";
    }

    /**
     * Replaces bound variables inside intents, connectives and quantifier bodies. The
     * quantified variable and domain, rules, relationships and examples are left as is.
     */
    public static LogicalNode apply(LogicalNode node, Substitution substitution) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(substitution, "substitution");
        if (substitution.isEmpty()) {
            return node;
        }
        return node.accept(new SubstitutingVisitor(substitution));
    }

    private static boolean nodes(LogicalNode pattern, LogicalNode target, Map<String, String> bindings) {
        if (pattern.type() != target.type()) {
            return false;
        }
        return switch (pattern.type()) {
            case INTENT -> intents((Intent) pattern, (Intent) target, bindings);
            case LOGICAL_EXPRESSION -> connectives((LogicalExpression) pattern, (LogicalExpression) target, bindings);
            case QUANTIFIED_EXPRESSION -> quantified((QuantifiedExpression) pattern, (QuantifiedExpression) target, bindings);
            case RULE_DEFINITION, RELATIONSHIP, EXAMPLE -> false;
        };
    }

    private static boolean intents(Intent pattern, Intent target, Map<String, String> bindings) {
        if (!pattern.intentType().equals(target.intentType())) {
            return false;
        }
        if (pattern.statements().size() != target.statements().size()) {
            return false;
        }
        for (int i = 0; i < pattern.statements().size(); i++) {
            Statement p = pattern.statements().get(i);
            Statement t = target.statements().get(i);
            if (!terms(term(p.subject()), term(t.subject()), bindings)
                    || !terms(term(p.relation()), term(t.relation()), bindings)
                    || !terms(term(p.object()), term(t.object()), bindings)) {
                return false;
            }
        }
        return true;
    }

    private static boolean connectives(LogicalExpression pattern, LogicalExpression target, Map<String, String> bindings) {
        if (pattern.operator() != target.operator()) {
            return false;
        }
        if (!nodes(pattern.left(), target.left(), bindings)) {
            return false;
        }
        if (pattern.right() == null || target.right() == null) {
            return pattern.right() == target.right();
        }
        return nodes(pattern.right(), target.right(), bindings);
    }

    private static boolean quantified(QuantifiedExpression pattern, QuantifiedExpression target, Map<String, String> bindings) {
        if (pattern.quantifier() != target.quantifier()
                || !pattern.variable().equals(target.variable())
                || !pattern.domain().equals(target.domain())) {
            return false;
        }
        return nodes(pattern.body(), target.body(), bindings);
    }

    private static boolean terms(String pattern, String target, Map<String, String> bindings) {
        if (isVariable(pattern)) {
            String bound = bindings.get(pattern);
            if (bound != null) {
                return bound.equals(target);
            }
            bindings.put(pattern, target);
            return true;
        }
        return pattern.equals(target);
    }

    static Expression toExpression(String term) {
        if (term.length() > 1 && term.startsWith("<") && term.endsWith(">")) {
            return new Concept(term);
        }
        if (term.length() > 1 && term.startsWith("\"") && term.endsWith("\"")) {
            return Literal.of(term.substring(1, term.length() - 1).replace("\\\"", "\"").replace("\\\\", "\\"));
        }
        if ("true".equals(term) || "false".equals(term)) {
            return Literal.of(Boolean.parseBoolean(term));
        }
        if (NumberUtils.isParsable(term)) {
            return Literal.of(Double.parseDouble(term));
        }
        return new Identifier(term);
    }

    private static final class SubstitutingVisitor implements LogicalNode.Visitor<LogicalNode> {
        private final Substitution substitution;

        SubstitutingVisitor(Substitution substitution) {
            this.substitution = substitution;
        }

        @Override
        public LogicalNode visitIntent(Intent intent) {
            List<Statement> replaced = new ArrayList<>(intent.statements().size());
            for (Statement s : intent.statements()) {
                replaced.add(new Statement(expression(s.subject()), s.relation(), expression(s.object()), s.attributes()));
            }
            return intent.withStatements(replaced);
        }

        @Override
        public LogicalNode visitLogicalExpression(LogicalExpression expression) {
            LogicalNode left = expression.left().accept(this);
            LogicalNode right = expression.right() == null ? null : expression.right().accept(this);
            return new LogicalExpression(expression.operator(), left, right);
        }

        @Override
        public LogicalNode visitQuantifiedExpression(QuantifiedExpression expression) {
            return new QuantifiedExpression(expression.quantifier(), expression.variable(), expression.domain(),
                    expression.body().accept(this));
        }

        @Override
        public LogicalNode visitRuleDefinition(RuleDefinition rule) {
            return rule;
        }

        @Override
        public LogicalNode visitRelationship(RelationshipNode relationship) {
            return relationship;
        }

        @Override
        public LogicalNode visitExample(ExampleNode example) {
            return example;
        }

        private Expression expression(Expression expression) {
            String term = term(expression);
            if (!isVariable(term)) {
                return expression;
            }
            return substitution.get(term).map(Unifier::toExpression).orElse(expression);
        }
    }
}
