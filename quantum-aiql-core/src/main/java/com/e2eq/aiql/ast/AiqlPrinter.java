package com.e2eq.aiql.ast;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Renders nodes back to compact AIQL-like text. The rendering of an expression is also
 * the term the unifier compares, so it must be stable for structurally equal input.
 */
public final class AiqlPrinter {
    private AiqlPrinter() {}

    private static final ExpressionRenderer EXPRESSIONS = new ExpressionRenderer();
    private static final NodeRenderer NODES = new NodeRenderer();

    public static String print(Expression expression) {
        return expression.accept(EXPRESSIONS);
    }

    public static String print(LogicalNode node) {
        return node.accept(NODES);
    }

    public static String print(Statement statement) {
        StringBuilder sb = new StringBuilder()
                .append(print(statement.subject()))
                .append(' ')
                .append(print(statement.relation()))
                .append(' ')
                .append(print(statement.object()));
        if (!statement.attributes().isEmpty()) {
            sb.append(statement.attributes().entrySet().stream()
                    .map(e -> e.getKey() + ": " + print(e.getValue()))
                    .collect(Collectors.joining(", ", " { ", " }")));
        }
        return sb.toString();
    }

    public static String print(Relation relation) {
        if ("=".equals(relation.name())) {
            return "=";
        }
        return relation.tense()
                .map(t -> "[" + relation.name() + "@tense:" + t.label() + "]")
                .orElseGet(() -> "[" + relation.name() + "]");
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String statements(List<Statement> statements) {
        if (statements.isEmpty()) {
            return "{ }";
        }
        return statements.stream().map(AiqlPrinter::print).collect(Collectors.joining(" ", "{ ", " }"));
    }

    private static String confidence(Optional<Double> confidence) {
        return confidence.map(c -> " @" + c).orElse("");
    }

    private static final class ExpressionRenderer implements Expression.Visitor<String> {

        @Override
        public String visitConcept(Concept concept) {
            return concept.name();
        }

        @Override
        public String visitLiteral(Literal literal) {
            if (literal.isNumber()) {
                return formatNumber(literal.asDouble());
            }
            if (literal.isString()) {
                return '"' + ((String) literal.value()).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
            }
            return literal.value().toString();
        }

        @Override
        public String visitIdentifier(Identifier identifier) {
            return identifier.name();
        }

        @Override
        public String visitMath(MathExpression math) {
            return "(" + print(math.left()) + " " + math.operator().symbol() + " " + print(math.right()) + ")";
        }

        @Override
        public String visitSet(SetExpression set) {
            return "(" + print(set.left()) + " " + set.operator().keyword() + " " + print(set.right()) + ")";
        }

        @Override
        public String visitFunctionApplication(FunctionApplication application) {
            String args = application.arguments().stream().map(AiqlPrinter::print).collect(Collectors.joining(", "));
            if (FunctionApplication.LIST.equals(application.function())) {
                return "[" + args + "]";
            }
            return application.function() + "(" + args + ")";
        }

        @Override
        public String visitLambda(LambdaExpression lambda) {
            return "lambda " + String.join(", ", lambda.parameters()) + ": " + print(lambda.body());
        }

        @Override
        public String visitUnary(UnaryExpression unary) {
            return unary.operator().symbol() + print(unary.operand());
        }

        @Override
        public String visitComparison(ComparisonExpression comparison) {
            return print(comparison.left()) + " " + comparison.operator().symbol() + " " + print(comparison.right());
        }

        @Override
        public String visitSpatial(SpatialExpression spatial) {
            if (spatial.kind() == SpatialExpression.Kind.VARIABLE) {
                return "space:variable(" + spatial.variable() + ")";
            }
            return spatial.coordinates().stream()
                    .map(AiqlPrinter::formatNumber)
                    .collect(Collectors.joining(", ", "space:literal(", ")"));
        }
    }

    private static final class NodeRenderer implements LogicalNode.Visitor<String> {

        @Override
        public String visitIntent(Intent intent) {
            StringBuilder sb = new StringBuilder("!").append(intent.intentType());
            if (!intent.contextParams().isEmpty()) {
                sb.append(params(intent.contextParams()));
            }
            sb.append(' ').append(statements(intent.statements()));
            sb.append(confidence(intent.confidence()));
            intent.coherence().ifPresent(c -> sb.append(" @coherence:").append(c));
            return sb.toString();
        }

        @Override
        public String visitLogicalExpression(LogicalExpression expression) {
            if (expression.operator().isUnary()) {
                return "not (" + print(expression.left()) + ")";
            }
            return "(" + print(expression.left()) + " " + expression.operator().keyword() + " "
                    + print(expression.right()) + ")";
        }

        @Override
        public String visitQuantifiedExpression(QuantifiedExpression expression) {
            return expression.quantifier().keyword() + " " + expression.variable()
                    + expression.domain().map(d -> " in " + d).orElse("")
                    + ": " + print(expression.body());
        }

        @Override
        public String visitRuleDefinition(RuleDefinition rule) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("id", rule.ruleId());
            rule.domain().ifPresent(d -> params.put("domain", d));
            String connective = rule.bidirectional() ? " iff " : " implies ";
            return "!Rule" + params(params) + " { " + print(rule.premises()) + connective + print(rule.conclusion()) + " }"
                    + (rule.confidence() < 1.0 ? " @" + rule.confidence() : "");
        }

        @Override
        public String visitRelationship(RelationshipNode relationship) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("type", relationship.relationshipType().name().toLowerCase(Locale.ROOT));
            params.put("source", "$id:" + relationship.source());
            params.put("target", "$id:" + relationship.target());
            if (relationship.relationName() != null) {
                params.put("relation", relationship.relationName());
            }
            return "!Relationship" + params(params) + " " + statements(relationship.statements())
                    + confidence(relationship.confidence());
        }

        @Override
        public String visitExample(ExampleNode example) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("type", example.exampleType().name().toLowerCase(Locale.ROOT));
            if (example.target() != null) {
                params.put("target", example.target());
            }
            if (example.contextType() != null) {
                params.put("context", example.contextType());
            }
            return "!Example" + params(params) + " " + statements(example.statements()) + confidence(example.confidence());
        }

        private static String params(Map<String, String> params) {
            return params.entrySet().stream()
                    .map(e -> e.getKey() + ":" + e.getValue())
                    .collect(Collectors.joining(", ", "(", ")"));
        }
    }
}
