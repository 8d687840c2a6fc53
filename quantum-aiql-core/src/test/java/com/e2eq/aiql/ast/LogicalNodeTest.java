package com.e2eq.aiql.ast;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LogicalNodeTest {

    private static Intent assertFact(String subject, String relation, String object) {
        return Intent.of("Assert", Statement.of(new Concept(subject), relation, new Concept(object)));
    }

    @Test
    void testConnectiveArity() {
        Intent a = assertFact("<A>", "p", "<B>");
        assertThrows(IllegalArgumentException.class, () -> new LogicalExpression(LogicalOperator.AND, a, null));
        assertThrows(IllegalArgumentException.class, () -> new LogicalExpression(LogicalOperator.NOT, a, a));
        assertThrows(NullPointerException.class, () -> new LogicalExpression(LogicalOperator.NOT, null, null));
        assertNull(LogicalExpression.not(a).right());
    }

    @Test
    void testQuantifierRequiresVariable() {
        Intent a = assertFact("<A>", "p", "<B>");
        assertThrows(IllegalArgumentException.class,
                () -> new QuantifiedExpression(Quantifier.FORALL, " ", Optional.empty(), a));
    }

    @Test
    void testStatementPartsAreRequired() {
        assertThrows(NullPointerException.class, () -> new Statement(null, Relation.of("p"), new Concept("<B>"), Map.of()));
        assertThrows(NullPointerException.class, () -> new Statement(new Concept("<A>"), null, new Concept("<B>"), Map.of()));
        assertThrows(NullPointerException.class, () -> new Statement(new Concept("<A>"), Relation.of("p"), null, Map.of()));
    }

    @Test
    void testConfidenceRange() {
        Intent a = assertFact("<A>", "p", "<B>");
        assertThrows(IllegalArgumentException.class, () -> a.withConfidence(1.01));
        assertEquals(Optional.of(0.5), a.withConfidence(0.5).confidence());
        assertThrows(IllegalArgumentException.class, () -> new RuleDefinition("r", Optional.empty(), a, a, false, -0.1));
    }

    @Test
    void testStructuralEquality() {
        LogicalNode first = LogicalExpression.implies(assertFact("<A>", "p", "<B>"), assertFact("<C>", "q", "<D>"));
        LogicalNode second = LogicalExpression.implies(assertFact("<A>", "p", "<B>"), assertFact("<C>", "q", "<D>"));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, LogicalExpression.implies(assertFact("<A>", "p", "<B>"), assertFact("<C>", "q", "<E>")));
        assertEquals(Set.of(first), new HashSet<>(List.of(first, second)));
    }

    @Test
    void testNodesAreImmutable() {
        List<Statement> statements = new ArrayList<>();
        statements.add(Statement.of(new Concept("<A>"), "p", new Concept("<B>")));
        Intent intent = Intent.of("Assert", statements);
        statements.clear();
        assertEquals(1, intent.statements().size());
        assertThrows(UnsupportedOperationException.class, () -> intent.statements().clear());
    }

    @Test
    void testVisitorReachesEveryVariant() {
        Intent a = assertFact("<A>", "p", "<B>");
        List<LogicalNode> nodes = List.of(
                a,
                LogicalExpression.not(a),
                new QuantifiedExpression(Quantifier.EXISTS, "x", Optional.of("Thing"), a),
                RuleDefinition.of("r", a, a),
                new RelationshipNode(RelationshipType.CAUSAL, "s", "t", "causes", List.of(), Optional.empty(), false, Map.of()),
                new ExampleNode(ExampleType.CONCEPT, "<A>", null, List.of(), Optional.empty(), Map.of()));

        LogicalNode.Visitor<NodeType> typeOf = new LogicalNode.Visitor<>() {
            @Override
            public NodeType visitIntent(Intent intent) {
                return NodeType.INTENT;
            }

            @Override
            public NodeType visitLogicalExpression(LogicalExpression expression) {
                return NodeType.LOGICAL_EXPRESSION;
            }

            @Override
            public NodeType visitQuantifiedExpression(QuantifiedExpression expression) {
                return NodeType.QUANTIFIED_EXPRESSION;
            }

            @Override
            public NodeType visitRuleDefinition(RuleDefinition rule) {
                return NodeType.RULE_DEFINITION;
            }

            @Override
            public NodeType visitRelationship(RelationshipNode relationship) {
                return NodeType.RELATIONSHIP;
            }

            @Override
            public NodeType visitExample(ExampleNode example) {
                return NodeType.EXAMPLE;
            }
        };
        for (LogicalNode node : nodes) {
            assertEquals(node.type(), node.accept(typeOf));
        }
    }

    @Test
    void testPrinter() {
        Intent a = assertFact("<A>", "p", "<B>").withConfidence(0.9);
        assertEquals("!Assert { <A> [p] <B> } @0.9", AiqlPrinter.print(a));
        assertEquals("not (!Assert { <A> [p] <B> } @0.9)", AiqlPrinter.print(LogicalExpression.not(a)));
        assertEquals("forall x in Thing: !Assert { <A> [p] <B> } @0.9",
                AiqlPrinter.print(new QuantifiedExpression(Quantifier.FORALL, "x", Optional.of("Thing"), a)));
        Statement tensed = new Statement(new Identifier("x"), new Relation("was", Optional.of(Tense.PAST)),
                Literal.of(3.5), Map.of("k", Literal.of("v")));
        assertEquals("x [was@tense:past] 3.5 { k: \"v\" }", AiqlPrinter.print(tensed));
        assertEquals("12", AiqlPrinter.formatNumber(12.0));
    }
}
