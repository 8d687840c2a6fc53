package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.parser.AiqlParser;
import org.junit.jupiter.api.Test;

import static com.e2eq.aiql.inference.AiqlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ConsistencyTest {

    @Test
    void testDirectContradiction() {
        InferenceEngine engine = new InferenceEngine(AiqlParser.parse("<X> [is] <Y>\nnot (<X> [is] <Y>)"));
        ConsistencyResult result = engine.checkConsistency();

        assertFalse(result.consistent());
        assertEquals(1, result.contradictions().size());
        Contradiction c = result.contradictions().get(0);
        assertEquals(fact("X", "is", "Y"), c.first());
        assertEquals(LogicalExpression.not(fact("X", "is", "Y")), c.second());
        assertEquals(Contradiction.DIRECT, c.reason());
    }

    @Test
    void testContradictoryImplications() {
        Intent a = fact("A", "p", "B");
        Intent b = fact("C", "q", "D");
        LogicalExpression positive = LogicalExpression.implies(a, b);
        LogicalExpression negative = LogicalExpression.implies(a, LogicalExpression.not(b));
        ConsistencyResult result = engine(positive, negative).checkConsistency();

        assertEquals(1, result.contradictions().size());
        assertEquals(positive, result.contradictions().get(0).first());
        assertEquals(negative, result.contradictions().get(0).second());
        assertEquals(Contradiction.IMPLICATIONS, result.contradictions().get(0).reason());
    }

    @Test
    void testConsistentKnowledgeBase() {
        InferenceEngine engine = engine(fact("A", "p", "B"), LogicalExpression.not(fact("C", "q", "D")));
        ConsistencyResult result = engine.checkConsistency();
        assertTrue(result.consistent());
        assertTrue(result.contradictions().isEmpty());
        assertEquals(2, engine.getKnowledgeBase().size());
    }
}
