package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.e2eq.aiql.inference.AiqlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StandardInferenceRulesTest {

    private final StandardInferenceRules rules = new StandardInferenceRules(10);
    private final Intent a = fact("A", "p", "B");
    private final Intent b = fact("C", "q", "D");

    @Test
    void testModusPonensRecordsPremises() {
        LogicalExpression impl = LogicalExpression.implies(a, b);
        List<Derivation> derived = rules.modusPonens(List.of(a, impl));

        assertEquals(1, derived.size());
        assertEquals(StandardInferenceRules.MODUS_PONENS, derived.get(0).rule());
        assertEquals(b, derived.get(0).conclusion());
        assertEquals(List.of(a, impl), derived.get(0).premises());
    }

    @Test
    void testRulesSeeOnlyFactsFromStartOfRound() {
        KnowledgeBase kb = new KnowledgeBase(List.of(a, LogicalExpression.implies(a, b)));
        List<Derivation> added = rules.applyAll(kb);

        // b is not yet known to conjunction introduction
        assertEquals(List.of(StandardInferenceRules.MODUS_PONENS), added.stream().map(Derivation::rule).toList());
        assertTrue(kb.contains(b));
        assertFalse(kb.contains(LogicalExpression.and(a, b)));
    }

    @Test
    void testConjunctionIntroductionOnlyPairsLeadingIntents() {
        Intent c = fact("E", "r", "F");
        List<Derivation> derived = new StandardInferenceRules(2).conjunctionIntroduction(List.of(a, LogicalExpression.not(c), b, c));

        assertEquals(1, derived.size());
        assertEquals(LogicalExpression.and(a, b), derived.get(0).conclusion());
    }

    @Test
    void testNegativeCapRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StandardInferenceRules(-1));
    }
}
