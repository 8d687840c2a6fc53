package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.exceptions.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.e2eq.aiql.inference.AiqlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class InferenceEngineTest {

    @Test
    void testProveByBackwardChaining() {
        InferenceEngine engine = engine(fact("A", "p", "B"));
        ProofResult result = engine.prove(fact("A", "p", "B"));

        assertTrue(result.provable());
        assertEquals(ProofMethod.BACKWARD, result.proof().orElseThrow().method());
        assertTrue(result.reason().isEmpty());
    }

    @Test
    void testProveFallsBackToForwardChaining() {
        Intent a = fact("A", "p", "B");
        Intent b = fact("C", "q", "D");
        InferenceEngine engine = engine(a, LogicalExpression.implies(a, b));

        ProofResult result = engine.prove(b);

        assertTrue(result.provable());
        Proof proof = result.proof().orElseThrow();
        assertEquals(ProofMethod.FORWARD, proof.method());
        assertEquals(List.of(ProofStep.of(b, InferenceEngine.FORWARD_CHAINING)), proof.steps());
        assertTrue(engine.getKnowledgeBase().contains(b));
    }

    @Test
    void testUnprovableGoal() {
        ProofResult result = engine(fact("A", "p", "B")).prove(fact("X", "p", "Y"));
        assertFalse(result.provable());
        assertTrue(result.proof().isEmpty());
        assertEquals(Optional.of("Goal not derivable from knowledge base"), result.reason());
    }

    @Test
    void testQuery() {
        InferenceEngine engine = engine(fact("Socrates", "is", "Man"), fact("Rex", "is", "Dog"), fact("Plato", "is", "Man"));
        List<QueryMatch> matches = engine.query(pattern("who", "is", "Man"));

        assertEquals(2, matches.size());
        assertEquals(fact("Socrates", "is", "Man"), matches.get(0).fact());
        assertEquals(Optional.of("<Socrates>"), matches.get(0).substitution().get("who"));
        assertEquals(Optional.of("<Plato>"), matches.get(1).substitution().get("who"));
    }

    @Test
    void testUnifyDelegates() {
        InferenceEngine engine = engine();
        assertTrue(engine.unify(pattern("x", "is", "Man"), fact("Socrates", "is", "Man")).isPresent());
    }

    @Test
    void testAddFact() {
        InferenceEngine engine = engine();
        assertTrue(engine.addFact(fact("A", "p", "B")));
        assertFalse(engine.addFact(fact("A", "p", "B")));
        assertEquals(1, engine.getKnowledgeBase().size());

        RuleDefinition rule = RuleDefinition.of("r", fact("A", "p", "B"), fact("C", "q", "D"));
        engine.addFact(rule);
        assertEquals(List.of(rule), engine.rules());
    }

    @Test
    void testAddFromAiql() {
        InferenceEngine engine = engine(fact("Socrates", "is", "Man"));
        int added = engine.addFromAiql(String.join("\n",
                "<Socrates> [is] <Man>",
                "<Plato> [is] <Man>",
                "!Rule(id:mortality) { x [is] <Man> implies x [is] <Mortal> }"));

        assertEquals(2, added);
        assertEquals(1, engine.rules().size());
        assertTrue(engine.prove(fact("Plato", "is", "Mortal")).provable());
    }

    @Test
    void testAddFromAiqlSyntaxErrorLeavesKnowledgeBase() {
        InferenceEngine engine = engine(fact("A", "p", "B"));
        assertThrows(ParseException.class, () -> engine.addFromAiql("!Assert { <X> [p] <Y> } @1.5"));
        assertEquals(1, engine.getKnowledgeBase().size());
    }

    @Test
    void testKnowledgeBaseViewIsReadOnly() {
        InferenceEngine engine = engine(fact("A", "p", "B"));
        assertThrows(UnsupportedOperationException.class, () -> engine.getKnowledgeBase().add(fact("C", "q", "D")));
        assertThrows(UnsupportedOperationException.class, () -> engine.rules().clear());
    }

    @Test
    void testNullArgumentsRejected() {
        InferenceEngine engine = engine();
        assertThrows(NullPointerException.class, () -> engine.addFact(null));
        assertThrows(NullPointerException.class, () -> engine.backwardChain(null));
        assertThrows(NullPointerException.class, () -> new InferenceEngine(null));
    }
}
