package com.e2eq.aiql.inference.runtime;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.exceptions.LexException;
import com.e2eq.aiql.inference.InferenceEngine;
import com.e2eq.aiql.inference.InferenceSettings;
import com.e2eq.aiql.inference.spi.InMemoryTrustRegistry;
import com.e2eq.aiql.inference.spi.OntologyReasoner;
import com.e2eq.aiql.inference.spi.TrustRegistry;
import com.e2eq.aiql.parser.AiqlProgramLoader;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Modifier;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InferenceEngineFactoryTest {

    @Test
    void testCreateFromSource() {
        InferenceSettings settings = InferenceSettings.defaults().withMaxProofDepth(3);
        InferenceEngineFactory factory = new InferenceEngineFactory(new AiqlProgramLoader(), settings,
                OntologyReasoner.noop(), TrustRegistry.noop());

        InferenceEngine engine = factory.create("<Socrates> [is] <Man>\n!Rule(id:m) { x [is] <Man> implies x [is] <Mortal> }");

        assertSame(settings, engine.settings());
        assertEquals(2, engine.getKnowledgeBase().size());
        Intent goal = Intent.of("Assert", Statement.of(new Concept("<Socrates>"), "is", new Concept("<Mortal>")));
        assertTrue(engine.prove(goal).provable());
    }

    @Test
    void testEnginesAreIndependent() {
        InferenceEngineFactory factory = new InferenceEngineFactory(new AiqlProgramLoader(), InferenceSettings.defaults(),
                OntologyReasoner.noop(), new InMemoryTrustRegistry());
        InferenceEngine first = factory.create(Program.of(List.of()));
        InferenceEngine second = factory.create(Program.of(List.of()));

        first.addFromAiql("<A> [p] <B>");
        assertEquals(1, first.getKnowledgeBase().size());
        assertTrue(second.getKnowledgeBase().isEmpty());
        assertSame(first.getTrustRegistry(), second.getTrustRegistry());
    }

    @Test
    void testLoaderInputCapApplies() {
        InferenceEngineFactory factory = new InferenceEngineFactory(new AiqlProgramLoader(8), InferenceSettings.defaults(),
                OntologyReasoner.noop(), TrustRegistry.noop());
        assertThrows(LexException.class, () -> factory.create("<Socrates> [is] <Man>"));
    }

    @Test
    void testPostConstructLoadsSettings() {
        InferenceEngineFactory factory = new InferenceEngineFactory(new AiqlProgramLoader(), null, null,
                "aiql/custom-inference.yaml");
        factory.init();

        assertEquals(5, factory.settings().maxProofDepth());
        assertEquals(0.5, factory.settings().lieThreshold());
        assertSame(OntologyReasoner.noop(), factory.create(Program.of(List.of())).getOntologyReasoner());
    }

    @Test
    void testPostConstructFallsBackToDefaults() {
        InferenceEngineFactory factory = new InferenceEngineFactory(new AiqlProgramLoader(), null, null,
                "aiql/does-not-exist.yaml");
        factory.init();
        assertEquals(InferenceSettings.defaults(), factory.settings());
    }

    @Test
    void testProxyableNoArgConstructor() throws NoSuchMethodException {
        int modifiers = InferenceEngineFactory.class.getDeclaredConstructor().getModifiers();
        assertTrue(Modifier.isProtected(modifiers));

        // what a container-generated client proxy does
        InferenceEngineFactory proxy = new InferenceEngineFactory() { };
        assertNull(proxy.settings());
    }
}
