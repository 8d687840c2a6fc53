package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;
import com.e2eq.aiql.inference.spi.*;
import com.e2eq.aiql.parser.AiqlProgramLoader;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Reasons over the top-level nodes of a {@link Program}.
 * <p>
 * The program body becomes the initial knowledge base and every {@link RuleDefinition} in it
 * is registered as a rule. Forward chaining saturates the knowledge base with rule
 * conclusions and the standard propositional rules; backward chaining searches for a proof
 * of a single goal without adding anything permanently. Contradiction checks never modify
 * the knowledge base.
 * </p>
 * Instances are not thread-safe.
 */
public class InferenceEngine {

    private static final Logger LOG = Logger.getLogger(InferenceEngine.class);

    public static final String FACT = "fact";
    public static final String CONJUNCTION_INTRODUCTION = StandardInferenceRules.CONJUNCTION_INTRODUCTION;
    public static final String IMPLICATION_INTRODUCTION = "implication-introduction";
    public static final String FORWARD_CHAINING = "forward-chaining";
    public static final String CONTRADICTS = "contradicts";

    static final double SEMANTIC_CONFLICT_CONFIDENCE = 0.92;
    static final double LIE_CONFIDENCE = 0.88;
    static final String ASSERT = "Assert";

    private final KnowledgeBase kb;
    private final InferenceSettings settings;
    private final StandardInferenceRules standardRules;
    private final OntologyReasoner ontologyReasoner;
    private final TrustRegistry trustRegistry;
    private final AiqlProgramLoader loader;

    public InferenceEngine(Program program) {
        this(program, InferenceSettings.defaults());
    }

    public InferenceEngine(Program program, InferenceSettings settings) {
        this(program, settings, OntologyReasoner.noop(), TrustRegistry.noop());
    }

    public InferenceEngine(Program program, InferenceSettings settings,
                           OntologyReasoner ontologyReasoner, TrustRegistry trustRegistry) {
        this(program, settings, ontologyReasoner, trustRegistry, new AiqlProgramLoader());
    }

    public InferenceEngine(Program program, InferenceSettings settings, OntologyReasoner ontologyReasoner,
                           TrustRegistry trustRegistry, AiqlProgramLoader loader) {
        Objects.requireNonNull(program, "program");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ontologyReasoner = Objects.requireNonNull(ontologyReasoner, "ontologyReasoner");
        this.trustRegistry = Objects.requireNonNull(trustRegistry, "trustRegistry");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.standardRules = new StandardInferenceRules(settings.conjunctionIntroductionCap());
        this.kb = new KnowledgeBase(program.body());

        List<Statement> statements = statements();
        ontologyReasoner.learnHierarchy(statements);
        int trusted = trustRegistry.loadFromKnowledgeBase(statements);
        LOG.debugf("Knowledge base initialised with %d facts, %d rules, %d trust scores",
                kb.size(), kb.rules().size(), trusted);
    }

    // ------------------------------------------------------------------
    // Knowledge base access
    // ------------------------------------------------------------------

    public List<LogicalNode> getKnowledgeBase() {
        return kb.snapshot();
    }

    public List<RuleDefinition> rules() {
        return kb.rules();
    }

    public InferenceSettings settings() {
        return settings;
    }

    public OntologyReasoner getOntologyReasoner() {
        return ontologyReasoner;
    }

    public TrustRegistry getTrustRegistry() {
        return trustRegistry;
    }

    /**
     * Adds a fact, registering it as a rule when it is a {@link RuleDefinition}.
     *
     * @return {@code false} when an equal fact was already present
     */
    public boolean addFact(LogicalNode node) {
        Objects.requireNonNull(node, "node");
        boolean added = kb.add(node);
        if (added && node instanceof Intent intent) {
            ontologyReasoner.learnHierarchy(intent.statements());
            trustRegistry.loadFromKnowledgeBase(intent.statements());
        }
        return added;
    }

    /**
     * Parses {@code source} and adds every top-level node. Syntax errors propagate and leave
     * the knowledge base untouched.
     *
     * @return the number of nodes that were new
     */
    public int addFromAiql(String source) {
        Program program = loader.parse(source);
        int added = 0;
        for (LogicalNode node : program.body()) {
            if (addFact(node)) {
                added++;
            }
        }
        return added;
    }

    // ------------------------------------------------------------------
    // Unification and queries
    // ------------------------------------------------------------------

    public Optional<Substitution> unify(LogicalNode pattern, LogicalNode target) {
        return Unifier.unify(pattern, target);
    }

    public List<QueryMatch> query(LogicalNode pattern) {
        Objects.requireNonNull(pattern, "pattern");
        List<QueryMatch> matches = new ArrayList<>();
        for (LogicalNode fact : kb.snapshot()) {
            Unifier.unify(pattern, fact).ifPresent(s -> matches.add(new QueryMatch(fact, s)));
        }
        return matches;
    }

    // ------------------------------------------------------------------
    // Forward chaining
    // ------------------------------------------------------------------

    public List<LogicalNode> forwardChain() {
        return forwardChain(settings.maxForwardSteps());
    }

    /**
     * Runs at most {@code maxSteps} rounds, stopping after the first round that adds nothing.
     *
     * @return the facts added, in the order they were derived
     */
    public List<LogicalNode> forwardChain(int maxSteps) {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be > 0, was " + maxSteps);
        }
        List<LogicalNode> added = new ArrayList<>();
        for (int round = 1; round <= maxSteps; round++) {
            int before = added.size();
            applyRuleDefinitions(added);
            for (Derivation d : standardRules.applyAll(kb)) {
                if (LOG.isTraceEnabled()) {
                    LOG.tracef("%s: %s", d.rule(), AiqlPrinter.print(d.conclusion()));
                }
                added.add(d.conclusion());
            }
            int derived = added.size() - before;
            LOG.debugf("Forward chaining round %d derived %d new facts", round, derived);
            if (derived == 0) {
                break;
            }
        }
        return added;
    }

    private void applyRuleDefinitions(List<LogicalNode> added) {
        for (RuleDefinition rule : kb.rules()) {
            for (LogicalNode fact : kb.snapshot()) {
                Optional<Substitution> forward = Unifier.unify(rule.premises(), fact);
                if (forward.isPresent()) {
                    addDerived(Unifier.apply(rule.conclusion(), forward.get()), added);
                }
                if (rule.bidirectional()) {
                    Optional<Substitution> reverse = Unifier.unify(rule.conclusion(), fact);
                    if (reverse.isPresent()) {
                        addDerived(Unifier.apply(rule.premises(), reverse.get()), added);
                    }
                }
            }
        }
    }

    private void addDerived(LogicalNode derived, List<LogicalNode> added) {
        if (kb.add(derived)) {
            added.add(derived);
        }
    }

    // ------------------------------------------------------------------
    // Backward chaining
    // ------------------------------------------------------------------

    public Optional<Proof> backwardChain(LogicalNode goal) {
        Objects.requireNonNull(goal, "goal");
        Set<LogicalNode> visited = new HashSet<>();
        return proveGoal(goal, 0, visited)
                .map(steps -> new Proof(goal, steps, true, ProofMethod.BACKWARD));
    }

    private Optional<List<ProofStep>> proveGoal(LogicalNode goal, int depth, Set<LogicalNode> visited) {
        if (depth > settings.maxProofDepth()) {
            LOG.debugf("Proof depth %d exceeds limit %d", depth, settings.maxProofDepth());
            return Optional.empty();
        }
        if (!visited.add(goal)) {
            return Optional.empty();
        }
        if (kb.contains(goal)) {
            return Optional.of(List.of(ProofStep.of(goal, FACT)));
        }

        for (RuleDefinition rule : kb.rules()) {
            Optional<List<ProofStep>> viaRule = proveByRule(goal, rule.ruleId(), rule.conclusion(), rule.premises(), depth, visited);
            if (viaRule.isPresent()) {
                return viaRule;
            }
            if (rule.bidirectional()) {
                viaRule = proveByRule(goal, rule.ruleId(), rule.premises(), rule.conclusion(), depth, visited);
                if (viaRule.isPresent()) {
                    return viaRule;
                }
            }
        }

        if (goal instanceof LogicalExpression e) {
            if (e.is(LogicalOperator.AND)) {
                Optional<List<ProofStep>> left = proveGoal(e.left(), depth + 1, visited);
                if (left.isPresent()) {
                    Optional<List<ProofStep>> right = proveGoal(e.right(), depth + 1, visited);
                    if (right.isPresent()) {
                        List<ProofStep> steps = new ArrayList<>(left.get());
                        steps.addAll(right.get());
                        steps.add(ProofStep.of(goal, CONJUNCTION_INTRODUCTION, e.left(), e.right()));
                        return Optional.of(steps);
                    }
                }
            } else if (e.is(LogicalOperator.IMPLIES)) {
                Optional<List<ProofStep>> consequent;
                try (KnowledgeBase.Assumption ignored = kb.assume(e.left())) {
                    consequent = proveGoal(e.right(), depth + 1, visited);
                }
                if (consequent.isPresent()) {
                    List<ProofStep> steps = new ArrayList<>(consequent.get());
                    steps.add(ProofStep.of(goal, IMPLICATION_INTRODUCTION, e.left(), e.right()));
                    return Optional.of(steps);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<ProofStep>> proveByRule(LogicalNode goal, String ruleId, LogicalNode head, LogicalNode body,
                                                  int depth, Set<LogicalNode> visited) {
        Optional<Substitution> substitution = Unifier.unify(head, goal);
        if (substitution.isEmpty()) {
            return Optional.empty();
        }
        LogicalNode subgoal = Unifier.apply(body, substitution.get());
        LOG.debugf("Trying rule %s for goal at depth %d", ruleId, depth);
        Optional<List<ProofStep>> premises = proveGoal(subgoal, depth + 1, visited);
        if (premises.isEmpty()) {
            return Optional.empty();
        }
        List<ProofStep> steps = new ArrayList<>(premises.get());
        steps.add(new ProofStep(goal, ruleId, List.of(subgoal), substitution));
        return Optional.of(steps);
    }

    // ------------------------------------------------------------------
    // Proof
    // ------------------------------------------------------------------

    /**
     * Tries backward chaining, then falls back to forward chaining. The fallback keeps the
     * facts it derives.
     */
    public ProofResult prove(LogicalNode goal) {
        Optional<Proof> backward = backwardChain(goal);
        if (backward.isPresent()) {
            return ProofResult.proven(backward.get());
        }
        forwardChain(settings.proveForwardSteps());
        if (kb.contains(goal)) {
            return ProofResult.proven(new Proof(goal, List.of(ProofStep.of(goal, FORWARD_CHAINING)), true, ProofMethod.FORWARD));
        }
        return ProofResult.notDerivable();
    }

    // ------------------------------------------------------------------
    // Consistency
    // ------------------------------------------------------------------

    public ConsistencyResult checkConsistency() {
        List<LogicalNode> facts = kb.snapshot();
        List<Contradiction> contradictions = new ArrayList<>();

        for (LogicalNode fact : facts) {
            if (fact instanceof LogicalExpression neg && neg.is(LogicalOperator.NOT) && kb.contains(neg.left())) {
                contradictions.add(new Contradiction(neg.left(), neg, Contradiction.DIRECT));
            }
        }

        for (LogicalNode a : facts) {
            if (!(a instanceof LogicalExpression first) || !first.is(LogicalOperator.IMPLIES)) continue;
            for (LogicalNode b : facts) {
                if (b instanceof LogicalExpression second && second.is(LogicalOperator.IMPLIES)
                        && first.left().equals(second.left())
                        && second.right() instanceof LogicalExpression negated && negated.is(LogicalOperator.NOT)
                        && negated.left().equals(first.right())) {
                    contradictions.add(new Contradiction(first, second, Contradiction.IMPLICATIONS));
                }
            }
        }

        if (!contradictions.isEmpty()) {
            LOG.warnf("Knowledge base is inconsistent: %d contradiction(s), first: %s",
                    contradictions.size(), AiqlPrinter.print(contradictions.get(0).second()));
        }
        return ConsistencyResult.of(contradictions);
    }

    public List<SemanticConflict> detectSemanticContradictions() {
        return ontologyReasoner.detectAllConflicts(statements());
    }

    public List<PotentialLie> detectLying() {
        return detectLying(settings.lieThreshold());
    }

    /**
     * Flags the less trusted side of each pair of contradicting {@code !Assert} intents when
     * the trust registry judges the gap in weighted confidence to exceed {@code threshold}.
     */
    public List<PotentialLie> detectLying(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be within [0, 1], was " + threshold);
        }
        List<Intent> asserts = new ArrayList<>();
        for (LogicalNode fact : kb.snapshot()) {
            if (fact instanceof Intent intent && intent.isType(ASSERT)) {
                asserts.add(intent);
            }
        }
        List<PotentialLie> lies = new ArrayList<>();
        for (int i = 0; i < asserts.size(); i++) {
            for (int j = i + 1; j < asserts.size(); j++) {
                Intent first = asserts.get(i);
                Intent second = asserts.get(j);
                if (!contradict(first, second)) {
                    continue;
                }
                boolean firstStronger = weighted(first) >= weighted(second);
                Intent high = firstStronger ? first : second;
                Intent low = firstStronger ? second : first;
                LieAssessment assessment = trustRegistry.assess(high, low, threshold);
                if (assessment.potentialLie()) {
                    lies.add(new PotentialLie(low, List.of(high), Math.abs(assessment.trustDelta()),
                            Math.abs(assessment.weightedConfidenceDelta()), assessment.reason().orElse(null)));
                }
            }
        }
        return lies;
    }

    public List<RelationshipNode> generateContradictionGraph() {
        return generateContradictionGraph(true, true);
    }

    /**
     * Describes detected conflicts as {@code logical} relationships named {@code contradicts}.
     */
    public List<RelationshipNode> generateContradictionGraph(boolean includeSemanticConflicts, boolean includeLies) {
        List<RelationshipNode> graph = new ArrayList<>();
        int id = 1;
        if (includeSemanticConflicts) {
            for (SemanticConflict conflict : detectSemanticContradictions()) {
                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put("contradiction_type", conflict.conflictType().name().toLowerCase(Locale.ROOT));
                metadata.put("reason", conflict.reason());
                metadata.put("severity", conflict.severity().name().toLowerCase(Locale.ROOT));
                metadata.put("domain_knowledge", conflict.domain());
                graph.add(new RelationshipNode(RelationshipType.LOGICAL, "statement_" + id + "_a", "statement_" + id + "_b",
                        CONTRADICTS, List.of(conflict.first(), conflict.second()),
                        Optional.of(SEMANTIC_CONFLICT_CONFIDENCE), false, metadata));
                id++;
            }
        }
        if (includeLies) {
            for (PotentialLie lie : detectLying()) {
                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put("contradiction_type", "trust_conflict");
                metadata.put("reason", lie.reason());
                metadata.put("severity", ConflictSeverity.MAJOR.name().toLowerCase(Locale.ROOT));
                metadata.put("trust_delta", Double.toString(lie.trustDelta()));
                metadata.put("weighted_confidence_delta", Double.toString(lie.weightedConfidenceDelta()));
                metadata.put("likely_deception", "true");
                graph.add(new RelationshipNode(RelationshipType.LOGICAL, "lie_suspect_" + id, "contradicted_fact_" + id,
                        CONTRADICTS, lie.statement().statements(), Optional.of(LIE_CONFIDENCE), false, metadata));
                id++;
            }
        }
        return graph;
    }

    private boolean contradict(Intent first, Intent second) {
        for (Statement a : first.statements()) {
            for (Statement b : second.statements()) {
                if (a.subject().equals(b.subject())
                        && a.relation().name().equals(b.relation().name())
                        && !a.object().equals(b.object())) {
                    return true;
                }
                if (ontologyReasoner.detectSemanticConflict(a, b).isPresent()) {
                    return true;
                }
            }
        }
        return false;
    }

    private double weighted(Intent intent) {
        return trustRegistry.weightedConfidence(intent.confidence(), intent.metadata().provenance().origin());
    }

    private List<Statement> statements() {
        List<Statement> out = new ArrayList<>();
        for (LogicalNode node : kb.snapshot()) {
            if (node instanceof Intent intent) {
                out.addAll(intent.statements());
            }
        }
        return out;
    }
}
