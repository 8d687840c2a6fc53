package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.*;

import java.util.*;
import java.util.function.Function;

/**
 * The propositional rules applied in every forward chaining round, in this order:
 * modus ponens, modus tollens, hypothetical syllogism, disjunctive syllogism, conjunction
 * introduction and conjunction elimination. All rules read the knowledge base as it stood
 * when the round began; their conclusions are added once every rule has run. Disjunction
 * introduction is not applied.
 */
final class StandardInferenceRules {

    static final String MODUS_PONENS = "modus-ponens";
    static final String MODUS_TOLLENS = "modus-tollens";
    static final String HYPOTHETICAL_SYLLOGISM = "hypothetical-syllogism";
    static final String DISJUNCTIVE_SYLLOGISM = "disjunctive-syllogism";
    static final String CONJUNCTION_INTRODUCTION = "conjunction-introduction";
    static final String CONJUNCTION_ELIMINATION = "conjunction-elimination";

    private final int conjunctionCap;
    private final List<Function<List<LogicalNode>, List<Derivation>>> ordered;

    StandardInferenceRules(int conjunctionCap) {
        if (conjunctionCap < 0) {
            throw new IllegalArgumentException("conjunctionCap must be >= 0, was " + conjunctionCap);
        }
        this.conjunctionCap = conjunctionCap;
        this.ordered = List.of(
                this::modusPonens,
                this::modusTollens,
                this::hypotheticalSyllogism,
                this::disjunctiveSyllogism,
                this::conjunctionIntroduction,
                this::conjunctionElimination);
    }

    /**
     * Runs every rule once over a single snapshot of {@code kb}, then adds the novel
     * conclusions in rule order.
     *
     * @return the derivations whose conclusions were new
     */
    List<Derivation> applyAll(KnowledgeBase kb) {
        List<LogicalNode> facts = kb.snapshot();
        List<Derivation> derived = new ArrayList<>();
        for (Function<List<LogicalNode>, List<Derivation>> rule : ordered) {
            derived.addAll(rule.apply(facts));
        }
        List<Derivation> added = new ArrayList<>();
        for (Derivation d : derived) {
            if (kb.add(d.conclusion())) {
                added.add(d);
            }
        }
        return added;
    }

    // A, A -> B |- B
    List<Derivation> modusPonens(List<LogicalNode> facts) {
        Set<LogicalNode> known = new HashSet<>(facts);
        List<Derivation> out = new ArrayList<>();
        for (LogicalExpression impl : connectives(facts, LogicalOperator.IMPLIES)) {
            if (known.contains(impl.left())) {
                out.add(new Derivation(MODUS_PONENS, impl.right(), List.of(impl.left(), impl)));
            }
        }
        return out;
    }

    // not B, A -> B |- not A
    List<Derivation> modusTollens(List<LogicalNode> facts) {
        List<Derivation> out = new ArrayList<>();
        List<LogicalExpression> negations = connectives(facts, LogicalOperator.NOT);
        for (LogicalExpression impl : connectives(facts, LogicalOperator.IMPLIES)) {
            for (LogicalExpression neg : negations) {
                if (neg.left().equals(impl.right())) {
                    out.add(new Derivation(MODUS_TOLLENS, LogicalExpression.not(impl.left()), List.of(neg, impl)));
                }
            }
        }
        return out;
    }

    // A -> B, B -> C |- A -> C
    List<Derivation> hypotheticalSyllogism(List<LogicalNode> facts) {
        List<Derivation> out = new ArrayList<>();
        List<LogicalExpression> implications = connectives(facts, LogicalOperator.IMPLIES);
        for (LogicalExpression first : implications) {
            for (LogicalExpression second : implications) {
                if (first.right().equals(second.left())) {
                    out.add(new Derivation(HYPOTHETICAL_SYLLOGISM,
                            LogicalExpression.implies(first.left(), second.right()), List.of(first, second)));
                }
            }
        }
        return out;
    }

    // A or B, not A |- B  and  A or B, not B |- A
    List<Derivation> disjunctiveSyllogism(List<LogicalNode> facts) {
        List<Derivation> out = new ArrayList<>();
        List<LogicalExpression> negations = connectives(facts, LogicalOperator.NOT);
        for (LogicalExpression disjunction : connectives(facts, LogicalOperator.OR)) {
            for (LogicalExpression neg : negations) {
                if (neg.left().equals(disjunction.left())) {
                    out.add(new Derivation(DISJUNCTIVE_SYLLOGISM, disjunction.right(), List.of(disjunction, neg)));
                }
                if (neg.left().equals(disjunction.right())) {
                    out.add(new Derivation(DISJUNCTIVE_SYLLOGISM, disjunction.left(), List.of(disjunction, neg)));
                }
            }
        }
        return out;
    }

    // A, B |- A and B, pairs among the first intents only
    List<Derivation> conjunctionIntroduction(List<LogicalNode> facts) {
        List<Intent> intents = new ArrayList<>();
        for (LogicalNode fact : facts) {
            if (intents.size() >= conjunctionCap) break;
            if (fact instanceof Intent intent) {
                intents.add(intent);
            }
        }
        List<Derivation> out = new ArrayList<>();
        for (int i = 0; i < intents.size(); i++) {
            for (int j = i + 1; j < intents.size(); j++) {
                out.add(new Derivation(CONJUNCTION_INTRODUCTION,
                        LogicalExpression.and(intents.get(i), intents.get(j)), List.of(intents.get(i), intents.get(j))));
            }
        }
        return out;
    }

    // A and B |- A, B
    List<Derivation> conjunctionElimination(List<LogicalNode> facts) {
        List<Derivation> out = new ArrayList<>();
        for (LogicalExpression conjunction : connectives(facts, LogicalOperator.AND)) {
            out.add(new Derivation(CONJUNCTION_ELIMINATION, conjunction.left(), List.of(conjunction)));
            out.add(new Derivation(CONJUNCTION_ELIMINATION, conjunction.right(), List.of(conjunction)));
        }
        return out;
    }

    private static List<LogicalExpression> connectives(List<LogicalNode> facts, LogicalOperator operator) {
        List<LogicalExpression> out = new ArrayList<>();
        for (LogicalNode fact : facts) {
            if (fact instanceof LogicalExpression e && e.is(operator)) {
                out.add(e);
            }
        }
        return out;
    }
}
