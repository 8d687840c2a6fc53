package com.e2eq.aiql.inference;

import com.e2eq.aiql.ast.LogicalNode;
import com.e2eq.aiql.ast.RuleDefinition;

import java.util.*;

/**
 * Ordered, duplicate-free store of facts with a structural index and the rules found among
 * them. Not thread-safe; an engine owns its knowledge base exclusively.
 */
public final class KnowledgeBase {

    private final List<LogicalNode> facts = new ArrayList<>();
    private final Set<LogicalNode> index = new HashSet<>();
    private final List<RuleDefinition> rules = new ArrayList<>();

    public KnowledgeBase() {
    }

    public KnowledgeBase(Collection<? extends LogicalNode> initial) {
        Objects.requireNonNull(initial, "initial");
        initial.forEach(this::add);
    }

    /**
     * Appends {@code node} unless a structurally equal node is already present.
     *
     * @return {@code true} if the node was added
     */
    public boolean add(LogicalNode node) {
        Objects.requireNonNull(node, "node");
        if (!index.add(node)) {
            return false;
        }
        facts.add(node);
        if (node instanceof RuleDefinition rule) {
            rules.add(rule);
        }
        return true;
    }

    public boolean contains(LogicalNode node) {
        return node != null && index.contains(node);
    }

    public int size() {
        return facts.size();
    }

    public List<LogicalNode> snapshot() {
        return List.copyOf(facts);
    }

    public List<RuleDefinition> rules() {
        return List.copyOf(rules);
    }

    /**
     * Temporarily adds {@code node} for the lifetime of the returned guard. Closing the guard
     * removes everything appended since it was opened, so the store returns to its prior
     * contents even when the scoped work throws.
     */
    public Assumption assume(LogicalNode node) {
        int mark = facts.size();
        add(node);
        return new Assumption(mark);
    }

    private void truncate(int mark) {
        while (facts.size() > mark) {
            LogicalNode removed = facts.remove(facts.size() - 1);
            index.remove(removed);
            if (removed instanceof RuleDefinition rule) {
                rules.remove(rule);
            }
        }
    }

    public final class Assumption implements AutoCloseable {
        private final int mark;
        private boolean closed;

        private Assumption(int mark) {
            this.mark = mark;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                truncate(mark);
            }
        }
    }
}
