package com.cyclomatic.analysis;

import com.cyclomatic.model.DecisionTally;
import com.cyclomatic.model.SyntaxNode;

/**
 * Cyclomatic complexity of a function as {@code M = E - N + 2}, where the function body
 * itself is one extra node on top of the counted decision points.
 */
public class ComplexityCalculator {

    private static final int ENTRY_NODES = 1;
    private static final int CONNECTED_COMPONENT_TERM = 2;

    private final DecisionCounter decisionCounter;

    public ComplexityCalculator() {
        this(new DecisionCounter());
    }

    public ComplexityCalculator(final DecisionCounter decisionCounter) {
        this.decisionCounter = decisionCounter;
    }

    public int calculate(final SyntaxNode function) {
        return fromTally(decisionCounter.count(function));
    }

    public static int fromTally(final DecisionTally tally) {
        final int edges = tally.edges();
        final int nodes = tally.nodes() + ENTRY_NODES;
        return edges - nodes + CONNECTED_COMPONENT_TERM;
    }
}
