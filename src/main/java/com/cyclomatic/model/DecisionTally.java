package com.cyclomatic.model;

/**
 * Edge and node counts accumulated over one function's subtree.
 */
public record DecisionTally(int edges, int nodes) {

    public static final DecisionTally EMPTY = new DecisionTally(0, 0);

    /** Contribution of a single decision point: two outgoing edges, one branching node. */
    public static final DecisionTally DECISION_POINT = new DecisionTally(2, 1);

    public DecisionTally plus(final DecisionTally other) {
        return new DecisionTally(edges + other.edges, nodes + other.nodes);
    }
}
