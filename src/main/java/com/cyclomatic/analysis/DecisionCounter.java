package com.cyclomatic.analysis;

import com.cyclomatic.model.DecisionTally;
import com.cyclomatic.model.SyntaxNode;

/**
 * Folds {@link DecisionClassifier} contributions over a whole subtree, depth-first and
 * pre-order. Decision points nested in other decision points are counted too.
 */
public class DecisionCounter {

    private final DecisionClassifier classifier;

    public DecisionCounter() {
        this(new DecisionClassifier());
    }

    public DecisionCounter(final DecisionClassifier classifier) {
        this.classifier = classifier;
    }

    public DecisionTally count(final SyntaxNode node) {
        DecisionTally tally = classifier.classify(node);
        for (final SyntaxNode child : node.children()) {
            tally = tally.plus(count(child));
        }
        return tally;
    }
}
