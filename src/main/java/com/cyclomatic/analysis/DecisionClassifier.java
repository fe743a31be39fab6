package com.cyclomatic.analysis;

import com.cyclomatic.model.DecisionTally;
import com.cyclomatic.model.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how much a single node adds to the enclosing function's tally.
 * Branches, loops, switch arms and ternaries always count; a binary operator counts
 * only when it is a short-circuit {@code &&} or {@code ||}.
 */
public class DecisionClassifier {
    private static final Logger log = LoggerFactory.getLogger(DecisionClassifier.class);

    private static final String LOGICAL_AND = "&&";
    private static final String LOGICAL_OR = "||";

    private final OperatorResolver operatorResolver;

    public DecisionClassifier() {
        this(new OperatorResolver());
    }

    public DecisionClassifier(final OperatorResolver operatorResolver) {
        this.operatorResolver = operatorResolver;
    }

    public DecisionTally classify(final SyntaxNode node) {
        switch (node.kind()) {
            case IF_STATEMENT:
            case FOR_STATEMENT:
            case WHILE_STATEMENT:
            case DEFAULT_BRANCH:
            case CASE_BRANCH:
            case CONDITIONAL_EXPRESSION:
                return DecisionTally.DECISION_POINT;
            case BINARY_OPERATOR:
                return isShortCircuit(node) ? DecisionTally.DECISION_POINT : DecisionTally.EMPTY;
            default:
                return DecisionTally.EMPTY;
        }
    }

    private boolean isShortCircuit(final SyntaxNode node) {
        try {
            final String operator = operatorResolver.resolve(node);
            return LOGICAL_AND.equals(operator) || LOGICAL_OR.equals(operator);
        } catch (final OperatorResolutionException e) {
            log.warn("Not counting binary operator: {}", e.getMessage());
            return false;
        }
    }
}
