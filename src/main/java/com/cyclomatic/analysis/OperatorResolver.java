package com.cyclomatic.analysis;

import com.cyclomatic.model.NodeKind;
import com.cyclomatic.model.SourceToken;
import com.cyclomatic.model.SyntaxNode;

import java.util.List;

/**
 * Recovers the operator symbol of a binary node from token positions alone.
 * <p>
 * The tokens of the left operand are a prefix of the tokens of the whole expression,
 * so the operator is the token right after that prefix.
 */
public class OperatorResolver {

    /**
     * @param operatorNode a {@link NodeKind#BINARY_OPERATOR} node
     * @return the spelling of the operator token, e.g. {@code "&&"}
     * @throws OperatorResolutionException if the node has no left operand or the token
     *         arithmetic falls outside the expression
     */
    public String resolve(final SyntaxNode operatorNode) throws OperatorResolutionException {
        final List<SourceToken> expressionTokens = operatorNode.tokens();
        final SyntaxNode leftOperand = operatorNode.firstChild()
                .orElseThrow(() -> new OperatorResolutionException("Binary operator at " + operatorNode.location() + " has no left operand"));

        final int leftTokenCount = leftOperand.tokens().size();
        if (leftTokenCount == 0) {
            throw new OperatorResolutionException("Left operand of binary operator at " + operatorNode.location() + " spans no tokens");
        }
        if (leftTokenCount >= expressionTokens.size()) {
            throw new OperatorResolutionException("Left operand of binary operator at " + operatorNode.location()
                    + " covers " + leftTokenCount + " of " + expressionTokens.size() + " tokens");
        }
        return expressionTokens.get(leftTokenCount).spelling();
    }
}
