package com.cyclomatic.analysis;

import com.cyclomatic.model.NodeKind;
import com.cyclomatic.model.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds function definitions at any depth, in pre-order.
 * The search continues below a function, so methods of local and anonymous classes
 * are found after their enclosing method.
 */
public class FunctionLocator {

    public List<SyntaxNode> findFunctions(final SyntaxNode root) {
        final List<SyntaxNode> functions = new ArrayList<>();
        collect(root, functions);
        return functions;
    }

    private void collect(final SyntaxNode node, final List<SyntaxNode> functions) {
        if (node.kind() == NodeKind.FUNCTION_DEFINITION) {
            functions.add(node);
        }
        for (final SyntaxNode child : node.children()) {
            collect(child, functions);
        }
    }
}
