package com.cyclomatic.model;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a parsed unit.
 * The view is only valid while the owning {@link SyntaxTree} is alive and never exposes
 * the operator of a binary node directly; callers recover it from {@link #tokens()}.
 */
public interface SyntaxNode {

    NodeKind kind();

    SourceLocation location();

    /**
     * @return the identifier of a named declaration, or an empty string
     */
    String spelling();

    /**
     * @return children in source order
     */
    List<SyntaxNode> children();

    default Optional<SyntaxNode> firstChild() {
        final List<SyntaxNode> children = children();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * Tokenizes the full source extent of this node, whitespace and comments excluded.
     *
     * @return tokens in source order
     */
    List<SourceToken> tokens();
}
