package com.cyclomatic.connectors;

import com.cyclomatic.model.NodeKind;
import com.cyclomatic.model.SourceLocation;
import com.cyclomatic.model.SourceToken;
import com.cyclomatic.model.SyntaxNode;
import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * {@link SyntaxNode} view over a JavaParser {@link Node}.
 */
final class JavaParserNode implements SyntaxNode {

    private static final Position NO_POSITION = new Position(0, 0);
    private static final Comparator<Node> BY_BEGIN = Comparator.comparing(node -> node.getBegin().orElse(NO_POSITION));

    private final Node node;
    private final NodeKind kind;
    // Columns the parsed text was shifted right by on its first line.
    private final int firstLineColumnOffset;

    JavaParserNode(final Node node) {
        this(node, 0);
    }

    JavaParserNode(final Node node, final int firstLineColumnOffset) {
        this.node = node;
        this.kind = kindOf(node);
        this.firstLineColumnOffset = firstLineColumnOffset;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public SourceLocation location() {
        final Node anchor = node instanceof NodeWithSimpleName ? ((NodeWithSimpleName<?>) node).getName() : node;
        return anchor.getBegin()
                .or(node::getBegin)
                .map(this::toSourceLocation)
                .orElse(SourceLocation.UNKNOWN);
    }

    private SourceLocation toSourceLocation(final Position position) {
        if (position.line != 1 || firstLineColumnOffset == 0) {
            return new SourceLocation(position.line, position.column);
        }
        final int column = position.column - firstLineColumnOffset;
        // Nodes starting inside the synthetic wrapper header have no place in the original text
        return column < 1 ? SourceLocation.UNKNOWN : new SourceLocation(1, column);
    }

    @Override
    public String spelling() {
        return node instanceof NodeWithSimpleName ? ((NodeWithSimpleName<?>) node).getNameAsString() : "";
    }

    @Override
    public List<SyntaxNode> children() {
        final List<Node> ordered = new ArrayList<>();
        for (final Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                ordered.add(child);
            }
        }
        ordered.sort(BY_BEGIN);

        final List<SyntaxNode> children = new ArrayList<>(ordered.size());
        for (final Node child : ordered) {
            children.add(new JavaParserNode(child, firstLineColumnOffset));
        }
        return children;
    }

    @Override
    public List<SourceToken> tokens() {
        final Optional<TokenRange> range = node.getTokenRange();
        if (range.isEmpty()) {
            return Collections.emptyList();
        }
        final List<SourceToken> tokens = new ArrayList<>();
        for (final JavaToken token : range.get()) {
            if (!token.getCategory().isWhitespaceOrComment()) {
                tokens.add(new SourceToken(token.getText()));
            }
        }
        return tokens;
    }

    @Override
    public String toString() {
        return kind + "@" + location();
    }

    static NodeKind kindOf(final Node node) {
        if (node instanceof MethodDeclaration || node instanceof ConstructorDeclaration
                || node instanceof CompactConstructorDeclaration) return NodeKind.FUNCTION_DEFINITION;
        if (node instanceof IfStmt) return NodeKind.IF_STATEMENT;
        if (node instanceof ForStmt || node instanceof ForEachStmt) return NodeKind.FOR_STATEMENT;
        if (node instanceof WhileStmt) return NodeKind.WHILE_STATEMENT;
        if (node instanceof DoStmt) return NodeKind.DO_STATEMENT;
        if (node instanceof SwitchEntry) {
            return ((SwitchEntry) node).getLabels().isEmpty() ? NodeKind.DEFAULT_BRANCH : NodeKind.CASE_BRANCH;
        }
        if (node instanceof SwitchStmt || node instanceof SwitchExpr) return NodeKind.SWITCH;
        if (node instanceof ConditionalExpr) return NodeKind.CONDITIONAL_EXPRESSION;
        if (node instanceof BinaryExpr || node instanceof AssignExpr) return NodeKind.BINARY_OPERATOR;
        if (node instanceof UnaryExpr) return NodeKind.UNARY_OPERATOR;
        if (node instanceof LambdaExpr) return NodeKind.LAMBDA_EXPRESSION;
        if (node instanceof CatchClause) return NodeKind.CATCH_CLAUSE;
        if (node instanceof TypeDeclaration) return NodeKind.TYPE_DECLARATION;
        if (node instanceof CompilationUnit) return NodeKind.TRANSLATION_UNIT;
        return NodeKind.OTHER;
    }
}
