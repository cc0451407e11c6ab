package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.TryStmt;

/**
 * Navigation helpers over JavaParser nodes and their token stream.
 */
final class Syntax {
    private static final Position HOME = new Position(1, 1);

    private Syntax() {
    }

    static Position begin(Node node) {
        Optional<Position> begin = node.getBegin();
        if (begin.isPresent()) {
            return begin.get();
        }
        return node.getParentNode().map(Syntax::begin).orElse(HOME);
    }

    static Position begin(JavaToken token) {
        return token.getRange().map(range -> range.begin).orElse(HOME);
    }

    static JavaToken firstToken(Node node) {
        return node.getTokenRange()
                .orElseThrow(() -> new IllegalStateException("No tokens kept for " + node.getClass().getSimpleName()))
                .getBegin();
    }

    static JavaToken lastToken(Node node) {
        return node.getTokenRange()
                .orElseThrow(() -> new IllegalStateException("No tokens kept for " + node.getClass().getSimpleName()))
                .getEnd();
    }

    static boolean isSignificant(JavaToken token) {
        return !token.getCategory().isWhitespaceOrComment();
    }

    static Optional<JavaToken> nextSignificant(JavaToken token) {
        Optional<JavaToken> next = token.getNextToken();
        while (next.isPresent() && !isSignificant(next.get())) {
            next = next.get().getNextToken();
        }
        return next;
    }

    static Optional<JavaToken> previousSignificant(JavaToken token) {
        Optional<JavaToken> previous = token.getPreviousToken();
        while (previous.isPresent() && !isSignificant(previous.get())) {
            previous = previous.get().getPreviousToken();
        }
        return previous;
    }

    static Optional<JavaToken> tokenAfter(Node node) {
        return nextSignificant(lastToken(node));
    }

    static Optional<JavaToken> tokenBefore(Node node) {
        return previousSignificant(firstToken(node));
    }

    /**
     * First significant token with the given text between {@code from} (inclusive) and the end
     * of {@code within}, skipping nested brackets.
     */
    static Optional<JavaToken> findAtDepth(JavaToken from, Node within, String text) {
        Position limit = lastToken(within).getRange().map(range -> range.end).orElse(null);
        int depth = 0;
        Optional<JavaToken> current = Optional.of(from);
        while (current.isPresent()) {
            JavaToken token = current.get();
            if (limit != null && token.getRange().isPresent() && token.getRange().get().begin.isAfter(limit)) {
                break;
            }
            if (isSignificant(token)) {
                String t = token.getText();
                if (depth == 0 && t.equals(text)) {
                    return current;
                }
                if (t.equals("(") || t.equals("[") || t.equals("{")) {
                    depth++;
                } else if (t.equals(")") || t.equals("]") || t.equals("}")) {
                    depth--;
                }
            }
            current = token.getNextToken();
        }
        return Optional.empty();
    }

    /**
     * Structural children in source order; comments are left out.
     */
    static List<Node> children(Node node) {
        List<Node> result = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                result.add(child);
            }
        }
        result.sort(Comparator.comparingInt((Node n) -> begin(n).line).thenComparingInt(n -> begin(n).column));
        return result;
    }

    /**
     * Parent node, looking through the statement wrapper JavaParser puts around an expression
     * lambda body.
     */
    static Optional<Node> parent(Node node) {
        Optional<Node> parent = node.getParentNode();
        if (parent.isPresent() && isLambdaExpressionBody(parent.get())) {
            return parent.get().getParentNode();
        }
        return parent;
    }

    static boolean isLambdaExpressionBody(Node node) {
        return node instanceof ExpressionStmt
                && node.getParentNode().filter(p -> p instanceof LambdaExpr).isPresent();
    }

    /**
     * Whether {@code child} sits in the argument list of {@code parent}.
     */
    static boolean isCallArgument(Node child, Node parent) {
        NodeList<Expression> arguments = arguments(parent);
        return arguments != null && containsIdentity(arguments, child);
    }

    static NodeList<Expression> arguments(Node node) {
        if (node instanceof MethodCallExpr) {
            return ((MethodCallExpr) node).getArguments();
        } else if (node instanceof ObjectCreationExpr) {
            return ((ObjectCreationExpr) node).getArguments();
        } else if (node instanceof ExplicitConstructorInvocationStmt) {
            return ((ExplicitConstructorInvocationStmt) node).getArguments();
        } else if (node instanceof EnumConstantDeclaration) {
            return ((EnumConstantDeclaration) node).getArguments();
        }
        return null;
    }

    static boolean isTryResource(Node node) {
        Optional<Node> parent = node.getParentNode();
        return parent.isPresent() && parent.get() instanceof TryStmt
                && containsIdentity(((TryStmt) parent.get()).getResources(), node);
    }

    static boolean containsIdentity(List<? extends Node> nodes, Node node) {
        for (Node candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }

    static boolean isSameNode(Optional<? extends Node> candidate, Node node) {
        return candidate.isPresent() && candidate.get() == node;
    }
}
