package com.indentlint.plugins.java.indentation;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

/**
 * Shared plumbing for the construct handlers: position queries, the two acceptance modes
 * and violation reporting. The expected indentation is always passed in by the caller.
 */
abstract class ConstructHandler {
    protected final CheckSession session;
    protected final IndentationWalker walker;

    protected ConstructHandler(CheckSession session, IndentationWalker walker) {
        this.session = session;
        this.walker = walker;
    }

    protected int basic() {
        return session.config().basicOffset();
    }

    protected int wrap() {
        return session.config().lineWrappingIndentation();
    }

    protected boolean strict() {
        return session.config().forceStrictCondition();
    }

    protected int line(Node node) {
        return session.line(node);
    }

    protected int line(JavaToken token) {
        return session.line(token);
    }

    protected int lineStart(int line) {
        return session.lineStart(line);
    }

    protected int lineStart(Node node) {
        return session.lineStart(session.line(node));
    }

    protected int lineStart(JavaToken token) {
        return session.lineStart(session.line(token));
    }

    protected int column(Node node) {
        return session.column(node);
    }

    protected int column(JavaToken token) {
        return session.column(token);
    }

    protected boolean startsLine(Node node) {
        return session.startsLine(node);
    }

    protected boolean startsLine(JavaToken token) {
        return session.startsLine(token);
    }

    protected boolean exact(int actual, IndentLevel expected) {
        return expected.isAcceptable(actual);
    }

    /**
     * "At least the minimum" unless forceStrictCondition is on.
     */
    protected boolean lenient(int actual, IndentLevel expected) {
        return expected.isAcceptable(actual, strict());
    }

    protected void error(Node node, String element, int actual, IndentLevel expected) {
        session.emitter().error(Syntax.begin(node), element, actual, expected);
    }

    protected void error(JavaToken token, String element, int actual, IndentLevel expected) {
        session.emitter().error(Syntax.begin(token), element, actual, expected);
    }

    protected void error(Position position, String element, int actual, IndentLevel expected) {
        session.emitter().error(position, element, actual, expected);
    }

    protected void childError(Node node, String element, int actual, IndentLevel expected) {
        session.emitter().childError(Syntax.begin(node), element, actual, expected);
    }

    protected void childError(JavaToken token, String element, int actual, IndentLevel expected) {
        session.emitter().childError(Syntax.begin(token), element, actual, expected);
    }

    protected void childError(Position position, String element, int actual, IndentLevel expected) {
        session.emitter().childError(position, element, actual, expected);
    }

    /**
     * Own-token check: when {@code node} starts its line, the line must sit exactly on one of
     * the expected columns.
     */
    protected boolean checkStart(Node node, String element, IndentLevel expected) {
        if (startsLine(node)) {
            int actual = lineStart(node);
            if (!exact(actual, expected)) {
                error(node, element, actual, expected);
                return false;
            }
        }
        return true;
    }

    protected boolean checkChildStart(Node node, String element, IndentLevel expected) {
        if (startsLine(node)) {
            int actual = lineStart(node);
            if (!exact(actual, expected)) {
                childError(node, element, actual, expected);
                return false;
            }
        }
        return true;
    }

    protected boolean checkStart(JavaToken token, String element, IndentLevel expected) {
        if (startsLine(token)) {
            int actual = lineStart(token);
            if (!exact(actual, expected)) {
                error(token, element, actual, expected);
                return false;
            }
        }
        return true;
    }

    /**
     * Continuation check: {@code node} is only looked at when it starts a line after
     * {@code baseLine}, and then only needs to reach the floor.
     */
    protected void checkContinuation(Node node, int baseLine, String element, IndentLevel expected) {
        if (line(node) > baseLine && startsLine(node)) {
            int actual = lineStart(node);
            if (!lenient(actual, expected)) {
                error(node, element, actual, expected);
            }
        }
    }

    protected void checkContinuation(JavaToken token, int baseLine, String element, IndentLevel expected) {
        if (line(token) > baseLine && startsLine(token)) {
            int actual = lineStart(token);
            if (!lenient(actual, expected)) {
                error(token, element, actual, expected);
            }
        }
    }

    protected void checkChildContinuation(Node node, int baseLine, String element, IndentLevel expected) {
        if (line(node) > baseLine && startsLine(node)) {
            int actual = lineStart(node);
            if (!lenient(actual, expected)) {
                childError(node, element, actual, expected);
            }
        }
    }

    protected void checkChildContinuation(JavaToken token, int baseLine, String element, IndentLevel expected) {
        if (line(token) > baseLine && startsLine(token)) {
            int actual = lineStart(token);
            if (!lenient(actual, expected)) {
                childError(token, element, actual, expected);
            }
        }
    }

    /**
     * Braces that start their line sit on the owner's indent, optionally shifted by
     * braceAdjustment. With {@code strictAdjust} a non-zero adjustment replaces the base level.
     */
    protected void checkBraces(JavaToken lcurly, JavaToken rcurly, IndentLevel indent, boolean strictAdjust) {
        int adjustment = session.config().braceAdjustment();
        IndentLevel adjusted = indent.withOffset(adjustment);
        boolean adjustedOnly = strictAdjust && adjustment != 0;
        IndentLevel acceptable = adjustedOnly ? adjusted : indent.combine(adjusted);
        IndentLevel reported = adjustedOnly ? adjusted : indent;
        _checkBrace(lcurly, "block lcurly", acceptable, reported);
        _checkBrace(rcurly, "block rcurly", acceptable, reported);
    }

    private void _checkBrace(JavaToken brace, String element, IndentLevel acceptable, IndentLevel reported) {
        if (startsLine(brace)) {
            int actual = column(brace);
            if (!exact(actual, acceptable)) {
                error(brace, element, actual, reported);
            }
        }
    }
}
