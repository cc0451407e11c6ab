package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.RecordPatternExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TypePatternExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;

/**
 * switch statements and expressions, both the colon form and the arrow form.
 */
final class SwitchHandler extends ConstructHandler {

    SwitchHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkSwitch(SwitchStmt statement, IndentLevel indent) {
        _checkSwitch(statement, statement.getSelector(), statement.getEntries(), indent);
    }

    /**
     * A switch expression assigned in an expression statement is itself a continuation.
     */
    void checkSwitchExpression(SwitchExpr expression, IndentLevel indent) {
        IndentLevel effective = indent;
        Optional<Node> parent = Syntax.parent(expression);
        if (parent.isPresent() && parent.get() instanceof AssignExpr
                && parent.get().getParentNode().filter(p -> p instanceof ExpressionStmt).isPresent()) {
            effective = indent.withOffset(wrap());
        }
        _checkSwitch(expression, expression.getSelector(), expression.getEntries(), effective);
    }

    private void _checkSwitch(Node node, Expression selector, NodeList<SwitchEntry> entries, IndentLevel indent) {
        IndentLevel wrapped = indent.withOffset(wrap());
        IndentLevel acceptable = indent.combine(wrapped);
        int switchLine = line(node);

        boolean valid = true;
        if (startsLine(node)) {
            int actual = lineStart(switchLine);
            if (!exact(actual, acceptable)) {
                error(node, "switch", actual, wrapped);
                valid = false;
            }
        }
        checkChildContinuation(selector, switchLine, "switch", wrapped);

        IndentLevel bodyBase = valid ? IndentLevel.of(lineStart(switchLine)) : indent;
        _checkBody(node, selector, entries, bodyBase);
    }

    /**
     * A switch expression nested as the body of an arrow case.
     */
    private void _checkNestedSwitch(SwitchExpr expression, IndentLevel expected) {
        int switchLine = line(expression);
        boolean valid = true;
        if (startsLine(expression)) {
            int actual = lineStart(switchLine);
            if (!exact(actual, expected)) {
                error(expression, "switch", actual, expected);
                valid = false;
            }
        }
        IndentLevel bodyBase = valid ? IndentLevel.of(lineStart(switchLine)) : expected;
        _checkBody(expression, expression.getSelector(), expression.getEntries(), bodyBase);
    }

    private void _checkBody(Node node, Expression selector, NodeList<SwitchEntry> entries, IndentLevel parentIndent) {
        Optional<JavaToken> lcurly = Syntax.tokenAfter(selector).flatMap(Syntax::nextSignificant);
        if (lcurly.isPresent() && lcurly.get().getText().equals("{")) {
            checkBraces(lcurly.get(), Syntax.lastToken(node), parentIndent, false);
        }

        IndentLevel caseIndent = parentIndent.withOffset(session.config().caseIndent());
        IndentLevel bodyIndent = caseIndent.withOffset(basic());
        for (SwitchEntry entry : entries) {
            if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                _checkGroup(entry, caseIndent, bodyIndent);
            } else {
                _checkRule(entry, caseIndent);
            }
        }
    }

    private void _checkGroup(SwitchEntry entry, IndentLevel caseIndent, IndentLevel bodyIndent) {
        JavaToken first = Syntax.firstToken(entry);
        int caseLine = line(first);
        if (startsLine(first) || _onlyCommentsBefore(first)) {
            int actual = column(first);
            if (!exact(actual, caseIndent)) {
                error(first, "case", actual, caseIndent);
            }
        }

        IndentLevel labelIndent = caseIndent.withOffset(wrap());
        for (Node label : _labelsAndGuard(entry)) {
            checkChildContinuation(label, caseLine, "case", labelIndent);
        }

        for (Statement statement : entry.getStatements()) {
            if (statement instanceof BlockStmt) {
                walker.blocks().checkCaseBlock((BlockStmt) statement, caseIndent);
            } else {
                walker.checkStatement(statement, bodyIndent);
            }
        }
    }

    private boolean _onlyCommentsBefore(JavaToken token) {
        int tokenLine = line(token);
        Optional<JavaToken> previous = token.getPreviousToken();
        while (previous.isPresent() && line(previous.get()) == tokenLine) {
            JavaToken candidate = previous.get();
            if (!candidate.getCategory().isWhitespaceOrComment()) {
                return false;
            }
            previous = candidate.getPreviousToken();
        }
        return true;
    }

    private static List<Node> _labelsAndGuard(SwitchEntry entry) {
        List<Node> nodes = new ArrayList<>(entry.getLabels());
        entry.getGuard().ifPresent(nodes::add);
        return nodes;
    }

    private void _checkRule(SwitchEntry entry, IndentLevel caseIndent) {
        JavaToken first = Syntax.firstToken(entry);
        int caseLine = line(first);
        checkStart(first, "case", caseIndent);

        IndentLevel contIndent = caseIndent.withOffset(wrap());
        _checkLabelPatterns(entry, caseIndent, caseLine);

        if (entry.getStatements().isEmpty()) {
            return;
        }
        Statement body = entry.getStatements().get(0);
        Optional<JavaToken> arrow = Syntax.tokenBefore(body);
        boolean arrowOnContinuation = arrow.isPresent() && line(arrow.get()) > caseLine && startsLine(arrow.get());
        IndentLevel bodyContIndent = arrowOnContinuation ? contIndent.withOffset(wrap()) : caseIndent.withOffset(basic());
        arrow.ifPresent(token -> checkContinuation(token, caseLine, "lambda", contIndent));

        if (body instanceof BlockStmt) {
            walker.blocks().checkBlock((BlockStmt) body, caseIndent);
        } else if (body instanceof ExpressionStmt || body instanceof ThrowStmt) {
            checkChildContinuation(body, caseLine, "case", bodyContIndent);
            if (body instanceof ExpressionStmt) {
                Expression value = ((ExpressionStmt) body).getExpression();
                if (value instanceof SwitchExpr) {
                    _checkNestedSwitch((SwitchExpr) value, contIndent);
                }
            }
        }
    }

    /**
     * Deconstruction patterns get their own alignment rules; other labels only must not fall
     * behind the case.
     */
    private void _checkLabelPatterns(SwitchEntry entry, IndentLevel caseIndent, int caseLine) {
        IndentLevel patternIndent = caseIndent.withOffset(wrap());
        int minimum = caseIndent.firstLevel();
        for (Expression label : entry.getLabels()) {
            if ((label instanceof RecordPatternExpr || label instanceof TypePatternExpr) && line(label) == caseLine) {
                walker.expressions().checkPattern(label, patternIndent, caseLine);
            } else if (startsLine(label)) {
                _checkNotBehind(label, minimum, caseIndent);
            }
        }

        if (entry.getGuard().isPresent()) {
            Expression guard = entry.getGuard().get();
            Optional<JavaToken> when = Syntax.tokenBefore(guard);
            int whenLine = when.map(this::line).orElse(caseLine);
            if (when.isPresent() && whenLine > caseLine && startsLine(when.get())) {
                int actual = lineStart(whenLine);
                if (actual < minimum) {
                    childError(when.get(), "case", actual, caseIndent);
                }
            }
            if (line(guard) > whenLine && startsLine(guard)) {
                _checkNotBehind(guard, minimum, caseIndent);
            }
        }
    }

    private void _checkNotBehind(Node node, int minimum, IndentLevel caseIndent) {
        int actual = lineStart(node);
        if (actual < minimum) {
            childError(node, "case", actual, caseIndent);
        }
    }
}
