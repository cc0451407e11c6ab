package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;

/**
 * Lambda arrows and bodies. The lambda's actual line start is usually accepted next to the
 * expected level, since lambdas show up in many wrapped positions.
 */
final class LambdaHandler extends ConstructHandler {

    LambdaHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkLambda(LambdaExpr lambda, IndentLevel indent) {
        int lambdaLine = line(lambda);
        int lambdaStart = lineStart(lambdaLine);
        IndentLevel lambdaIndent = IndentLevel.of(lambdaStart);
        boolean atWrongPosition = !lenient(lambdaStart, indent);
        boolean lambdaStartsLine = startsLine(lambda);

        Node body = lambda.getBody() instanceof BlockStmt
                ? lambda.getBody()
                : lambda.getExpressionBody().map(expression -> (Node) expression).orElse(lambda.getBody());

        _checkArrow(lambda, body, lambdaLine, lambdaStart, lambdaIndent, indent);

        if (body instanceof BlockStmt) {
            BlockStmt block = (BlockStmt) body;
            IndentLevel blockIndent = _blockIndent(lambda, block, lambdaLine, lambdaStart, lambdaIndent,
                    atWrongPosition, indent);
            walker.blocks().checkBlock(block, blockIndent);
            return;
        }

        boolean useExpected = atWrongPosition && lambdaStartsLine;
        if (startsLine(body)) {
            int actual = lineStart(body);
            if (actual < Math.min(lambdaStart, indent.firstLevel())) {
                childError(body, "lambda", actual, indent.withOffset(wrap()));
            }
            walker.checkExpression(body, strict() || useExpected ? indent : lambdaIndent);
        } else {
            walker.checkExpression(body, useExpected ? indent : lambdaIndent);
        }
    }

    /**
     * Inside an argument list a wrapped arrow only has to reach the lambda; elsewhere it
     * must sit on one of the known levels.
     */
    private void _checkArrow(LambdaExpr lambda, Node body, int lambdaLine, int lambdaStart,
                             IndentLevel lambdaIndent, IndentLevel indent) {
        Optional<JavaToken> arrow = Syntax.tokenBefore(body);
        if (arrow.isEmpty() || !arrow.get().getText().equals("->")) {
            return;
        }
        JavaToken token = arrow.get();
        if (line(token) <= lambdaLine || !startsLine(token)) {
            return;
        }

        IndentLevel arrowExpected = strict() ? indent : lambdaIndent.combine(indent);
        IndentLevel withWrap = strict()
                ? arrowExpected
                : arrowExpected.addAcceptable(indent.firstLevel() + wrap(), lambdaStart + wrap());
        boolean inArgumentList = Syntax.parent(lambda).map(p -> Syntax.isCallArgument(lambda, p)).orElse(false);

        int actual = lineStart(token);
        boolean accepted = inArgumentList ? lenient(actual, arrowExpected) : exact(actual, withWrap);
        if (!accepted) {
            error(token, "->", actual, indent);
        }
    }

    private IndentLevel _blockIndent(LambdaExpr lambda, BlockStmt block, int lambdaLine, int lambdaStart,
                                     IndentLevel lambdaIndent, boolean atWrongPosition, IndentLevel indent) {
        int chainNesting = _callArgumentNesting(lambda);
        if (chainNesting > 0) {
            IndentLevel combined = lambdaIndent.combine(indent).addAcceptable(lambdaStart + wrap());
            for (int level = 2; level <= chainNesting; level++) {
                combined = combined.addAcceptable(lambdaStart + level * wrap());
            }
            return combined;
        }

        JavaToken lcurly = Syntax.firstToken(block);
        if (line(lcurly) > lambdaLine && lambdaStart <= indent.firstLevel()) {
            return lambdaIndent.combine(indent);
        }
        if (strict() && atWrongPosition) {
            return indent;
        }
        if (startsLine(lcurly)) {
            int braceColumn = column(lcurly);
            if (strict()) {
                return indent;
            }
            return braceColumn >= indent.firstLevel() ? IndentLevel.of(braceColumn) : indent;
        }

        boolean lambdaStartsLine = startsLine(lambda);
        if (!lambdaStartsLine && lambdaStart > indent.firstLevel()) {
            // the enclosing statement itself is misaligned
            return indent.withOffset(basic());
        }
        if (lambdaStartsLine) {
            boolean continuation = lambdaStart == indent.firstLevel() + basic()
                    || lambdaStart == indent.firstLevel() + wrap();
            return continuation ? indent.combine(lambdaIndent) : lambdaIndent;
        }
        return indent.withOffset(wrap()).combine(lambdaIndent).combine(indent);
    }

    /**
     * How many method call argument lists directly enclose the lambda, e.g. 2 for
     * {@code outer(inner(() -> { }))}.
     */
    private static int _callArgumentNesting(LambdaExpr lambda) {
        int nesting = 0;
        Node current = lambda;
        Optional<Node> parent = Syntax.parent(current);
        while (parent.isPresent() && parent.get() instanceof MethodCallExpr
                && Syntax.isCallArgument(current, parent.get())) {
            nesting++;
            current = parent.get();
            parent = Syntax.parent(current);
        }
        return nesting;
    }
}
