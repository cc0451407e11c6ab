package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnionType;

/**
 * try, its resource specification, catch clauses and finally.
 */
final class TryHandler extends ConstructHandler {

    TryHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkTry(TryStmt statement, IndentLevel indent) {
        checkStart(statement, "try", indent);
        int tryLine = line(statement);
        BlockStmt tryBlock = statement.getTryBlock();

        if (!statement.getResources().isEmpty()) {
            IndentLevel resourceIndent = indent.withOffset(wrap());
            IndentLevel parenIndent = indent.combine(resourceIndent);

            Syntax.nextSignificant(Syntax.firstToken(statement))
                    .ifPresent(lparen -> _checkParen(lparen, tryLine, "lparen", parenIndent, indent));
            for (Expression resource : statement.getResources()) {
                _checkResource(resource, tryLine, resourceIndent);
            }
            Syntax.tokenBefore(tryBlock)
                    .ifPresent(rparen -> _checkParen(rparen, tryLine, "rparen", parenIndent, indent));
        }

        walker.blocks().checkBlock(tryBlock, indent);

        for (CatchClause clause : statement.getCatchClauses()) {
            _checkCatch(clause, indent);
        }

        statement.getFinallyBlock().ifPresent(finallyBlock -> {
            Syntax.tokenBefore(finallyBlock).ifPresent(keyword -> checkStart(keyword, "finally", indent));
            walker.blocks().checkBlock(finallyBlock, indent);
        });
    }

    private void _checkParen(JavaToken paren, int tryLine, String element, IndentLevel acceptable,
                             IndentLevel reported) {
        if (line(paren) > tryLine && startsLine(paren)) {
            int actual = column(paren);
            if (!exact(actual, acceptable)) {
                error(paren, element, actual, reported);
            }
        }
    }

    private void _checkResource(Expression resource, int tryLine, IndentLevel resourceIndent) {
        int resourceLine = line(resource);
        boolean onContinuation = resourceLine > tryLine && startsLine(resource);
        if (onContinuation) {
            int actual = lineStart(resourceLine);
            if (!lenient(actual, resourceIndent)) {
                childError(resource, "try", actual, resourceIndent);
            }
        }

        Optional<Expression> value = _resourceValue(resource);
        if (value.isEmpty()) {
            return;
        }
        IndentLevel expected = onContinuation ? resourceIndent.withOffset(wrap()) : resourceIndent;
        checkChildContinuation(value.get(), resourceLine, "try resource", expected);
        walker.checkExpression(value.get(), resourceIndent);
    }

    private static Optional<Expression> _resourceValue(Expression resource) {
        if (resource instanceof VariableDeclarationExpr) {
            for (VariableDeclarator variable : ((VariableDeclarationExpr) resource).getVariables()) {
                if (variable.getInitializer().isPresent()) {
                    return variable.getInitializer();
                }
            }
        }
        return Optional.empty();
    }

    private void _checkCatch(CatchClause clause, IndentLevel indent) {
        JavaToken catchToken = Syntax.firstToken(clause);
        int catchLine = line(catchToken);
        checkStart(catchToken, "catch", indent);

        IndentLevel paramIndent = indent.withOffset(wrap());
        Parameter parameter = clause.getParameter();
        List<Node> prefix = new ArrayList<>(parameter.getAnnotations());
        prefix.addAll(parameter.getModifiers());
        for (Node node : prefix) {
            if (line(node) > catchLine && startsLine(node)) {
                int actual = lineStart(node);
                if (!exact(actual, paramIndent)) {
                    childError(node, "catch parameter", actual, paramIndent);
                }
            }
        }

        _checkCaughtTypes(parameter.getType(), catchLine, paramIndent);
        walker.blocks().checkBlock(clause.getBody(), indent);
    }

    /**
     * Alternatives of a multi-catch wrap one level past the parameter when the first type was
     * already moved to its own line.
     */
    private void _checkCaughtTypes(Type type, int catchLine, IndentLevel paramIndent) {
        List<Position> items = new ArrayList<>();
        List<Boolean> pipes = new ArrayList<>();
        if (type instanceof UnionType) {
            List<? extends Type> elements = ((UnionType) type).getElements();
            for (int i = 0; i < elements.size(); i++) {
                Type element = elements.get(i);
                if (i > 0) {
                    Optional<JavaToken> pipe = Syntax.tokenBefore(element);
                    if (pipe.isPresent() && pipe.get().getText().equals("|")) {
                        items.add(Syntax.begin(pipe.get()));
                        pipes.add(Boolean.TRUE);
                    }
                }
                items.add(Syntax.begin(element));
                pipes.add(Boolean.FALSE);
            }
        } else {
            items.add(Syntax.begin(type));
            pipes.add(Boolean.FALSE);
        }
        if (items.isEmpty()) {
            return;
        }

        int firstTypeLine = session.line(items.get(0));
        boolean firstTypeOnNewLine = firstTypeLine > catchLine && session.startsLine(items.get(0));
        IndentLevel pipeIndent = firstTypeOnNewLine ? paramIndent.withOffset(wrap()) : paramIndent;

        for (int i = 0; i < items.size(); i++) {
            Position item = items.get(i);
            int itemLine = session.line(item);
            if (itemLine <= catchLine || !session.startsLine(item)) {
                continue;
            }
            boolean deeper = pipes.get(i) || (firstTypeOnNewLine && firstTypeLine < itemLine);
            IndentLevel expected = deeper ? pipeIndent : paramIndent;
            int actual = lineStart(itemLine);
            if (!lenient(actual, expected)) {
                childError(item, "catch parameter", actual, expected);
            }
        }
    }
}
