package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.YieldStmt;

/**
 * Braced blocks and the plain statements that live in them.
 */
final class BlockHandler extends ConstructHandler {

    BlockHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkBlock(BlockStmt block, IndentLevel parentIndent) {
        checkBlock(block, parentIndent, -1);
    }

    /**
     * A block owned by a statement that started on {@code parentLine}. A brace moved to a
     * line of its own must then sit on the adjusted position.
     */
    void checkBlock(BlockStmt block, IndentLevel parentIndent, int parentLine) {
        JavaToken lcurly = Syntax.firstToken(block);
        JavaToken rcurly = Syntax.lastToken(block);
        boolean braceOnContinuation = parentLine >= 0 && line(lcurly) > parentLine && startsLine(lcurly);
        checkBraces(lcurly, rcurly, parentIndent, braceOnContinuation);

        IndentLevel childIndent = parentIndent.withOffset(basic());
        if (startsLine(lcurly)) {
            int braceColumn = column(lcurly);
            IndentLevel expectedBrace = braceOnContinuation && session.config().braceAdjustment() != 0
                    ? parentIndent.withOffset(session.config().braceAdjustment())
                    : parentIndent;
            if (exact(braceColumn, expectedBrace)) {
                childIndent = IndentLevel.of(braceColumn + basic());
            }
        }
        _checkStatements(block.getStatements(), childIndent);
    }

    void checkConstructorBody(BlockStmt body, IndentLevel parentIndent) {
        JavaToken lcurly = Syntax.firstToken(body);
        checkBraces(lcurly, Syntax.lastToken(body), parentIndent, false);

        int adjustment = session.config().braceAdjustment();
        IndentLevel childIndent = parentIndent.withOffset(basic());
        if (startsLine(lcurly) && adjustment != 0) {
            int braceColumn = column(lcurly);
            if (exact(braceColumn, parentIndent.withOffset(adjustment))) {
                childIndent = IndentLevel.of(braceColumn + basic());
            }
        }
        _checkStatements(body.getStatements(), childIndent);
    }

    /**
     * Block directly under a {@code case} label of a colon-style switch.
     */
    void checkCaseBlock(BlockStmt block, IndentLevel caseIndent) {
        JavaToken lcurly = Syntax.firstToken(block);
        JavaToken rcurly = Syntax.lastToken(block);
        if (startsLine(lcurly)) {
            checkBraces(lcurly, rcurly, caseIndent, true);
            _checkStatements(block.getStatements(),
                    caseIndent.withOffset(session.config().braceAdjustment() + basic()));
            return;
        }
        if (startsLine(rcurly)) {
            int actual = column(rcurly);
            if (!exact(actual, caseIndent)) {
                error(rcurly, "block rcurly", actual, caseIndent);
            }
        }
        _checkStatements(block.getStatements(), caseIndent.withOffset(basic()));
    }

    private void _checkStatements(NodeList<Statement> statements, IndentLevel indent) {
        for (Statement statement : statements) {
            walker.checkStatement(statement, indent);
        }
    }

    void checkLocalVariable(ExpressionStmt statement, IndentLevel indent) {
        checkChildStart(statement, "block", indent);
        VariableDeclarationExpr declaration = (VariableDeclarationExpr) statement.getExpression();
        walker.declarations().checkVariableContinuation(declaration, declaration.getVariables(), indent);
    }

    /**
     * Expression, return, throw, break, continue and assert statements.
     */
    void checkSimpleStatement(Statement statement, IndentLevel indent) {
        checkChildStart(statement, "block", indent);
        walker.recurse(statement, indent);
    }

    void checkYield(YieldStmt statement, IndentLevel indent) {
        checkChildStart(statement, "block", indent);
        Expression value = statement.getExpression();
        checkChildContinuation(value, line(statement), "yield value", indent);
        walker.checkExpression(value, indent);
    }

    /**
     * A label may sit on the statement's level or one level out.
     */
    void checkLabeled(LabeledStmt statement, IndentLevel indent) {
        IndentLevel outer = indent.withOffset(-basic());
        IndentLevel acceptable = outer.firstLevel() < 0 ? indent : indent.combine(outer);
        checkStart(statement, "label", acceptable);
        walker.checkStatement(statement.getStatement(), acceptable);
    }

    void checkSynchronized(SynchronizedStmt statement, IndentLevel indent) {
        int syncLine = line(statement);
        checkStart(statement, "synchronized", indent);

        Expression lock = statement.getExpression();
        Optional<JavaToken> lparen = Syntax.tokenBefore(lock);
        if (lparen.isPresent()) {
            int parenLine = line(lparen.get());
            IndentLevel wrapped = indent.withOffset(wrap());
            if (parenLine > syncLine && startsLine(lparen.get())) {
                int actual = lineStart(parenLine);
                if (!exact(actual, indent)) {
                    error(lparen.get(), "synchronized lparen", actual, indent);
                }
            }
            if (parenLine == syncLine) {
                checkChildContinuation(lock, syncLine, "synchronized", wrapped);
                walker.checkExpression(lock, wrapped);
            }
        }
        checkBlock(statement.getBody(), indent);
    }

    /**
     * {@code this(...)}, {@code super(...)} and qualified {@code outer.super(...)}.
     */
    void checkConstructorCall(ExplicitConstructorInvocationStmt call, IndentLevel indent) {
        checkStart(call, "ctor call", indent);

        int ctorLine = line(call);
        int ctorStart = lineStart(ctorLine);
        IndentLevel ctorIndent = IndentLevel.of(ctorStart);
        boolean hasObject = call.getExpression().isPresent();
        String keywordText = call.isThis() ? "this" : "super";

        JavaToken searchFrom = Syntax.firstToken(call);
        if (hasObject) {
            Expression object = call.getExpression().get();
            walker.checkExpression(object, indent);

            int objectLine = line(object);
            IndentLevel continuation = IndentLevel.of(lineStart(objectLine)).withOffset(wrap());
            Optional<JavaToken> dot = Syntax.tokenAfter(object);
            if (dot.isPresent()) {
                checkChildContinuation(dot.get(), objectLine, "ctor call", continuation);
                searchFrom = dot.get();
            }
            Optional<JavaToken> superKeyword = Syntax.findAtDepth(searchFrom, call, "super");
            superKeyword.ifPresent(keyword -> checkChildContinuation(keyword, objectLine, "ctor call", continuation));
        }

        Optional<JavaToken> keyword = Syntax.findAtDepth(searchFrom, call, keywordText);
        int keywordLine = keyword.map(this::line).orElse(ctorLine);

        IndentLevel argExpected;
        if (!hasObject) {
            argExpected = indent;
        } else if (keyword.isPresent() && keywordLine > ctorLine) {
            int keywordStart = lineStart(keywordLine);
            argExpected = IndentLevel.of(keywordStart + basic()).addAcceptable(keywordStart + wrap());
        } else {
            argExpected = IndentLevel.of(ctorStart + wrap());
        }
        IndentLevel combinedArgIndent = argExpected.combine(indent.withOffset(wrap()));

        Optional<JavaToken> lparen = keyword.flatMap(Syntax::nextSignificant);
        if (lparen.isEmpty()) {
            return;
        }
        int lparenLine = line(lparen.get());
        if (lparenLine > keywordLine && startsLine(lparen.get())) {
            int actual = lineStart(lparenLine);
            if (!lenient(actual, combinedArgIndent)) {
                childError(lparen.get(), "ctor call", actual, argExpected);
            }
        }

        IndentLevel checkIndent = hasObject ? argExpected : combinedArgIndent;
        for (Expression argument : call.getArguments()) {
            int argumentLine = line(argument);
            if (argumentLine > lparenLine && startsLine(argument)) {
                int actual = lineStart(argumentLine);
                if (!lenient(actual, checkIndent)) {
                    childError(argument, "ctor call", actual, argExpected);
                }
            }
            if (argument instanceof LambdaExpr) {
                walker.lambdas().checkLambda((LambdaExpr) argument, argExpected);
            } else if (argument instanceof BinaryExpr || argument instanceof ConditionalExpr) {
                _checkOperandLines(argument, argExpected);
            }
        }

        Optional<JavaToken> rparen = Syntax.previousSignificant(Syntax.lastToken(call));
        if (rparen.isPresent() && rparen.get().getText().equals(")") && startsLine(rparen.get())) {
            int actual = column(rparen.get());
            if (!lenient(actual, ctorIndent.combine(indent))) {
                error(rparen.get(), "rparen", actual, ctorIndent);
            }
        }
    }

    private void _checkOperandLines(Expression expression, IndentLevel expected) {
        int startLine = line(expression);
        for (ExpressionHandler.Part part : ExpressionHandler.parts(expression)) {
            if (session.line(part.position()) > startLine && session.startsLine(part.position())) {
                int actual = lineStart(session.line(part.position()));
                if (!lenient(actual, expected)) {
                    childError(part.position(), "ctor call", actual, expected);
                }
            }
        }
    }
}
