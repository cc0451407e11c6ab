package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;

/**
 * Method calls: wrapped chain segments and argument lists.
 */
final class MethodCallHandler extends ConstructHandler {
    private static final int MAX_NESTED_CHAIN_STEPS = 6;

    MethodCallHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkMethodCall(MethodCallExpr call, IndentLevel indent) {
        Optional<JavaToken> lparen = Syntax.tokenAfter(call.getName());
        JavaToken rparen = Syntax.lastToken(call);
        boolean multilineArguments = lparen.isPresent() && line(rparen) > line(lparen.get());

        int methodStart = lineStart(call);
        Integer chainExpectedStart = null;

        if (call.getScope().isPresent()) {
            Expression scope = call.getScope().get();
            int scopeLine = line(scope);
            Optional<JavaToken> dot = Syntax.tokenAfter(scope).filter(token -> token.getText().equals("."));
            int dotLine = dot.map(this::line).orElse(scopeLine);
            methodStart = lineStart(dotLine);

            ChainPosition position = _chainPosition(call, scope);
            boolean requiresWrap = position.topLevel && (!position.expressionStatement || multilineArguments);
            IndentLevel chainExpected = _expectedChainIndent(position.topLevel, requiresWrap, indent);
            boolean strictTopLevel = position.topLevel && strict();

            if (dot.isPresent() && dotLine > scopeLine && startsLine(dot.get())) {
                int actual = lineStart(dotLine);
                // column 0 is always accepted
                if (actual != 0) {
                    boolean wrong = strictTopLevel
                            ? actual < chainExpected.firstLevel()
                            : !lenient(actual, chainExpected);
                    if (wrong) {
                        error(dot.get(), "method call", actual, chainExpected);
                    }
                }
                if (requiresWrap) {
                    chainExpectedStart = chainExpected.firstLevel();
                }
            }

            int nameLine = line(call.getName());
            if (nameLine > dotLine && startsLine(call.getName())) {
                int actual = lineStart(nameLine);
                IndentLevel nameExpected = chainExpected.combine(IndentLevel.of(lineStart(dotLine) + wrap()));
                boolean wrong = strictTopLevel
                        ? actual < chainExpected.firstLevel()
                        : !lenient(actual, nameExpected);
                if (wrong) {
                    childError(call.getName(), "method call", actual, nameExpected);
                }
                if (requiresWrap) {
                    chainExpectedStart = chainExpected.firstLevel();
                }
            }

            walker.checkExpression(scope, indent);
        }

        if (lparen.isEmpty()) {
            return;
        }
        int nameStart = lineStart(call.getName());
        int effectiveStart = chainExpectedStart == null ? nameStart : Math.max(nameStart, chainExpectedStart);
        _checkArguments(call, indent, lparen.get(), nameStart, effectiveStart, methodStart, multilineArguments);

        if (multilineArguments && startsLine(rparen)) {
            int actual = column(rparen);
            IndentLevel rparenExpected = IndentLevel.of(effectiveStart)
                    .combine(indent)
                    .combine(indent.withOffset(wrap()));
            if (!exact(actual, rparenExpected)) {
                error(rparen, "rparen", actual, indent);
            }
        }
    }

    private IndentLevel _expectedChainIndent(boolean topLevel, boolean requiresWrap, IndentLevel indent) {
        if (!topLevel && strict()) {
            IndentLevel nested = indent.combine(indent.withOffset(wrap()));
            if (wrap() > 0) {
                for (int step = 2; step <= MAX_NESTED_CHAIN_STEPS; step++) {
                    nested = nested.addAcceptable(indent.firstLevel() + step * wrap());
                }
            }
            return nested;
        }
        if (requiresWrap && !strict()) {
            return indent.withOffset(wrap());
        }
        return indent;
    }

    private static final class ChainPosition {
        private final boolean topLevel;
        private final boolean expressionStatement;

        private ChainPosition(boolean topLevel, boolean expressionStatement) {
            this.topLevel = topLevel;
            this.expressionStatement = expressionStatement;
        }
    }

    /**
     * Whether the chain this call belongs to is a statement, a return or throw value, or the
     * initializer of a declaration that starts on the declaration's line.
     */
    private ChainPosition _chainPosition(MethodCallExpr call, Expression scope) {
        Node child = call;
        Optional<Node> current = Syntax.parent(call);
        while (current.isPresent()) {
            Node parent = current.get();
            boolean chained = (parent instanceof MethodCallExpr
                    && Syntax.isSameNode(((MethodCallExpr) parent).getScope(), child))
                    || (parent instanceof FieldAccessExpr && ((FieldAccessExpr) parent).getScope() == child)
                    || parent instanceof EnclosedExpr;
            if (chained) {
                child = parent;
                current = Syntax.parent(parent);
                continue;
            }
            if (parent instanceof ExpressionStmt && !Syntax.isLambdaExpressionBody(parent)) {
                return new ChainPosition(true, true);
            }
            if (parent instanceof ReturnStmt || parent instanceof ThrowStmt) {
                return new ChainPosition(true, false);
            }
            if (parent instanceof VariableDeclarator) {
                Optional<Node> declaration = parent.getParentNode();
                boolean declared = declaration.isPresent()
                        && ((declaration.get() instanceof VariableDeclarationExpr
                        && !Syntax.isTryResource(declaration.get()))
                        || declaration.get() instanceof FieldDeclaration);
                if (declared) {
                    return new ChainPosition(line(_chainRoot(scope)) == line(declaration.get()), false);
                }
            }
            break;
        }
        return new ChainPosition(false, false);
    }

    private static Expression _chainRoot(Expression scope) {
        Expression root = scope;
        while (root instanceof MethodCallExpr && ((MethodCallExpr) root).getScope().isPresent()) {
            root = ((MethodCallExpr) root).getScope().get();
        }
        return root;
    }

    private void _checkArguments(MethodCallExpr call, IndentLevel indent, JavaToken lparen, int nameStart,
                                 int effectiveStart, int methodStart, boolean multilineArguments) {
        NodeList<Expression> arguments = call.getArguments();
        if (arguments.isEmpty()) {
            return;
        }
        IndentLevel argBase = IndentLevel.of(effectiveStart);
        IndentLevel argIndent = argBase.withOffset(basic()).combine(argBase.withOffset(wrap()));
        IndentLevel nestedIndent = multilineArguments ? indent.withOffset(wrap()) : IndentLevel.of(methodStart);

        Optional<Node> parent = call.getParentNode();
        boolean inReturn = parent.isPresent() && parent.get() instanceof ReturnStmt;
        boolean inVariableInitializer = parent.isPresent() && parent.get() instanceof VariableDeclarator;
        boolean inField = inVariableInitializer
                && parent.get().getParentNode().filter(p -> p instanceof FieldDeclaration).isPresent();
        boolean lenientContext = inReturn || inField;

        int lparenLine = line(lparen);
        boolean firstOnNewLine = line(arguments.get(0)) > lparenLine;

        for (Expression argument : arguments) {
            int argumentLine = line(argument);
            boolean skip = lenientContext && !(argument instanceof LambdaExpr);
            if (argumentLine > lparenLine && !skip && startsLine(argument)) {
                int actual = lineStart(argumentLine);
                boolean wrong;
                if (strict()) {
                    wrong = actual < effectiveStart || (inVariableInitializer && actual > argIndent.lastLevel());
                } else if (firstOnNewLine) {
                    boolean alignedWithName = !(argument instanceof LambdaExpr) && actual == nameStart;
                    wrong = !alignedWithName && !lenient(actual, argIndent);
                } else {
                    wrong = actual < effectiveStart;
                }
                if (wrong) {
                    childError(argument, "method call", actual, argIndent);
                }
            }

            IndentLevel expressionIndent;
            if (argument instanceof ObjectCreationExpr || argument instanceof MethodCallExpr
                    || argument instanceof LambdaExpr) {
                expressionIndent = argBase;
            } else if (argument instanceof BinaryExpr || argument instanceof ConditionalExpr) {
                expressionIndent = indent;
            } else {
                expressionIndent = nestedIndent;
            }
            walker.checkExpression(argument, expressionIndent);
        }
    }
}
