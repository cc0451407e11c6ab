package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;

/**
 * {@code new} expressions: the wrapped type and argument list, and anonymous class bodies.
 */
final class ObjectCreationHandler extends ConstructHandler {

    ObjectCreationHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkObjectCreation(ObjectCreationExpr creation, IndentLevel indent) {
        int newLine = line(creation);
        int newStart = lineStart(newLine);
        IndentLevel newIndent = IndentLevel.of(newStart);
        IndentLevel continuationIndent = newIndent.withOffset(wrap());
        boolean newAtWrongPosition = !lenient(newStart, indent.combine(indent.withOffset(wrap())));

        Node type = creation.getType();
        _checkAgainstNew(type, newLine, newIndent, continuationIndent);
        Optional<JavaToken> lparen = Syntax.findAtDepth(Syntax.firstToken(type), creation, "(");
        lparen.ifPresent(token -> {
            if (line(token) > newLine && startsLine(token)) {
                int actual = lineStart(token);
                if (!lenient(actual, newIndent)) {
                    childError(token, "new", actual, continuationIndent);
                }
            }
        });

        if (lparen.isPresent()) {
            _checkArguments(creation, lparen.get(), newStart, newIndent);
        }

        if (creation.getAnonymousClassBody().isPresent() && lparen.isPresent()) {
            _checkAnonymousBody(creation, creation.getAnonymousClassBody().get(), lparen.get(), indent,
                    newLine, newStart, newIndent, newAtWrongPosition);
        }

        creation.getScope().ifPresent(scope -> walker.checkExpression(scope, newIndent));
    }

    private void _checkAgainstNew(Node node, int newLine, IndentLevel newIndent, IndentLevel continuationIndent) {
        if (line(node) > newLine && startsLine(node)) {
            int actual = lineStart(node);
            if (!lenient(actual, newIndent)) {
                childError(node, "new", actual, continuationIndent);
            }
        }
    }

    private void _checkArguments(ObjectCreationExpr creation, JavaToken lparen, int newStart, IndentLevel newIndent) {
        NodeList<Expression> arguments = creation.getArguments();
        if (arguments.isEmpty()) {
            return;
        }
        IndentLevel argIndent = newIndent.withOffset(wrap());

        Optional<Node> parent = creation.getParentNode();
        boolean inReturn = parent.isPresent() && parent.get() instanceof ReturnStmt;
        boolean inField = parent.isPresent() && parent.get() instanceof VariableDeclarator
                && parent.get().getParentNode().filter(p -> p instanceof FieldDeclaration).isPresent();
        boolean lenientContext = inReturn || inField;
        boolean inTryResource = _inTryResource(creation);

        int lparenLine = line(lparen);
        boolean firstOnNewLine = line(arguments.get(0)) > lparenLine;

        for (Expression argument : arguments) {
            int argumentLine = line(argument);
            if (argumentLine > lparenLine && startsLine(argument) && !lenientContext) {
                int actual = lineStart(argumentLine);
                boolean wrong;
                if (strict()) {
                    wrong = inTryResource ? !lenient(actual, argIndent) : actual < newStart;
                } else if (firstOnNewLine) {
                    boolean alignedWithNew = wrap() <= basic() && !(argument instanceof LambdaExpr)
                            && actual == newStart;
                    wrong = !alignedWithNew && !lenient(actual, argIndent);
                } else {
                    wrong = actual < newStart;
                }
                if (wrong) {
                    childError(argument, "new", actual, argIndent);
                }
            }

            boolean ownRules = argument instanceof ObjectCreationExpr || argument instanceof MethodCallExpr
                    || argument instanceof LambdaExpr;
            walker.checkExpression(argument, ownRules || strict() ? argIndent : newIndent);
        }
    }

    private static boolean _inTryResource(ObjectCreationExpr creation) {
        Optional<Node> current = creation.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (Syntax.isTryResource(node)) {
                return true;
            }
            if (node instanceof ExpressionStmt || node instanceof ReturnStmt || node instanceof ThrowStmt
                    || node instanceof FieldDeclaration || node instanceof BlockStmt) {
                return false;
            }
            current = node.getParentNode();
        }
        return false;
    }

    /**
     * Anonymous class braces accept several positions around the {@code new}, and the members
     * are measured from wherever the body actually opens.
     */
    private void _checkAnonymousBody(ObjectCreationExpr creation, NodeList<BodyDeclaration<?>> members,
                                     JavaToken lparen, IndentLevel indent, int newLine, int newStart,
                                     IndentLevel newIndent, boolean newAtWrongPosition) {
        Optional<JavaToken> argumentsEnd = Syntax.nextSignificant(lparen)
                .flatMap(token -> Syntax.findAtDepth(token, creation, ")"));
        Optional<JavaToken> lcurly = argumentsEnd.flatMap(Syntax::nextSignificant);
        if (lcurly.isEmpty() || !lcurly.get().getText().equals("{")) {
            return;
        }
        JavaToken rcurly = Syntax.lastToken(creation);
        IndentLevel expectedBrace = _expectedBrace(creation, indent, newStart);

        if (startsLine(rcurly)) {
            int actual = column(rcurly);
            if (!exact(actual, expectedBrace)) {
                childError(rcurly, "block rcurly", actual, expectedBrace);
            }
        }

        IndentLevel bodyIndent;
        if (startsLine(lcurly.get())) {
            int braceColumn = column(lcurly.get());
            if (!exact(braceColumn, expectedBrace)) {
                childError(lcurly.get(), "block lcurly", braceColumn, expectedBrace);
            }
            bodyIndent = IndentLevel.of(braceColumn).combine(newIndent).combine(indent);
        } else {
            Optional<Integer> argumentStart = _firstArgumentContinuation(creation, newLine);
            if (argumentStart.isPresent()) {
                bodyIndent = IndentLevel.of(argumentStart.get());
            } else if (strict()) {
                bodyIndent = newAtWrongPosition ? indent : newIndent;
            } else if (newAtWrongPosition) {
                bodyIndent = indent.combine(indent.withOffset(basic()));
            } else {
                bodyIndent = newIndent.combine(indent)
                        .combine(newIndent.withOffset(basic()))
                        .combine(indent.withOffset(basic()));
            }
        }

        walker.declarations().checkClassBody(lcurly.get(), rcurly, members, bodyIndent);
    }

    private IndentLevel _expectedBrace(ObjectCreationExpr creation, IndentLevel indent, int newStart) {
        IndentLevel expected = indent.addAcceptable(indent.firstLevel() + basic(), indent.firstLevel() + wrap());
        int offset = newStart - indent.firstLevel();
        if (offset > 0) {
            boolean cleanOffset = (basic() > 0 && offset % basic() == 0) || (wrap() > 0 && offset % wrap() == 0);
            if (cleanOffset) {
                expected = expected.addAcceptable(newStart, newStart + basic(), newStart + wrap());
            }
        }
        Optional<Integer> lambdaStart = _enclosingLambdaStart(creation);
        if (lambdaStart.isPresent()) {
            expected = expected.addAcceptable(lambdaStart.get(), lambdaStart.get() + basic());
        }
        return expected;
    }

    private Optional<Integer> _enclosingLambdaStart(ObjectCreationExpr creation) {
        Optional<Node> current = Syntax.parent(creation);
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof LambdaExpr) {
                return Optional.of(lineStart(node));
            }
            if (node instanceof ExpressionStmt || node instanceof VariableDeclarationExpr
                    || node instanceof ReturnStmt || node instanceof BlockStmt || node instanceof MethodDeclaration) {
                break;
            }
            current = Syntax.parent(node);
        }
        return Optional.empty();
    }

    private Optional<Integer> _firstArgumentContinuation(ObjectCreationExpr creation, int newLine) {
        if (creation.getArguments().isEmpty()) {
            return Optional.empty();
        }
        int argumentLine = line(creation.getArguments().get(0));
        return argumentLine > newLine ? Optional.of(lineStart(argumentLine)) : Optional.empty();
    }
}
