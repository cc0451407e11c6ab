package com.indentlint.plugins.java.indentation;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.Expression;

/**
 * Array creation dimensions and array initializers, including those inside annotations.
 */
final class ArrayHandler extends ConstructHandler {

    ArrayHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    /**
     * @param inVariableInitializer elements of an initializer declared on a variable use
     *                              arrayInitIndent from the statement; elsewhere they wrap
     */
    void checkArrayCreation(ArrayCreationExpr creation, IndentLevel indent, boolean inVariableInitializer) {
        int newLine = line(creation);
        IndentLevel newIndent = IndentLevel.of(lineStart(newLine));
        IndentLevel lineWrapped = newIndent.withOffset(wrap());

        int emptyDimensionsLine = -1;
        for (ArrayCreationLevel level : creation.getLevels()) {
            JavaToken lbracket = Syntax.firstToken(level);
            JavaToken rbracket = Syntax.lastToken(level);
            if (level.getDimension().isPresent()) {
                _checkDimension(level.getDimension().get(), lbracket, rbracket, newIndent, lineWrapped);
                continue;
            }
            if (emptyDimensionsLine < 0) {
                emptyDimensionsLine = line(lbracket);
            }
            _checkEmptyBracket(lbracket, emptyDimensionsLine, indent, lineWrapped);
            _checkEmptyBracket(rbracket, emptyDimensionsLine, indent, lineWrapped);
        }

        creation.getInitializer().ifPresent(initializer -> {
            IndentLevel base = newIndent;
            int arrayInit = session.config().arrayInitIndent();
            if (!inVariableInitializer && wrap() >= arrayInit) {
                base = newIndent.withOffset(wrap() - arrayInit);
            }
            checkArrayInitializer(initializer, base);
        });
    }

    private void _checkDimension(Expression dimension, JavaToken lbracket, JavaToken rbracket,
                                 IndentLevel newIndent, IndentLevel lineWrapped) {
        int dimensionLine = line(lbracket);
        checkChildContinuation(dimension, dimensionLine, "array dimension", lineWrapped);
        walker.checkExpression(dimension, newIndent);
        checkContinuation(rbracket, dimensionLine, "array dimension rbracket", lineWrapped);
    }

    private void _checkEmptyBracket(JavaToken bracket, int dimensionsLine, IndentLevel indent,
                                    IndentLevel lineWrapped) {
        if (line(bracket) > dimensionsLine && startsLine(bracket)) {
            int actual = lineStart(bracket);
            if (!lenient(actual, lineWrapped.combine(indent))) {
                error(bracket, "array dimension", actual, lineWrapped);
            }
        }
    }

    void checkArrayInitializer(ArrayInitializerExpr initializer, IndentLevel indent) {
        IndentLevel braceIndent = indent.withOffset(session.config().braceAdjustment());
        IndentLevel acceptable = braceIndent.combine(indent).combine(indent.withOffset(wrap()));
        int arrayInit = session.config().arrayInitIndent();

        JavaToken lcurly = Syntax.firstToken(initializer);
        int lcurlyLine = line(lcurly);
        boolean lcurlyOwnLine = startsLine(lcurly);
        int braceColumn = column(lcurly);
        if (lcurlyOwnLine && !exact(braceColumn, acceptable)) {
            error(lcurly, "lcurly", braceColumn, braceIndent);
        }
        boolean braceMisaligned = !exact(braceColumn, acceptable);

        IndentLevel elementIndent = indent.withOffset(arrayInit);
        if (lcurlyOwnLine) {
            elementIndent = elementIndent.addAcceptable(braceColumn + arrayInit);
        } else {
            for (Expression value : initializer.getValues()) {
                if (line(value) == lcurlyLine) {
                    elementIndent = elementIndent.addAcceptable(column(value));
                }
                break;
            }
        }

        for (Expression value : initializer.getValues()) {
            boolean continuation = line(value) > lcurlyLine && startsLine(value);
            if (value instanceof ArrayInitializerExpr) {
                _checkElement(value, continuation, elementIndent, false);
                checkArrayInitializer((ArrayInitializerExpr) value, elementIndent);
            } else if (value instanceof ArrayCreationExpr) {
                _checkElement(value, continuation, elementIndent, braceMisaligned);
                checkArrayCreation((ArrayCreationExpr) value, elementIndent, false);
            } else {
                _checkElement(value, continuation, elementIndent, false);
                walker.checkExpression(value, elementIndent);
            }
        }

        _checkClosingBrace(initializer, acceptable, braceIndent);
    }

    private void _checkElement(Expression value, boolean continuation, IndentLevel elementIndent,
                               boolean lenientOnly) {
        if (!continuation) {
            return;
        }
        int actual = lineStart(value);
        boolean accepted = lenientOnly ? lenient(actual, elementIndent) : exact(actual, elementIndent);
        if (!accepted) {
            childError(value, "array initialization", actual, elementIndent);
        }
    }

    private void _checkClosingBrace(ArrayInitializerExpr initializer, IndentLevel acceptable, IndentLevel braceIndent) {
        JavaToken rcurly = Syntax.lastToken(initializer);
        if (startsLine(rcurly)) {
            int actual = column(rcurly);
            if (!exact(actual, acceptable)) {
                error(rcurly, "rcurly", actual, braceIndent);
            }
        }
    }

    /**
     * Element values inside an annotation, e.g. {@code @SuppressWarnings({"a", "b"})}.
     */
    void checkAnnotationArrayInitializer(ArrayInitializerExpr initializer, IndentLevel indent) {
        IndentLevel braceIndent = indent.withOffset(session.config().braceAdjustment());
        IndentLevel acceptable = braceIndent.combine(indent).combine(indent.withOffset(wrap()));

        JavaToken lcurly = Syntax.firstToken(initializer);
        int lcurlyLine = line(lcurly);
        boolean lcurlyOwnLine = startsLine(lcurly);
        IndentLevel elementIndent = indent.withOffset(session.config().arrayInitIndent());
        if (lcurlyOwnLine) {
            int braceColumn = column(lcurly);
            if (exact(braceColumn, acceptable)) {
                elementIndent = IndentLevel.of(braceColumn + basic());
            } else {
                error(lcurly, "lcurly", braceColumn, braceIndent);
            }
        }
        IndentLevel combined = elementIndent.combine(indent.withOffset(wrap()));

        for (Expression value : initializer.getValues()) {
            if (line(value) > lcurlyLine && startsLine(value)) {
                int actual = lineStart(value);
                if (!exact(actual, combined)) {
                    childError(value, "annotation array initialization", actual, elementIndent);
                }
            }
            walker.checkExpression(value, elementIndent);
        }

        _checkClosingBrace(initializer, acceptable, braceIndent);
    }
}
