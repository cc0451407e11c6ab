package com.indentlint.plugins.java.indentation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.RecordPatternExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * Wrapped operators of binary and conditional expressions, instanceof with its patterns,
 * array access and text block delimiters.
 */
final class ExpressionHandler extends ConstructHandler {
    private static final int MAX_PARENT_DEPTH = 50;

    /**
     * Where an operator expression sits; decides how strictly its continuation lines are read.
     */
    private enum Context {
        STATEMENT,
        ARGUMENT,
        WRAPPED_INITIALIZER,
        RETURN,
        DECLARATION_LINE,
        LAMBDA
    }

    /**
     * One operand or operator of an expression, in source order. Operators have no node.
     */
    static final class Part {
        private final Position position;
        private final Expression node;

        private Part(Position position, Expression node) {
            this.position = position;
            this.node = node;
        }

        Position position() { return position; }
        Optional<Expression> node() { return Optional.ofNullable(node); }
    }

    ExpressionHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    static List<Part> parts(Expression expression) {
        List<Part> parts = new ArrayList<>();
        if (expression instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expression;
            parts.add(_operand(binary.getLeft()));
            Syntax.tokenBefore(binary.getRight()).ifPresent(operator -> parts.add(_operator(operator)));
            parts.add(_operand(binary.getRight()));
        } else if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            parts.add(_operand(conditional.getCondition()));
            Syntax.tokenBefore(conditional.getThenExpr()).ifPresent(question -> parts.add(_operator(question)));
            parts.add(_operand(conditional.getThenExpr()));
            Syntax.tokenBefore(conditional.getElseExpr()).ifPresent(colon -> parts.add(_operator(colon)));
            parts.add(_operand(conditional.getElseExpr()));
        }
        return parts;
    }

    private static Part _operand(Expression expression) {
        return new Part(Syntax.begin(expression), expression);
    }

    private static Part _operator(JavaToken token) {
        return new Part(Syntax.begin(token), null);
    }

    private static boolean _isOperatorExpression(Node node) {
        return node instanceof BinaryExpr || node instanceof ConditionalExpr;
    }

    void checkBinary(Expression expression, IndentLevel indent) {
        Context context = _context(expression);
        switch (context) {
            case LAMBDA:
                return;
            case STATEMENT:
                _checkStatementOperands(expression, indent);
                return;
            default:
                _checkLenientOperands(expression, indent, context);
        }
    }

    private Context _context(Expression expression) {
        Node child = expression;
        Optional<Node> current = Syntax.parent(expression);
        int depth = 0;
        while (current.isPresent() && depth < MAX_PARENT_DEPTH) {
            Node parent = current.get();
            if (parent instanceof LambdaExpr) {
                return Context.LAMBDA;
            }
            if (parent instanceof ReturnStmt || parent instanceof ThrowStmt) {
                return Context.RETURN;
            }
            if (Syntax.isCallArgument(child, parent)) {
                return Context.ARGUMENT;
            }
            if (parent instanceof VariableDeclarator && !strict()) {
                Optional<Node> declaration = parent.getParentNode();
                if (declaration.isPresent() && declaration.get() instanceof VariableDeclarationExpr
                        && !Syntax.isTryResource(declaration.get())) {
                    return line(expression) == line(declaration.get())
                            ? Context.DECLARATION_LINE
                            : Context.WRAPPED_INITIALIZER;
                }
            }
            if (_endsExpressionSearch(parent)) {
                return Context.STATEMENT;
            }
            child = parent;
            current = Syntax.parent(parent);
            depth++;
        }
        return Context.STATEMENT;
    }

    private static boolean _endsExpressionSearch(Node node) {
        return node instanceof ExpressionStmt || node instanceof IfStmt || node instanceof WhileStmt
                || node instanceof ForStmt || node instanceof ForEachStmt || node instanceof DoStmt
                || node instanceof SwitchStmt || node instanceof TryStmt || node instanceof SynchronizedStmt
                || node instanceof BlockStmt;
    }

    /**
     * Operators inside arguments, returns and initializers only need to stay at or past a
     * floor that depends on where the expression sits.
     */
    private void _checkLenientOperands(Expression expression, IndentLevel indent, Context context) {
        int startLine = line(expression);
        int exprStart = lineStart(startLine);
        int floor;
        switch (context) {
            case ARGUMENT:
                OptionalInt throwFloor = _throwFloor(expression);
                floor = throwFloor.isPresent() ? throwFloor.getAsInt() : exprStart;
                break;
            case RETURN:
                floor = strict() || expression instanceof ConditionalExpr
                        ? exprStart
                        : indent.firstLevel() + wrap();
                break;
            case DECLARATION_LINE:
                floor = indent.firstLevel() + wrap();
                break;
            default:
                floor = indent.firstLevel();
        }
        IndentLevel reported = context == Context.WRAPPED_INITIALIZER ? indent : IndentLevel.of(floor);

        Deque<Expression> pending = new ArrayDeque<>();
        pending.add(expression);
        while (!pending.isEmpty()) {
            for (Part part : parts(pending.poll())) {
                Position position = part.position();
                if (session.line(position) > startLine && session.startsLine(position)) {
                    int actual = lineStart(session.line(position));
                    if (actual < floor) {
                        childError(position, "expr", actual, reported);
                    }
                }
                if (part.node().isEmpty()) {
                    continue;
                }
                Expression operand = part.node().get();
                if (operand instanceof TextBlockLiteralExpr) {
                    _checkClosingBelowFloor((TextBlockLiteralExpr) operand, startLine, floor, reported);
                }
                if (_isOperatorExpression(operand)) {
                    pending.add(operand);
                } else if (operand instanceof MethodCallExpr || operand instanceof ObjectCreationExpr) {
                    walker.checkExpression(operand, indent);
                }
            }
        }
    }

    private OptionalInt _throwFloor(Expression expression) {
        Optional<Node> current = Syntax.parent(expression);
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof ThrowStmt) {
                return OptionalInt.of(lineStart(node) + wrap());
            }
            if (node instanceof ExpressionStmt || node instanceof ReturnStmt
                    || node instanceof VariableDeclarationExpr || node instanceof FieldDeclaration
                    || node instanceof BlockStmt) {
                break;
            }
            current = Syntax.parent(node);
        }
        return OptionalInt.empty();
    }

    private void _checkClosingBelowFloor(TextBlockLiteralExpr textBlock, int startLine, int floor,
                                         IndentLevel reported) {
        Position closing = _closingDelimiter(textBlock);
        if (session.line(closing) > startLine && session.startsLine(closing)) {
            int actual = session.column(closing);
            if (actual < floor) {
                session.emitter().reportOnly(closing, "text block", true, actual, reported);
            }
        }
    }

    /**
     * Operators of an expression that makes up a whole statement or a condition.
     */
    private void _checkStatementOperands(Expression expression, IndentLevel indent) {
        int startLine = line(expression);
        int exprStart = column(expression);
        int lineWrappedLevel = indent.firstLevel() + wrap();
        boolean nested = !_isConditionExpression(expression) && exprStart < lineWrappedLevel;
        IndentLevel expected = IndentLevel.of(nested ? indent.firstLevel() : lineWrappedLevel);

        IndentLevel strictAcceptable = expected.combine(indent.withOffset(wrap()));
        if (!_inArrayDimension(expression)) {
            strictAcceptable = strictAcceptable.addAcceptable(exprStart, lineStart(startLine));
        }

        Deque<Expression> pending = new ArrayDeque<>();
        pending.add(expression);
        while (!pending.isEmpty()) {
            for (Part part : parts(pending.poll())) {
                Position position = part.position();
                if (session.line(position) > startLine && session.startsLine(position)) {
                    int actual = lineStart(session.line(position));
                    if (strict()) {
                        if (!exact(actual, strictAcceptable)) {
                            childError(position, "expr", actual, expected);
                        }
                    } else if (actual != exprStart && actual < expected.firstLevel()) {
                        childError(position, "expr", actual, expected);
                    }
                }
                if (part.node().isEmpty()) {
                    continue;
                }
                Expression operand = part.node().get();
                if (operand instanceof TextBlockLiteralExpr) {
                    _checkClosingDelimiter((TextBlockLiteralExpr) operand, startLine, expected);
                }
                if (_isOperatorExpression(operand)) {
                    pending.add(operand);
                } else {
                    walker.checkExpression(operand, indent);
                }
            }
        }
    }

    private void _checkClosingDelimiter(TextBlockLiteralExpr textBlock, int startLine, IndentLevel expected) {
        Position closing = _closingDelimiter(textBlock);
        if (session.line(closing) > startLine && session.startsLine(closing)) {
            int actual = session.column(closing);
            if (!lenient(actual, expected)) {
                session.emitter().reportOnly(closing, "text block", true, actual, expected);
            }
        }
    }

    private boolean _isConditionExpression(Expression expression) {
        Node child = expression;
        Optional<Node> parent = child.getParentNode();
        while (parent.isPresent() && _isOperatorExpression(parent.get())) {
            child = parent.get();
            parent = child.getParentNode();
        }
        if (parent.isEmpty()) {
            return false;
        }
        Node owner = parent.get();
        if (owner instanceof IfStmt) {
            return ((IfStmt) owner).getCondition() == child;
        } else if (owner instanceof WhileStmt) {
            return ((WhileStmt) owner).getCondition() == child;
        } else if (owner instanceof DoStmt) {
            return ((DoStmt) owner).getCondition() == child;
        }
        return false;
    }

    private static boolean _inArrayDimension(Expression expression) {
        Optional<Node> parent = expression.getParentNode();
        while (parent.isPresent()) {
            Node node = parent.get();
            if (node instanceof ArrayCreationLevel) {
                return true;
            }
            if (!(node instanceof BinaryExpr || node instanceof ConditionalExpr || node instanceof EnclosedExpr)) {
                return false;
            }
            parent = node.getParentNode();
        }
        return false;
    }

    void checkInstanceOf(InstanceOfExpr expression, IndentLevel indent) {
        int instanceLine = line(expression);
        IndentLevel patternExpected = IndentLevel.of(lineStart(instanceLine)).withOffset(wrap());
        Node target = expression.getPattern().map(pattern -> (Node) pattern).orElse(expression.getType());
        checkChildContinuation(target, instanceLine, "instanceof", patternExpected);
        checkPattern(target, patternExpected, instanceLine);
        walker.checkExpression(expression.getExpression(), indent);
    }

    /**
     * Record deconstruction patterns: wrapped components stay past {@code expected}, and a
     * closing parenthesis on its own line lines up with the pattern start.
     */
    void checkPattern(Node pattern, IndentLevel expected, int baseLine) {
        if (!(pattern instanceof RecordPatternExpr)) {
            return;
        }
        RecordPatternExpr record = (RecordPatternExpr) pattern;
        Node type = record.getType();
        boolean typeCorrect = line(type) == baseLine || !startsLine(type) || lenient(lineStart(type), expected);
        checkChildContinuation(type, baseLine, "record pattern", expected);

        for (PatternExpr component : record.getPatternList()) {
            checkChildContinuation(component, baseLine, "record pattern", expected);
            checkPattern(component, expected, line(component));
        }

        JavaToken rparen = Syntax.lastToken(record);
        if (line(rparen) > baseLine && startsLine(rparen)) {
            int actual = lineStart(rparen);
            IndentLevel rparenLevel = IndentLevel.of(typeCorrect
                    ? expected.firstLevel() - wrap()
                    : expected.firstLevel());
            if (!lenient(actual, rparenLevel)) {
                error(rparen, "rparen", actual, rparenLevel);
            }
        }
    }

    void checkArrayAccess(ArrayAccessExpr access, IndentLevel indent) {
        Optional<Node> parent = Syntax.parent(access);
        if (parent.isPresent() && parent.get() instanceof VariableDeclarator
                && parent.get().getParentNode().filter(p -> p instanceof VariableDeclarationExpr).isPresent()) {
            int declaratorLine = line(parent.get());
            IndentLevel wrapped = indent.withOffset(wrap());
            checkChildContinuation(access.getName(), declaratorLine, "array access", wrapped);
            checkChildContinuation(access.getIndex(), declaratorLine, "array access", wrapped);
        }
        walker.checkExpression(access.getName(), indent);
        walker.checkExpression(access.getIndex(), indent);
    }

    /**
     * Delimiters of a text block assigned in a declaration. The closing delimiter is reported
     * without a fix since it belongs to the literal's content.
     */
    void checkTextBlockDelimiters(TextBlockLiteralExpr textBlock, int declarationLine, IndentLevel wrapped) {
        Position opening = Syntax.begin(textBlock);
        if (session.line(opening) > declarationLine && session.startsLine(opening)) {
            int actual = lineStart(session.line(opening));
            if (!lenient(actual, wrapped)) {
                error(opening, "text block", actual, wrapped);
            }
        }
        Position closing = _closingDelimiter(textBlock);
        if (session.line(closing) > declarationLine && session.startsLine(closing)) {
            int actual = lineStart(session.line(closing));
            if (!lenient(actual, wrapped)) {
                session.emitter().reportOnly(closing, "text block", false, actual, wrapped);
            }
        }
    }

    private static Position _closingDelimiter(TextBlockLiteralExpr textBlock) {
        Position end = textBlock.getEnd().orElse(Syntax.begin(textBlock));
        return new Position(end.line, Math.max(1, end.column - 2));
    }
}
