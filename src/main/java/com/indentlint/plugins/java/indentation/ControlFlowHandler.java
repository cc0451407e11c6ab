package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.WhileStmt;

/**
 * if/else, for, for-each, while and do-while.
 */
final class ControlFlowHandler extends ConstructHandler {
    private static final Set<String> CONTINUATION_OPERATORS =
            Set.of("&&", "||", "+", "-", "*", "/", "%", "&", "|", "^");

    ControlFlowHandler(CheckSession session, IndentationWalker walker) {
        super(session, walker);
    }

    void checkIf(IfStmt statement, IndentLevel indent) {
        checkStart(statement, "if", indent);
        int ifLine = line(statement);
        IndentLevel wrapped = indent.withOffset(wrap());

        Expression condition = statement.getCondition();
        Syntax.tokenBefore(condition).ifPresent(lparen -> {
            if (line(lparen) > ifLine && startsLine(lparen)) {
                int actual = column(lparen);
                if (!lenient(actual, wrapped)) {
                    error(lparen, "lparen", actual, wrapped);
                }
            }
        });
        checkChildContinuation(condition, ifLine, "condition", wrapped);
        walker.checkExpression(condition, _expressionBase(ifLine, indent));

        Syntax.tokenAfter(condition).ifPresent(rparen -> {
            if (line(rparen) > ifLine && startsLine(rparen)) {
                int actual = column(rparen);
                if (!exact(actual, indent.combine(wrapped))) {
                    error(rparen, "rparen", actual, indent);
                }
            }
        });

        _checkBody(statement.getThenStmt(), indent, ifLine);

        if (statement.getElseStmt().isPresent()) {
            Statement alternative = statement.getElseStmt().get();
            Optional<JavaToken> elseToken = Syntax.tokenBefore(alternative);
            int elseLine = elseToken.map(this::line).orElse(ifLine);
            elseToken.ifPresent(token -> {
                if (startsLine(token)) {
                    int actual = column(token);
                    if (!exact(actual, indent)) {
                        error(token, "else", actual, indent);
                    }
                }
            });

            if (alternative instanceof BlockStmt) {
                walker.blocks().checkBlock((BlockStmt) alternative, indent, elseLine);
            } else if (alternative instanceof IfStmt) {
                IndentLevel elseIfIndent = line(alternative) == elseLine ? indent : indent.withOffset(basic());
                checkIf((IfStmt) alternative, elseIfIndent);
            } else {
                checkSingleStatementBody(alternative, indent.withOffset(basic()));
            }
        }
    }

    /**
     * Continuations of a misaligned statement are measured from where it actually is.
     */
    private IndentLevel _expressionBase(int statementLine, IndentLevel indent) {
        int actual = lineStart(statementLine);
        return actual != indent.firstLevel() ? IndentLevel.of(actual) : indent;
    }

    private void _checkBody(Statement body, IndentLevel indent, int ownerLine) {
        if (body instanceof BlockStmt) {
            walker.blocks().checkBlock((BlockStmt) body, indent, ownerLine);
        } else {
            checkSingleStatementBody(body, indent.withOffset(basic()));
        }
    }

    void checkFor(Statement statement, IndentLevel indent) {
        checkStart(statement, "for", indent);
        int forLine = line(statement);
        IndentLevel wrapped = indent.withOffset(wrap());

        List<Node> header = new ArrayList<>();
        Statement body;
        if (statement instanceof ForStmt) {
            ForStmt loop = (ForStmt) statement;
            header.addAll(loop.getInitialization());
            loop.getCompare().ifPresent(header::add);
            header.addAll(loop.getUpdate());
            body = loop.getBody();
        } else {
            ForEachStmt loop = (ForEachStmt) statement;
            header.add(loop.getVariable());
            header.add(loop.getIterable());
            body = loop.getBody();
        }

        Optional<JavaToken> lparen = Syntax.nextSignificant(Syntax.firstToken(statement));
        Optional<JavaToken> rparen = Syntax.tokenBefore(body);
        if (lparen.isPresent() && rparen.isPresent()) {
            _checkForParen(lparen.get(), forLine, "for lparen", indent);
            _checkForParen(rparen.get(), forLine, "for rparen", indent);
            _checkHeaderSeparators(lparen.get(), rparen.get(), forLine, wrapped);
        }

        for (Node part : header) {
            checkContinuation(part, forLine, "for", wrapped);
            if (part instanceof BinaryExpr) {
                checkNestedBinaryContinuation((BinaryExpr) part, line(part), wrapped, "for");
            }
        }

        _checkBody(body, indent, forLine);
    }

    private void _checkForParen(JavaToken paren, int forLine, String element, IndentLevel indent) {
        if (line(paren) > forLine && startsLine(paren)) {
            int actual = lineStart(paren);
            if (!exact(actual, indent)) {
                error(paren, element, actual, indent);
            }
        }
    }

    /**
     * Semicolons, commas and the for-each colon at the top level of the header.
     */
    private void _checkHeaderSeparators(JavaToken lparen, JavaToken rparen, int forLine, IndentLevel wrapped) {
        IndentLevel semicolonExpected = IndentLevel.of(basic());
        int depth = 0;
        Optional<JavaToken> current = Syntax.nextSignificant(lparen);
        while (current.isPresent() && current.get() != rparen) {
            JavaToken token = current.get();
            String text = token.getText();
            if (text.equals("(") || text.equals("[") || text.equals("{")) {
                depth++;
            } else if (text.equals(")") || text.equals("]") || text.equals("}")) {
                depth--;
            } else if (depth == 0 && line(token) > forLine && startsLine(token)) {
                int actual = lineStart(token);
                if (text.equals(";")) {
                    if (!exact(actual, semicolonExpected)) {
                        error(token, ";", actual, semicolonExpected);
                    }
                } else if (text.equals(":") || text.equals(",")) {
                    if (!lenient(actual, wrapped)) {
                        error(token, "for", actual, wrapped);
                    }
                }
            }
            current = Syntax.nextSignificant(token);
        }
    }

    /**
     * Each further level of a wrapped binary expression goes one wrap deeper.
     */
    void checkNestedBinaryContinuation(BinaryExpr expression, int baseLine, IndentLevel parentIndent, String label) {
        IndentLevel nested = parentIndent.withOffset(wrap());
        _checkNestedOperand(expression.getLeft(), baseLine, nested, label);
        Syntax.tokenBefore(expression.getRight()).ifPresent(operator -> {
            if (CONTINUATION_OPERATORS.contains(operator.getText())) {
                checkChildContinuation(operator, baseLine, label, nested);
            }
        });
        _checkNestedOperand(expression.getRight(), baseLine, nested, label);
    }

    private void _checkNestedOperand(Expression operand, int baseLine, IndentLevel nested, String label) {
        if (operand instanceof BinaryExpr) {
            checkChildContinuation(operand, baseLine, label, nested);
            checkNestedBinaryContinuation((BinaryExpr) operand, baseLine, nested, label);
        }
    }

    void checkWhile(WhileStmt statement, IndentLevel indent) {
        checkStart(statement, "while", indent);
        int whileLine = line(statement);

        Expression condition = statement.getCondition();
        walker.checkExpression(condition, _expressionBase(whileLine, indent));
        Syntax.tokenAfter(condition).ifPresent(rparen -> {
            if (line(rparen) > whileLine && startsLine(rparen)) {
                int actual = column(rparen);
                if (!exact(actual, indent)) {
                    error(rparen, "rparen", actual, indent);
                }
            }
        });

        _checkBody(statement.getBody(), indent, whileLine);
    }

    void checkDo(DoStmt statement, IndentLevel indent) {
        checkStart(statement, "do", indent);
        int doLine = line(statement);
        _checkBody(statement.getBody(), indent, doLine);

        Expression condition = statement.getCondition();
        Optional<JavaToken> lparen = Syntax.tokenBefore(condition);
        Optional<JavaToken> whileToken = lparen.flatMap(Syntax::previousSignificant);
        int whileLine = whileToken.map(this::line).orElse(doLine);

        whileToken.ifPresent(token -> {
            if (startsLine(token)) {
                int actual = column(token);
                if (!exact(actual, indent)) {
                    error(token, "while", actual, indent);
                }
            }
        });
        lparen.ifPresent(token -> {
            if (line(token) > whileLine && startsLine(token)) {
                int actual = column(token);
                if (!exact(actual, indent)) {
                    error(token, "lparen", actual, indent);
                }
            }
        });

        checkChildContinuation(condition, whileLine, "condition", indent);
        walker.checkExpression(condition, indent);

        Syntax.tokenAfter(condition).ifPresent(rparen -> {
            if (line(rparen) > whileLine && startsLine(rparen)) {
                int actual = column(rparen);
                if (!exact(actual, indent)) {
                    error(rparen, "rparen", actual, indent);
                }
            }
        });
    }

    /**
     * Unbraced body of a control statement: lenient, and nested unbraced bodies go one
     * level deeper each.
     */
    void checkSingleStatementBody(Statement body, IndentLevel indent) {
        checkChildContinuation(body, -1, "block", indent);
        walker.checkExpression(body, indent);

        Statement inner = null;
        if (body instanceof ForStmt) {
            inner = ((ForStmt) body).getBody();
        } else if (body instanceof ForEachStmt) {
            inner = ((ForEachStmt) body).getBody();
        } else if (body instanceof WhileStmt) {
            inner = ((WhileStmt) body).getBody();
        } else if (body instanceof DoStmt) {
            inner = ((DoStmt) body).getBody();
        } else if (body instanceof IfStmt) {
            inner = ((IfStmt) body).getThenStmt();
        }
        if (inner instanceof BlockStmt) {
            walker.blocks().checkBlock((BlockStmt) inner, indent);
        } else if (inner != null) {
            checkSingleStatementBody(inner, indent.withOffset(basic()));
        }
    }
}
