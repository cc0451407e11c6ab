package com.indentlint.plugins.java.indentation;

import java.util.Optional;

import com.github.javaparser.Position;

/**
 * One indentation mismatch. {@code position} is the parser position of the offending token.
 */
public final class IndentViolation {
    private final Position position;
    private final String element;
    private final boolean child;
    private final int actual;
    private final IndentLevel expected;
    private final boolean fixable;
    private final LineFix fix;

    IndentViolation(Position position, String element, boolean child, int actual,
                    IndentLevel expected, boolean fixable, LineFix fix) {
        this.position = position;
        this.element = element;
        this.child = child;
        this.actual = actual;
        this.expected = expected;
        this.fixable = fixable;
        this.fix = fix;
    }

    IndentViolation withFix(LineFix fix) {
        return new IndentViolation(position, element, child, actual, expected, fixable, fix);
    }

    public String message() {
        return "'" + element + "'" + (child ? " child" : "") + " has incorrect indentation level "
                + actual + ", expected level should be " + expected;
    }

    /**
     * 1-based line.
     */
    public int line() {
        return position.line;
    }

    /**
     * 1-based column as reported by the parser.
     */
    public int column() {
        return position.column;
    }

    public Position position() { return position; }
    public String element() { return element; }
    public boolean isChild() { return child; }
    public int actual() { return actual; }
    public IndentLevel expected() { return expected; }
    boolean isFixable() { return fixable; }
    public Optional<LineFix> fix() { return Optional.ofNullable(fix); }

    @Override
    public String toString() {
        return line() + ":" + column() + ": " + message();
    }
}
