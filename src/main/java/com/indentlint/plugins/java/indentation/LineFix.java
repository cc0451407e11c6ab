package com.indentlint.plugins.java.indentation;

/**
 * Replacement of one line's leading whitespace. Offsets are character offsets into the
 * source the fix was computed from; {@code end} is exclusive.
 */
public final class LineFix {
    private final int line;
    private final int start;
    private final int end;
    private final String replacement;

    public LineFix(int line, int start, int end, String replacement) {
        this.line = line;
        this.start = start;
        this.end = end;
        this.replacement = replacement;
    }

    // Getters
    public int line() { return line; }
    public int start() { return start; }
    public int end() { return end; }
    public String replacement() { return replacement; }

    public boolean overlaps(LineFix other) {
        return line == other.line || (start < other.end && other.start < end);
    }

    @Override
    public String toString() {
        return "line " + (line + 1) + ": indent with " + replacement.length() + " spaces";
    }
}
