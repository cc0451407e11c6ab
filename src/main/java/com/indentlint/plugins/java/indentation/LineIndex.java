package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.Position;

/**
 * Line table over one source text. Lines are 0-based here; parser positions are 1-based.
 * Columns are expanded, with a tab advancing to the next multiple of the tab width.
 */
public final class LineIndex {
    private final String source;
    private final int tabWidth;
    private final int[] lineOffsets;
    private final int[] lineEnds;

    public LineIndex(String source, int tabWidth) {
        this.source = source;
        this.tabWidth = tabWidth;

        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        starts.add(0);
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                ends.add(i);
                if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            }
            i++;
        }
        ends.add(source.length());

        this.lineOffsets = starts.stream().mapToInt(Integer::intValue).toArray();
        this.lineEnds = ends.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return lineOffsets.length;
    }

    public int tabWidth() {
        return tabWidth;
    }

    /**
     * Character offset of the first character of {@code line} in the source.
     */
    public int lineOffset(int line) {
        return lineOffsets[line];
    }

    /**
     * Character offset just past the leading whitespace of {@code line}.
     */
    public int leadingWhitespaceEnd(int line) {
        int offset = lineOffsets[line];
        int end = lineEnds[line];
        while (offset < end && Character.isWhitespace(source.charAt(offset))) {
            offset++;
        }
        return offset;
    }

    /**
     * Expanded column of the first non-whitespace character of {@code line}.
     */
    public int lineStart(int line) {
        if (line < 0 || line >= lineOffsets.length) {
            return 0;
        }
        return expandedColumn(line, leadingWhitespaceEnd(line) - lineOffsets[line]);
    }

    /**
     * Expanded column of the character at {@code charIndex} inside {@code line}.
     */
    public int expandedColumn(int line, int charIndex) {
        if (line < 0 || line >= lineOffsets.length) {
            return 0;
        }
        int offset = lineOffsets[line];
        int limit = Math.min(offset + charIndex, lineEnds[line]);
        int column = 0;
        for (int i = offset; i < limit; i++) {
            if (source.charAt(i) == '\t') {
                column = (column / tabWidth + 1) * tabWidth;
            } else {
                column++;
            }
        }
        return column;
    }

    /**
     * Expanded column of a parser position.
     */
    public int column(Position position) {
        return expandedColumn(position.line - 1, position.column - 1);
    }

    /**
     * Whether {@code position} is the first non-whitespace character of its line.
     */
    public boolean isOnStartOfLine(Position position) {
        int line = position.line - 1;
        if (line < 0 || line >= lineOffsets.length) {
            return false;
        }
        return leadingWhitespaceEnd(line) - lineOffsets[line] == position.column - 1;
    }
}
