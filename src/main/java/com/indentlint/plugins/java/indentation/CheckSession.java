package com.indentlint.plugins.java.indentation;

import java.util.List;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

/**
 * Per-file state of one check: the line table, the options and the violation sink.
 * Lives exactly as long as the check of one compilation unit.
 */
final class CheckSession {
    private final LineIndex lines;
    private final IndentConfig config;
    private final ViolationEmitter emitter;

    CheckSession(String source, IndentConfig config) {
        this.lines = new LineIndex(source, config.tabWidth());
        this.config = config;
        this.emitter = new ViolationEmitter(lines);
    }

    LineIndex lines() {
        return lines;
    }

    IndentConfig config() {
        return config;
    }

    ViolationEmitter emitter() {
        return emitter;
    }

    List<IndentViolation> finish() {
        return emitter.finish();
    }

    /** 0-based line of a position. */
    int line(Position position) {
        return position.line - 1;
    }

    int line(Node node) {
        return line(Syntax.begin(node));
    }

    int line(JavaToken token) {
        return line(Syntax.begin(token));
    }

    int lineStart(int line) {
        return lines.lineStart(line);
    }

    int column(Position position) {
        return lines.column(position);
    }

    int column(Node node) {
        return column(Syntax.begin(node));
    }

    int column(JavaToken token) {
        return column(Syntax.begin(token));
    }

    boolean startsLine(Position position) {
        return lines.isOnStartOfLine(position);
    }

    boolean startsLine(Node node) {
        return startsLine(Syntax.begin(node));
    }

    boolean startsLine(JavaToken token) {
        return startsLine(Syntax.begin(token));
    }
}
