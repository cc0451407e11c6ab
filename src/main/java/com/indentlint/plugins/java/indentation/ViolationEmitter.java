package com.indentlint.plugins.java.indentation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.javaparser.Position;

/**
 * Collects violations for one file and decides which of them carry a fix.
 */
final class ViolationEmitter {
    private final LineIndex lines;
    private final Map<String, IndentViolation> violations = new LinkedHashMap<>();

    ViolationEmitter(LineIndex lines) {
        this.lines = lines;
    }

    void error(Position position, String element, int actual, IndentLevel expected) {
        _add(new IndentViolation(position, element, false, actual, expected, true, null));
    }

    void childError(Position position, String element, int actual, IndentLevel expected) {
        _add(new IndentViolation(position, element, true, actual, expected, true, null));
    }

    /**
     * Violation whose line must not be rewritten, e.g. the closing delimiter of a text block.
     */
    void reportOnly(Position position, String element, boolean child, int actual, IndentLevel expected) {
        _add(new IndentViolation(position, element, child, actual, expected, false, null));
    }

    private void _add(IndentViolation violation) {
        String key = violation.line() + ":" + violation.column() + ":" + violation.message();
        violations.putIfAbsent(key, violation);
    }

    /**
     * Violations in source order. A fix is attached only when the expectation is a single
     * column and the line carries no other violation.
     */
    List<IndentViolation> finish() {
        List<IndentViolation> sorted = new ArrayList<>(violations.values());
        sorted.sort(Comparator.comparingInt(IndentViolation::line).thenComparingInt(IndentViolation::column));

        Map<Integer, Integer> perLine = new HashMap<>();
        for (IndentViolation violation : sorted) {
            perLine.merge(violation.line(), 1, Integer::sum);
        }

        List<IndentViolation> result = new ArrayList<>(sorted.size());
        for (IndentViolation violation : sorted) {
            boolean single = !violation.expected().isMultiLevel() && violation.expected().firstLevel() >= 0;
            if (violation.isFixable() && single && perLine.get(violation.line()) == 1) {
                result.add(violation.withFix(_createFix(violation.line() - 1, violation.expected().firstLevel())));
            } else {
                result.add(violation);
            }
        }
        return result;
    }

    private LineFix _createFix(int line, int expected) {
        int start = lines.lineOffset(line);
        int end = lines.leadingWhitespaceEnd(line);
        return new LineFix(line, start, end, " ".repeat(expected));
    }
}
