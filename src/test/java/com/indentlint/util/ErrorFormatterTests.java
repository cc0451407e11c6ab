package com.indentlint.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ErrorFormatterTests {
    private static final LintError VIOLATION = new LintError(Severity.WARNING, "Indentation",
            "'block' child has incorrect indentation level 6, expected level should be 8", 3, 7,
            "Indent with 8 spaces");

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void testFormatLocation() {
        Assertions.assertEquals(
                "src/A.java:3:7: [Indentation] 'block' child has incorrect indentation level 6, expected level should be 8",
                plain.formatLocation(Path.of("src", "A.java"), VIOLATION));
    }

    @Test
    void testFormatErrorIncludesSuggestion() {
        String formatted = plain.formatError(VIOLATION);
        Assertions.assertTrue(formatted.startsWith("WARNING: [Indentation] 'block' child"));
        Assertions.assertTrue(formatted.contains("(Line 3, Col 7)"));
        Assertions.assertTrue(formatted.endsWith("Fix: Indent with 8 spaces"));
    }

    @Test
    void testFormatErrorWithoutRuleName() {
        LintError fatal = new LintError(Severity.FATAL, "Failed to read file: A.java", 1, 1);
        Assertions.assertEquals("FATAL: Failed to read file: A.java (Line 1, Col 1)", plain.formatError(fatal));
    }

    @Test
    void testSummaryCountsPerFile() {
        Map<Path, List<LintError>> errors = new TreeMap<>();
        errors.put(Path.of("A.java"), List.of(VIOLATION, VIOLATION));
        errors.put(Path.of("B.java"), List.of(new LintError(Severity.FATAL, "broken", 1, 1)));
        errors.put(Path.of("C.java"), List.of());

        String summary = plain.formatErrorSummary(errors);

        Assertions.assertTrue(summary.contains("A.java: 2 violations\n"));
        Assertions.assertTrue(summary.contains("B.java: 1 fatal\n"));
        Assertions.assertFalse(summary.contains("C.java"));
        Assertions.assertTrue(summary.endsWith("Total: 1 fatal, 2 violations"));
    }

    @Test
    void testColorizeOnlyWhenEnabled() {
        Assertions.assertEquals("x", plain.colorize(ErrorFormatter.ANSI_RED, "x"));
        Assertions.assertEquals(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET,
                new ErrorFormatter(true).colorize(ErrorFormatter.ANSI_RED, "x"));
    }

    @Test
    void testGroupBySeverity() {
        Map<Severity, List<LintError>> grouped = plain.groupBySeverity(
                List.of(VIOLATION, new LintError(Severity.ERROR, "e", 1, 1), VIOLATION));
        Assertions.assertEquals(2, grouped.get(Severity.WARNING).size());
        Assertions.assertEquals(1, grouped.get(Severity.ERROR).size());
    }
}
