package com.indentlint.plugins.java;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.plugins.java.indentation.LineFix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SuppressionsTests {

    private static CompilationUnit parse(String source) {
        return JavaLintPlugin.parse(source).getResult().orElseThrow();
    }

    @Test
    void testOffOnCommentsBoundRegion() {
        String source = String.join("\n",
                "class Foo {",
                "    void bar() {",
                "        // CHECKSTYLE:OFF",
                "      int x = 1;",
                "        // CHECKSTYLE:ON",
                "      int y = 2;",
                "    }",
                "}",
                "");
        Suppressions suppressions = Suppressions.from(parse(source));

        Assertions.assertFalse(suppressions.isEmpty());
        Assertions.assertTrue(suppressions.isSuppressed("Indentation", 4, 7));
        Assertions.assertFalse(suppressions.isSuppressed("Indentation", 6, 7));
        Assertions.assertFalse(suppressions.isSuppressed("Indentation", 2, 5));
    }

    @Test
    void testRuleSpecificToggleOnlyAffectsThatRule() {
        String source = String.join("\n",
                "class Foo {",
                "    // CHECKSTYLE:OFF:Indentation",
                "    int x;",
                "}",
                "");
        Suppressions suppressions = Suppressions.from(parse(source));

        Assertions.assertTrue(suppressions.isSuppressed("indentation", 3, 5));
        Assertions.assertFalse(suppressions.isSuppressed("LineLength", 3, 5));
    }

    @Test
    void testUnclosedRegionRunsToEndOfFile() {
        String source = "class Foo {\n    // CHECKSTYLE:OFF\n    int x;\n}\n";
        Suppressions suppressions = Suppressions.from(parse(source));
        Assertions.assertTrue(suppressions.isSuppressed("Indentation", 4, 1));
    }

    @Test
    void testSuppressWarningsCoversDeclaration() {
        String source = String.join("\n",
                "class Foo {",
                "    @SuppressWarnings(\"checkstyle:indentation\")",
                "    void bar() {",
                "      int x = 1;",
                "    }",
                "",
                "    void baz() {",
                "      int y = 1;",
                "    }",
                "}",
                "");
        Suppressions suppressions = Suppressions.from(parse(source));

        Assertions.assertTrue(suppressions.isSuppressed("Indentation", 4, 7));
        Assertions.assertFalse(suppressions.isSuppressed("Indentation", 8, 7));
    }

    @Test
    void testSuppressWarningsAllAndArrayValues() {
        String source = String.join("\n",
                "class Foo {",
                "    @SuppressWarnings({\"unchecked\", \"all\"})",
                "    int x;",
                "}",
                "");
        Suppressions suppressions = Suppressions.from(parse(source));
        Assertions.assertTrue(suppressions.isSuppressed("Indentation", 3, 5));
    }

    @Test
    void testFilterDropsSuppressedErrorsAndTheirFixes() {
        String source = String.join("\n",
                "class Foo {",
                "    // CHECKSTYLE:OFF",
                "  int x;",
                "    // CHECKSTYLE:ON",
                "  int y;",
                "}",
                "");
        Suppressions suppressions = Suppressions.from(parse(source));
        RuleResult result = new RuleResult(
                List.of(new LintError(Severity.WARNING, "Indentation", "x", 3, 3, null),
                        new LintError(Severity.WARNING, "Indentation", "y", 5, 3, null)),
                List.of(new LineFix(2, 0, 2, "    "), new LineFix(4, 0, 2, "    ")));

        RuleResult filtered = suppressions.filter("Indentation", result);

        Assertions.assertEquals(1, filtered.getErrors().size());
        Assertions.assertEquals("y", filtered.getErrors().get(0).getMessage());
        Assertions.assertEquals(1, filtered.getFixes().size());
        Assertions.assertEquals(4, filtered.getFixes().get(0).line());
    }

    @Test
    void testNoneSuppressesNothing() {
        Suppressions none = Suppressions.none();
        Assertions.assertTrue(none.isEmpty());
        Assertions.assertFalse(none.isSuppressed("Indentation", 1, 1));
    }
}
