package com.indentlint.plugins.java;

import java.nio.file.Path;
import java.util.List;

import com.indentlint.api.AppliedFix;
import com.indentlint.api.CheckResult;
import com.indentlint.api.error.Severity;
import com.indentlint.config.ConfigurationLoader;
import com.indentlint.config.LintConfig;
import com.indentlint.plugins.java.indentation.IndentationRule;
import com.indentlint.plugins.java.indentation.IndentViolation;
import com.indentlint.plugins.java.indentation.IndentationSources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JavaLintPluginTests {
    private static final Path FILE = Path.of("src", "Input.java");

    private static final String SHOWCASE = "/fixtures/clean/Showcase.java";

    private JavaLintPlugin plugin;

    @BeforeEach
    void setup() {
        plugin = new JavaLintPlugin();
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
    }

    @AfterEach
    void tearDown() {
        plugin.close();
    }

    // ------------------------------------------------------------------
    // check
    // ------------------------------------------------------------------

    @Test
    void testIndentationRuleEnabledByDefault() {
        Assertions.assertEquals(1, plugin.getRules().size());
        Assertions.assertEquals(IndentationRule.NAME, plugin.getRules().get(0).getName());
        Assertions.assertNotNull(plugin.getConfig());
    }

    @Test
    void testCheckReportsWarningsButSucceeds() {
        String source = IndentationSources.resource("/fixtures/misindented/Input.java");
        CheckResult result = plugin.check(FILE, source);

        Assertions.assertTrue(result.isSuccessful());
        Assertions.assertEquals(3, result.getErrors().size());
        Assertions.assertEquals(source, result.getFixedCode());
        Assertions.assertTrue(result.getAppliedFixes().isEmpty());
    }

    @Test
    void testCheckIsStableAcrossCachedCalls() {
        String source = IndentationSources.resource("/fixtures/misindented/Input.java");
        CheckResult first = plugin.check(FILE, source);
        CheckResult second = plugin.check(FILE, source);
        Assertions.assertEquals(first.getErrors().size(), second.getErrors().size());
    }

    @Test
    void testCacheIgnoresTreeOfDifferentSourceWithSameHash() {
        String clean = "class Cached {\n    int x;\n}\n// tkzlfkti\n";
        String extraLine = "class Cached {\n    int x;\n  int y;\n}\n// yjywwzms\n";
        Assertions.assertEquals(clean.hashCode(), extraLine.hashCode());

        Assertions.assertFalse(plugin.check(FILE, clean).hasViolations());
        CheckResult result = plugin.check(FILE, extraLine);
        Assertions.assertEquals(1, result.getErrors().size());
        Assertions.assertEquals(3, result.getErrors().get(0).getLine());
    }

    @Test
    void testParseErrorIsFatal() {
        CheckResult result = plugin.check(FILE, "class Foo { void bar( }");

        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(1, result.getErrors().size());
        Assertions.assertEquals(Severity.FATAL, result.getErrors().get(0).getSeverity());
        Assertions.assertTrue(result.getErrors().get(0).getMessage().startsWith("Failed to parse Java source code: "));
    }

    @Test
    void testDisabledRuleReportsNothing() {
        LintConfig config = ConfigurationLoader.loadDefaultConfig()
                .withRuleOption(ConfigurationLoader.INDENTATION_RULE, "enabled", false);
        JavaLintPlugin disabled = new JavaLintPlugin();
        disabled.initialize(config);

        String source = IndentationSources.resource("/fixtures/misindented/Input.java");
        Assertions.assertTrue(disabled.getRules().isEmpty());
        Assertions.assertFalse(disabled.check(FILE, source).hasViolations());
        disabled.close();
    }

    @Test
    void testSuppressionCommentsAreHonoured() {
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
        CheckResult result = plugin.check(FILE, source);
        Assertions.assertEquals(1, result.getErrors().size());
        Assertions.assertEquals(6, result.getErrors().get(0).getLine());
    }

    @Test
    void testSuppressionCanBeSwitchedOff() {
        LintConfig config = ConfigurationLoader.loadDefaultConfig()
                .withGeneralOption("commentSuppression", false);
        JavaLintPlugin strict = new JavaLintPlugin();
        strict.initialize(config);

        String source = "class Foo {\n    // CHECKSTYLE:OFF\n  int x;\n}\n";
        Assertions.assertEquals(1, strict.check(FILE, source).getErrors().size());
        Assertions.assertEquals(0, plugin.check(FILE, source).getErrors().size());
        strict.close();
    }

    // ------------------------------------------------------------------
    // fix
    // ------------------------------------------------------------------

    @Test
    void testFixProducesExpectedSource() {
        String input = IndentationSources.resource("/fixtures/misindented/Input.java");
        String expected = IndentationSources.resource("/fixtures/misindented/Expected.java");

        CheckResult result = plugin.fix(FILE, input);

        Assertions.assertTrue(result.isSuccessful());
        Assertions.assertEquals(expected, result.getFixedCode());
        Assertions.assertTrue(result.getErrors().isEmpty());

        List<AppliedFix> applied = result.getAppliedFixes();
        Assertions.assertEquals(3, applied.size());
        Assertions.assertEquals(List.of(13, 15, 21), applied.stream().map(AppliedFix::getLine).toList());
        for (AppliedFix fix : applied) {
            Assertions.assertEquals(IndentationRule.NAME, fix.getRuleName());
        }
    }

    @Test
    void testFixIsIdempotent() {
        String expected = IndentationSources.resource("/fixtures/misindented/Expected.java");
        CheckResult result = plugin.fix(FILE, expected);

        Assertions.assertEquals(expected, result.getFixedCode());
        Assertions.assertTrue(result.getAppliedFixes().isEmpty());
    }

    @Test
    void testUnfixableViolationSurvivesFix() {
        String source = String.join("\n",
                "class Foo {",
                "    void f(java.util.List<String> list) {",
                "        list.forEach(item -> {",
                "              System.out.println(item);",
                "        });",
                "    }",
                "}",
                "");
        CheckResult result = plugin.fix(FILE, source);

        Assertions.assertEquals(source, result.getFixedCode());
        Assertions.assertEquals(1, result.getErrors().size());
    }

    @ParameterizedTest
    @CsvSource({
            "6, 2", "7, -2", "12, -2", "14, 2", "15, -2", "21, 2", "23, -2",
            "24, -6", "28, 2", "29, -2", "33, 2", "35, -2", "37, 2", "40, 6"
    })
    void testFixOfShiftedLineIsStable(int line, int shift) {
        String perturbed = shiftLine(IndentationSources.resource(SHOWCASE), line, shift);

        CheckResult fixed = plugin.fix(FILE, perturbed);
        Assertions.assertTrue(fixed.isSuccessful());

        String once = fixed.getFixedCode();
        Assertions.assertEquals(once, plugin.fix(FILE, once).getFixedCode());
        for (IndentViolation violation : IndentationSources.violations(once)) {
            Assertions.assertTrue(violation.fix().isEmpty(), violation.toString());
        }
    }

    @Test
    void testFixRestoresSeveralShiftedLines() {
        String original = IndentationSources.resource(SHOWCASE);
        String perturbed = original;
        perturbed = shiftLine(perturbed, 7, -2);
        perturbed = shiftLine(perturbed, 25, -2);
        perturbed = shiftLine(perturbed, 29, 2);
        perturbed = shiftLine(perturbed, 34, 2);
        perturbed = shiftLine(perturbed, 40, -2);
        Assertions.assertNotEquals(original, perturbed);

        CheckResult result = plugin.fix(FILE, perturbed);

        Assertions.assertEquals(original, result.getFixedCode());
        Assertions.assertEquals(5, result.getAppliedFixes().size());
        Assertions.assertTrue(result.getErrors().isEmpty());
    }

    private static String shiftLine(String source, int line, int shift) {
        String[] lines = source.split("\n", -1);
        String text = lines[line - 1];
        lines[line - 1] = shift >= 0 ? " ".repeat(shift) + text : text.substring(-shift);
        return String.join("\n", lines);
    }

    @Test
    void testFixOnUnparsableSourceKeepsInput() {
        String source = "class Foo {";
        CheckResult result = plugin.fix(FILE, source);
        Assertions.assertFalse(result.isSuccessful());
        Assertions.assertEquals(source, result.getFixedCode());
    }
}
