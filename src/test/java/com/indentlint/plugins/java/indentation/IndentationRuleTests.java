package com.indentlint.plugins.java.indentation;

import java.util.List;

import com.indentlint.api.error.LintError;
import com.indentlint.api.error.Severity;
import com.indentlint.plugins.java.RuleResult;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Construct scenarios run through the whole walker.
 */
class IndentationRuleTests {

    private static final String WRAPPED_CONDITION = String.join("\n",
            "class Foo {",
            "    boolean f(boolean a, boolean b) {",
            "        if (a",
            "%s&& b) {",
            "            return true;",
            "        }",
            "        return false;",
            "    }",
            "}",
            "");

    private static String wrappedCondition(int operatorColumn) {
        return String.format(WRAPPED_CONDITION, " ".repeat(operatorColumn));
    }

    // ------------------------------------------------------------------
    // blocks and declarations
    // ------------------------------------------------------------------

    @Test
    void testWellIndentedClassIsClean() {
        String source = String.join("\n",
                "package a;",
                "",
                "import java.util.List;",
                "",
                "public class Foo {",
                "    private int x = 1;",
                "",
                "    public int bar(int y) {",
                "        if (y > 0) {",
                "            return y;",
                "        } else {",
                "            return -y;",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));
    }

    @Test
    void testMisindentedStatementInMethodBody() {
        String source = String.join("\n",
                "class Foo {",
                "    void bar() {",
                "      int x = 1;",
                "    }",
                "}",
                "");
        List<IndentViolation> violations = IndentationSources.violations(source);

        Assertions.assertEquals(1, violations.size());
        IndentViolation violation = violations.get(0);
        Assertions.assertEquals("'block' child has incorrect indentation level 6, expected level should be 8",
                violation.message());
        Assertions.assertEquals(3, violation.line());
        Assertions.assertEquals(7, violation.column());
        Assertions.assertEquals("block", violation.element());
        Assertions.assertTrue(violation.isChild());
        Assertions.assertEquals(6, violation.actual());
        Assertions.assertEquals(IndentLevel.of(8), violation.expected());
        Assertions.assertTrue(violation.fix().isPresent());
        Assertions.assertEquals(8, violation.fix().get().replacement().length());
    }

    @Test
    void testMisindentedMethodDefinition() {
        String source = String.join("\n",
                "class Foo {",
                "  void bar() {",
                "  }",
                "}",
                "");
        List<String> messages = IndentationSources.messages(source);
        Assertions.assertTrue(messages.contains(
                "2:3: 'method def' has incorrect indentation level 2, expected level should be 4"), messages.toString());
    }

    @Test
    void testBasicOffsetIsConfigurable() {
        String source = String.join("\n",
                "class Foo {",
                "  void bar() {",
                "    int x = 1;",
                "  }",
                "}",
                "");
        IndentConfig twoSpaces = IndentConfig.builder().basicOffset(2).build();
        Assertions.assertEquals(List.of(), IndentationSources.messages(source, twoSpaces));
        Assertions.assertFalse(IndentationSources.messages(source).isEmpty());
    }

    @Test
    void testTabIndentedSourceIsExpanded() {
        String source = "class Foo {\n\tvoid bar() {\n\t\tint x = 1;\n\t}\n}\n";
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));
    }

    // ------------------------------------------------------------------
    // continuation lines
    // ------------------------------------------------------------------

    @ParameterizedTest
    @ValueSource(ints = {12, 16, 20, 24})
    void testWrappedConditionIsLenient(int column) {
        Assertions.assertEquals(List.of(), IndentationSources.messages(wrappedCondition(column)));
    }

    @Test
    void testWrappedConditionBelowFloor() {
        List<IndentViolation> violations = IndentationSources.violations(wrappedCondition(10));
        Assertions.assertEquals(1, violations.size());
        Assertions.assertEquals("'expr' child has incorrect indentation level 10, expected level should be 12",
                violations.get(0).message());
        Assertions.assertEquals(4, violations.get(0).line());
    }

    @Test
    void testForceStrictConditionRequiresExactColumn() {
        IndentConfig strict = IndentConfig.builder().forceStrictCondition(true).build();
        Assertions.assertEquals(List.of(), IndentationSources.messages(wrappedCondition(12), strict));

        List<IndentViolation> violations = IndentationSources.violations(wrappedCondition(16), strict);
        Assertions.assertEquals(1, violations.size());
        Assertions.assertEquals("'expr' child has incorrect indentation level 16, expected level should be 12",
                violations.get(0).message());
    }

    // ------------------------------------------------------------------
    // switch, try, arrays, lambdas, anonymous classes
    // ------------------------------------------------------------------

    @Test
    void testSwitchCaseAtCaseIndent() {
        String source = String.join("\n",
                "class Foo {",
                "    int f(int k) {",
                "        switch (k) {",
                "            case 1:",
                "                return 1;",
                "          default:",
                "                return 0;",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("6:11: 'case' has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(source));
    }

    @Test
    void testCaseIndentIsConfigurable() {
        String source = String.join("\n",
                "class Foo {",
                "    int f(int k) {",
                "        switch (k) {",
                "        case 1:",
                "            return 1;",
                "        default:",
                "            return 0;",
                "        }",
                "    }",
                "}",
                "");
        IndentConfig flatCases = IndentConfig.builder().caseIndent(0).build();
        Assertions.assertEquals(List.of(), IndentationSources.messages(source, flatCases));
    }

    @Test
    void testMisindentedCatchKeyword() {
        String source = String.join("\n",
                "class Foo {",
                "    void f() {",
                "        try {",
                "            run();",
                "        }",
                "      catch (RuntimeException e) {",
                "            handle(e);",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("6:7: 'catch' has incorrect indentation level 6, expected level should be 8"),
                IndentationSources.messages(source));
    }

    @Test
    void testArrayInitializerElements() {
        String source = String.join("\n",
                "class Foo {",
                "    int[] values = {",
                "        1,",
                "      2",
                "    };",
                "}",
                "");
        Assertions.assertEquals(
                List.of("4:7: 'array initialization' child has incorrect indentation level 6, "
                        + "expected level should be 8"),
                IndentationSources.messages(source));
    }

    @Test
    void testLambdaBlockAcceptsTwoLevelsAndAttachesNoFix() {
        String source = String.join("\n",
                "class Foo {",
                "    void f(java.util.List<String> list) {",
                "        list.forEach(item -> {",
                "              System.out.println(item);",
                "        });",
                "    }",
                "}",
                "");
        List<IndentViolation> violations = IndentationSources.violations(source);
        Assertions.assertEquals(1, violations.size());
        Assertions.assertEquals("'block' child has incorrect indentation level 14, expected level should be 12, 16",
                violations.get(0).message());
        Assertions.assertTrue(violations.get(0).fix().isEmpty());
    }

    @Test
    void testCleanFixtureHasNoViolations() {
        String source = IndentationSources.resource("/fixtures/clean/Showcase.java");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));
    }

    @Test
    void testMisindentedFixture() {
        String source = IndentationSources.resource("/fixtures/misindented/Input.java");
        Assertions.assertEquals(List.of(
                        "13:7: 'block' child has incorrect indentation level 6, expected level should be 8",
                        "15:15: 'if' has incorrect indentation level 14, expected level should be 12",
                        "21:11: 'block rcurly' has incorrect indentation level 10, expected level should be 8"),
                IndentationSources.messages(source));
    }

    // ------------------------------------------------------------------
    // nested calls and cascading
    // ------------------------------------------------------------------

    @Test
    void testIfBodyOffByTwo() {
        String source = String.join("\n",
                "class Foo {",
                "    void f(boolean x) {",
                "        if (x) {",
                "          foo();",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("4:11: 'block' child has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(source));
    }

    @Test
    void testNestedCallArgumentAtWrapFloor() {
        String source = String.join("\n",
                "class Foo {",
                "    void f() {",
                "        foo(bar(",
                "            1));",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallow = source.replace("            1));", "          1));");
        Assertions.assertEquals(
                List.of("4:11: 'method call' child has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(shallow));
    }

    @Test
    void testContinuationFollowsMisalignedStatement() {
        String source = String.join("\n",
                "class Foo {",
                "    boolean f(boolean a, boolean b) {",
                "      if (a",
                "          && b) {",
                "            return true;",
                "        }",
                "        return false;",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("3:7: 'if' has incorrect indentation level 6, expected level should be 8"),
                IndentationSources.messages(source));
    }

    // ------------------------------------------------------------------
    // anonymous classes under a misaligned new
    // ------------------------------------------------------------------

    @Test
    void testAnonymousBodyFollowsMisalignedNew() {
        String source = String.join("\n",
                "class Foo {",
                "    void f() {",
                "          new Runnable() {",
                "              public void run() {}",
                "          };",
                "    }",
                "}",
                "");
        List<String> messages = IndentationSources.messages(source);
        Assertions.assertEquals(List.of(
                        "3:11: 'block' child has incorrect indentation level 10, expected level should be 8",
                        "5:11: 'block rcurly' child has incorrect indentation level 10, expected level should be 8, 12"),
                messages);
        Assertions.assertTrue(messages.stream().noneMatch(message -> message.startsWith("4:")));
    }

    @Test
    void testAnonymousClosingBraceAcceptedAtCleanOffsetFromNew() {
        String source = String.join("\n",
                "class Foo {",
                "    void f() {",
                "            new Runnable() {",
                "                public void run() {}",
                "            };",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("3:13: 'block' child has incorrect indentation level 12, expected level should be 8"),
                IndentationSources.messages(source));
    }

    // ------------------------------------------------------------------
    // construct catalogue
    // ------------------------------------------------------------------

    @Test
    void testTryWithResources() {
        String source = String.join("\n",
                "class Foo {",
                "    void f() throws Exception {",
                "        try (AutoCloseable in = open();",
                "             AutoCloseable out = create()) {",
                "            copy(in, out);",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallow = source.replace("             AutoCloseable out", "          AutoCloseable out");
        Assertions.assertEquals(
                List.of("4:11: 'try' child has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(shallow));
    }

    @Test
    void testRecordHeader() {
        String source = String.join("\n",
                "class Foo {",
                "    record Point(int x,",
                "                 int y) {",
                "        int sum() {",
                "            return x + y;",
                "        }",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String misplacedParen = String.join("\n",
                "class Foo {",
                "    record Point(int x,",
                "                 int y",
                "  ) {",
                "    }",
                "}",
                "");
        Assertions.assertEquals(
                List.of("4:3: 'rparen' has incorrect indentation level 2, expected level should be 4"),
                IndentationSources.messages(misplacedParen));
    }

    @Test
    void testTextBlockDelimiters() {
        String source = String.join("\n",
                "class Foo {",
                "    String query() {",
                "        String sql =",
                "            \"\"\"",
                "            select 1",
                "            \"\"\";",
                "        return sql;",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallowClosing = source.replace("            \"\"\";", "        \"\"\";");
        List<IndentViolation> violations = IndentationSources.violations(shallowClosing);
        Assertions.assertEquals(1, violations.size());
        Assertions.assertEquals("6:9: 'text block' has incorrect indentation level 8, expected level should be 12",
                violations.get(0).toString());
        Assertions.assertTrue(violations.get(0).fix().isEmpty());
    }

    @Test
    void testThrowsClause() {
        String source = String.join("\n",
                "class Foo {",
                "    void bar()",
                "        throws Exception {",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String unindented = source.replace("        throws", "throws");
        Assertions.assertEquals(
                List.of("3:1: 'throws' has incorrect indentation level 0, expected level should be 8"),
                IndentationSources.messages(unindented));
    }

    @Test
    void testMethodCallChain() {
        String source = String.join("\n",
                "class Foo {",
                "    void bar() {",
                "        Stream.of(\"a\", \"b\", \"c\")",
                "            .map(String::toUpperCase)",
                "            .forEach(System.out::println);",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallow = source.replace("            .map", "      .map");
        Assertions.assertEquals(
                List.of("4:7: 'method call' has incorrect indentation level 6, expected level should be 8"),
                IndentationSources.messages(shallow));
    }

    @Test
    void testTernaryContinuation() {
        String source = String.join("\n",
                "class Foo {",
                "    int f(boolean flag) {",
                "        int x = flag",
                "                ? 1",
                "                : 2;",
                "        return x;",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallow = source.replace("                ? 1", "          ? 1");
        Assertions.assertEquals(
                List.of("4:11: 'expr' child has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(shallow));
    }

    @Test
    void testAnnotationArrayInitializer() {
        String source = String.join("\n",
                "@SuppressWarnings({\"unchecked\", \"deprecation\"})",
                "class Foo {",
                "    @SuppressWarnings({",
                "        \"unchecked\",",
                "        \"deprecation\"",
                "    })",
                "    void bar() {",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shallow = source.replace("        \"deprecation\"", "      \"deprecation\"");
        Assertions.assertEquals(
                List.of("5:7: 'annotation array initialization' child has incorrect indentation level 6, "
                        + "expected level should be 8"),
                IndentationSources.messages(shallow));
    }

    @Test
    void testSwitchExpressionWithArrowRules() {
        String source = String.join("\n",
                "class Foo {",
                "    String name(int k) {",
                "        return switch (k) {",
                "            case 1 -> \"one\";",
                "            case 2 -> {",
                "                yield \"two\";",
                "            }",
                "            default -> \"many\";",
                "        };",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String deepCase = source.replace("            case 2 ->", "              case 2 ->");
        Assertions.assertEquals(
                List.of("5:15: 'case' has incorrect indentation level 14, expected level should be 12"),
                IndentationSources.messages(deepCase));
    }

    @Test
    void testEnumConstantBodies() {
        String source = String.join("\n",
                "enum Op {",
                "    PLUS {",
                "        int apply(int a, int b) {",
                "            return a + b;",
                "        }",
                "    },",
                "    MINUS {",
                "        int apply(int a, int b) {",
                "            return a - b;",
                "        }",
                "    };",
                "",
                "    abstract int apply(int a, int b);",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        String shiftedBrace = source.replaceFirst("\n    },", "\n      },");
        Assertions.assertEquals(
                List.of("6:7: 'block rcurly' has incorrect indentation level 6, expected level should be 4"),
                IndentationSources.messages(shiftedBrace));
    }

    // ------------------------------------------------------------------
    // options
    // ------------------------------------------------------------------

    @Test
    void testBraceAdjustmentMovesBlockChildren() {
        String source = String.join("\n",
                "class Foo {",
                "    void f(boolean x) {",
                "        if (x)",
                "          {",
                "              foo();",
                "          }",
                "    }",
                "}",
                "");
        IndentConfig adjusted = IndentConfig.builder().braceAdjustment(2).build();
        Assertions.assertEquals(List.of(), IndentationSources.messages(source, adjusted));
        Assertions.assertTrue(IndentationSources.messages(source).contains(
                "4:11: 'block lcurly' has incorrect indentation level 10, expected level should be 8"));

        String unadjustedChild = source.replace("              foo();", "            foo();");
        Assertions.assertEquals(
                List.of("5:13: 'block' child has incorrect indentation level 12, expected level should be 14"),
                IndentationSources.messages(unadjustedChild, adjusted));
    }

    @Test
    void testArrayInitIndentForVariableInitializer() {
        String source = String.join("\n",
                "class Foo {",
                "    int[] values = {",
                "      1,",
                "      2",
                "    };",
                "}",
                "");
        IndentConfig narrow = IndentConfig.builder().arrayInitIndent(2).build();
        Assertions.assertEquals(List.of(), IndentationSources.messages(source, narrow));
        Assertions.assertEquals(2, IndentationSources.messages(source).size());
    }

    @Test
    void testArrayInitIndentRebasesArrayInReturn() {
        String source = String.join("\n",
                "class Foo {",
                "    int[] f() {",
                "        return new int[] {",
                "            1,",
                "            2",
                "        };",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        IndentConfig narrow = IndentConfig.builder().arrayInitIndent(2).build();
        Assertions.assertEquals(
                List.of("6:9: 'rcurly' has incorrect indentation level 8, expected level should be 10"),
                IndentationSources.messages(source, narrow));
    }

    @Test
    void testLineWrappingIndentationRaisesConditionFloor() {
        String source = wrappedCondition(14);
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        IndentConfig wide = IndentConfig.builder().lineWrappingIndentation(8).build();
        Assertions.assertEquals(
                List.of("4:15: 'expr' child has incorrect indentation level 14, expected level should be 16"),
                IndentationSources.messages(source, wide));
        Assertions.assertEquals(List.of(), IndentationSources.messages(wrappedCondition(16), wide));
    }

    @Test
    void testThrowsIndentIsConfigurable() {
        String source = String.join("\n",
                "class Foo {",
                "    void bar()",
                "          throws Exception {",
                "    }",
                "}",
                "");
        Assertions.assertEquals(List.of(), IndentationSources.messages(source));

        IndentConfig deepThrows = IndentConfig.builder().throwsIndent(8).build();
        Assertions.assertEquals(
                List.of("3:11: 'throws' has incorrect indentation level 10, expected level should be 12"),
                IndentationSources.messages(source, deepThrows));
    }

    // ------------------------------------------------------------------
    // rule facade
    // ------------------------------------------------------------------

    @Test
    void testRuleResultCarriesWarningsAndFixes() {
        String source = IndentationSources.resource("/fixtures/misindented/Input.java");
        IndentationRule rule = new IndentationRule(IndentConfig.defaults());
        RuleResult result = rule.check(IndentationSources.parse(source), source);

        Assertions.assertEquals(3, result.getErrors().size());
        Assertions.assertEquals(3, result.getFixes().size());
        for (LintError error : result.getErrors()) {
            Assertions.assertEquals(Severity.WARNING, error.getSeverity());
            Assertions.assertEquals(IndentationRule.NAME, error.getRuleName());
            Assertions.assertNotNull(error.getSuggestion());
        }
        Assertions.assertEquals("Indent with 8 spaces", result.getErrors().get(0).getSuggestion());
        Assertions.assertTrue(rule.canAutoFix());
        Assertions.assertEquals(4, rule.getConfig().basicOffset());
    }
}
