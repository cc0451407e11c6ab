package com.indentlint.plugins.java;

import java.util.List;

import com.indentlint.plugins.java.indentation.LineFix;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FixApplierTests {

    private static final String SOURCE = "class A {\n  int x;\n      int y;\n}\n";

    @Test
    void testApplyReplacesLeadingWhitespace() {
        // line 1 starts at offset 10, line 2 at offset 19
        List<LineFix> fixes = List.of(
                new LineFix(1, 10, 12, "    "),
                new LineFix(2, 19, 25, "    "));
        Assertions.assertEquals("class A {\n    int x;\n    int y;\n}\n", FixApplier.apply(SOURCE, fixes));
    }

    @Test
    void testSecondFixOnSameLineIsDropped() {
        LineFix first = new LineFix(1, 10, 12, "    ");
        LineFix second = new LineFix(1, 10, 12, "        ");

        List<LineFix> selected = FixApplier.selectNonOverlapping(List.of(first, second));

        Assertions.assertEquals(1, selected.size());
        Assertions.assertSame(first, selected.get(0));
    }

    @Test
    void testSelectionIsInSourceOrder() {
        LineFix late = new LineFix(2, 19, 25, "    ");
        LineFix early = new LineFix(1, 10, 12, "    ");
        Assertions.assertEquals(List.of(early, late), FixApplier.selectNonOverlapping(List.of(late, early)));
    }

    @Test
    void testFixOutsideSourceIsRejected() {
        List<LineFix> fixes = List.of(new LineFix(9, 100, 104, ""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> FixApplier.apply(SOURCE, fixes));
    }

    @Test
    void testNoFixesLeavesSourceUntouched() {
        Assertions.assertEquals(SOURCE, FixApplier.apply(SOURCE, List.of()));
    }
}
