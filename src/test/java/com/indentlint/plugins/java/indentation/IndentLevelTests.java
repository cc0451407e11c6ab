package com.indentlint.plugins.java.indentation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class IndentLevelTests {

    // ------------------------------------------------------------------
    // construction and offsets
    // ------------------------------------------------------------------

    @Test
    void testSingleLevel() {
        IndentLevel level = IndentLevel.of(8);
        Assertions.assertFalse(level.isMultiLevel());
        Assertions.assertEquals(8, level.firstLevel());
        Assertions.assertEquals(8, level.lastLevel());
        Assertions.assertEquals("8", level.toString());
    }

    @Test
    void testMembersAreSortedAndDistinct() {
        IndentLevel level = IndentLevel.of(12, 4, 8, 4);
        Assertions.assertEquals("4, 8, 12", level.toString());
        Assertions.assertEquals(4, level.firstLevel());
        Assertions.assertEquals(12, level.lastLevel());
    }

    @Test
    void testWithOffsetShiftsEveryMember() {
        IndentLevel level = IndentLevel.of(0, 4).withOffset(4);
        Assertions.assertEquals(IndentLevel.of(4, 8), level);
    }

    @Test
    void testWithOffsetsIsUnionOfShifts() {
        IndentLevel level = IndentLevel.of(4).withOffsets(0, 4, 8);
        Assertions.assertEquals("4, 8, 12", level.toString());
    }

    @Test
    void testCombineAndAddAcceptable() {
        IndentLevel combined = IndentLevel.of(4).combine(IndentLevel.of(8)).addAcceptable(8, 2);
        Assertions.assertEquals("2, 4, 8", combined.toString());
        Assertions.assertTrue(combined.isMultiLevel());
    }

    // ------------------------------------------------------------------
    // acceptance
    // ------------------------------------------------------------------

    @Test
    void testExactAcceptance() {
        IndentLevel level = IndentLevel.of(4, 8);
        Assertions.assertTrue(level.isAcceptable(4));
        Assertions.assertTrue(level.isAcceptable(8));
        Assertions.assertFalse(level.isAcceptable(6));
        Assertions.assertFalse(level.isAcceptable(12));
    }

    @Test
    void testLenientAcceptanceUsesMinimum() {
        IndentLevel level = IndentLevel.of(8, 12);
        Assertions.assertTrue(level.isAcceptable(8, false));
        Assertions.assertTrue(level.isAcceptable(10, false));
        Assertions.assertTrue(level.isAcceptable(40, false));
        Assertions.assertFalse(level.isAcceptable(7, false));
    }

    @Test
    void testForceStrictFallsBackToExact() {
        IndentLevel level = IndentLevel.of(8, 12);
        Assertions.assertFalse(level.isAcceptable(10, true));
        Assertions.assertTrue(level.isAcceptable(12, true));
    }

    @Test
    void testLenientAcceptanceIsMonotonic() {
        IndentLevel level = IndentLevel.of(6);
        boolean accepted = false;
        for (int column = 0; column < 40; column++) {
            boolean now = level.isAcceptable(column, false);
            if (accepted) {
                Assertions.assertTrue(now, "column " + column + " rejected after a smaller one was accepted");
            }
            accepted = now;
        }
        Assertions.assertTrue(accepted);
    }

    @Test
    void testIsGreaterThan() {
        IndentLevel level = IndentLevel.of(8, 12);
        Assertions.assertTrue(level.isGreaterThan(4));
        Assertions.assertFalse(level.isGreaterThan(8));
    }
}
