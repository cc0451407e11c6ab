package com.indentlint.plugins.java;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.indentlint.plugins.java.indentation.LineFix;

/**
 * Writes line fixes into a source text.
 */
public final class FixApplier {

    private FixApplier() {
    }

    /**
     * Picks fixes in source order, skipping any that overlaps one already picked.
     */
    public static List<LineFix> selectNonOverlapping(List<LineFix> fixes) {
        List<LineFix> ordered = new ArrayList<>(fixes);
        ordered.sort(Comparator.comparingInt(LineFix::start).thenComparingInt(LineFix::end));
        List<LineFix> selected = new ArrayList<>();
        for (LineFix fix : ordered) {
            boolean overlaps = false;
            for (LineFix taken : selected) {
                if (taken.overlaps(fix)) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                selected.add(fix);
            }
        }
        return selected;
    }

    /**
     * Applies the non-overlapping subset of {@code fixes}, last offset first so earlier
     * offsets stay valid.
     */
    public static String apply(String source, List<LineFix> fixes) {
        List<LineFix> selected = selectNonOverlapping(fixes);
        selected.sort(Comparator.comparingInt(LineFix::start).reversed());
        StringBuilder result = new StringBuilder(source);
        for (LineFix fix : selected) {
            if (fix.start() < 0 || fix.end() > result.length() || fix.start() > fix.end()) {
                throw new IllegalArgumentException("Fix outside of source: " + fix);
            }
            result.replace(fix.start(), fix.end(), fix.replacement());
        }
        return result.toString();
    }
}
