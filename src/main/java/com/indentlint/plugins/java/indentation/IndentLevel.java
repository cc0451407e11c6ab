package com.indentlint.plugins.java.indentation;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Immutable set of acceptable indentation columns for one check point.
 * <p>
 * Two acceptance modes are supported: exact membership, used for strict checks, and
 * "at least the smallest member", used for lenient continuation checks.
 */
public final class IndentLevel {
    private final int[] levels;

    private IndentLevel(int[] sortedDistinct) {
        this.levels = sortedDistinct;
    }

    public static IndentLevel of(int level) {
        return new IndentLevel(new int[]{level});
    }

    public static IndentLevel of(int first, int... more) {
        int[] all = new int[more.length + 1];
        all[0] = first;
        System.arraycopy(more, 0, all, 1, more.length);
        return new IndentLevel(_normalize(all));
    }

    /**
     * Every member shifted by {@code offset}.
     */
    public IndentLevel withOffset(int offset) {
        int[] shifted = new int[levels.length];
        for (int i = 0; i < levels.length; i++) {
            shifted[i] = levels[i] + offset;
        }
        return new IndentLevel(shifted);
    }

    /**
     * Union of this level shifted by each offset in turn.
     */
    public IndentLevel withOffsets(int... offsets) {
        int[] all = new int[levels.length * offsets.length];
        int i = 0;
        for (int offset : offsets) {
            for (int level : levels) {
                all[i++] = level + offset;
            }
        }
        return new IndentLevel(_normalize(all));
    }

    public IndentLevel addAcceptable(int... extra) {
        int[] all = Arrays.copyOf(levels, levels.length + extra.length);
        System.arraycopy(extra, 0, all, levels.length, extra.length);
        return new IndentLevel(_normalize(all));
    }

    public IndentLevel combine(IndentLevel other) {
        return addAcceptable(other.levels);
    }

    /**
     * Exact membership.
     */
    public boolean isAcceptable(int indent) {
        return Arrays.binarySearch(levels, indent) >= 0;
    }

    /**
     * Exact membership when {@code forceStrict}, otherwise {@code indent >= firstLevel()}.
     */
    public boolean isAcceptable(int indent, boolean forceStrict) {
        if (forceStrict) {
            return isAcceptable(indent);
        }
        return indent >= firstLevel();
    }

    /**
     * True when every member lies beyond {@code indent}.
     */
    public boolean isGreaterThan(int indent) {
        return firstLevel() > indent;
    }

    public boolean isMultiLevel() {
        return levels.length > 1;
    }

    public int firstLevel() {
        return levels.length == 0 ? 0 : levels[0];
    }

    public int lastLevel() {
        return levels.length == 0 ? 0 : levels[levels.length - 1];
    }

    private static int[] _normalize(int[] values) {
        return Arrays.stream(values).sorted().distinct().toArray();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndentLevel && Arrays.equals(levels, ((IndentLevel) o).levels);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(levels);
    }

    @Override
    public String toString() {
        return Arrays.stream(levels).mapToObj(Integer::toString).collect(Collectors.joining(", "));
    }
}
