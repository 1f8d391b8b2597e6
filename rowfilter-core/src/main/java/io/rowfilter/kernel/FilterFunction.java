package io.rowfilter.kernel;

/**
 * Compiled row predicate.
 * <p>
 * Scans the visible rows {@code [row0, row1)}, writes the positions of the rows that pass
 * into {@code out} (which has room for at least {@code row1 - row0} entries) and stores the
 * number of written positions into {@code nOuts[0]}.
 */
@FunctionalInterface
public interface FilterFunction {
    void apply(int row0, int row1, int[] out, int[] nOuts);
}
