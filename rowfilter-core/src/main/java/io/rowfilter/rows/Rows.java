package io.rowfilter.rows;

import java.util.Arrays;
import java.util.List;

/**
 * Helpers for building rows selectors.
 */
public final class Rows {

    /**
     * Selects every row; equivalent to a {@code null} selector.
     */
    public static final Object ALL = Marker.ALL;

    private enum Marker {
        ALL
    }

    private Rows() {
    }

    public static Slice slice(Integer start, Integer stop) {
        return new Slice(start, stop, null);
    }

    public static Slice slice(Integer start, Integer stop, Integer step) {
        return new Slice(start, stop, step);
    }

    public static Range range(long stop) {
        return Range.of(stop);
    }

    public static Range range(long start, long stop) {
        return Range.of(start, stop);
    }

    public static Range range(long start, long stop, long step) {
        return new Range(start, stop, step);
    }

    /**
     * A list of integers, slices and ranges.
     */
    public static List<Object> of(Object... elements) {
        return Arrays.asList(elements);
    }
}
