package io.rowfilter.rows;

/**
 * Range selector: the arithmetic progression {@code start, start + step, ...} stopping before
 * {@code stop}. Unlike a {@link Slice}, a range is never clamped: every generated row must
 * exist in the frame.
 */
public record Range(long start, long stop, long step) {
    public Range {
        if (step == 0) {
            throw new IllegalArgumentException("range step must not be zero");
        }
    }

    public static Range of(long stop) {
        return new Range(0, stop, 1);
    }

    public static Range of(long start, long stop) {
        return new Range(start, stop, 1);
    }

    /**
     * Number of values in the progression.
     *
     * @throws ArithmeticException if the distance between start and stop exceeds the long range
     */
    public long count() {
        if (step > 0) {
            return stop > start ? (Math.subtractExact(stop, start) - 1) / step + 1 : 0;
        }
        // divides by the negative step itself, -step overflows for Long.MIN_VALUE
        return start > stop ? -((Math.subtractExact(start, stop) - 1) / step) + 1 : 0;
    }

    @Override
    public String toString() {
        return step == 1 ? "range(" + start + ", " + stop + ")" : "range(" + start + ", " + stop + ", " + step + ")";
    }
}
