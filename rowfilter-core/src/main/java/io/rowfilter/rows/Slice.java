package io.rowfilter.rows;

/**
 * Slice selector with half-open {@code [start, stop)} semantics.
 * <p>
 * Any bound may be {@code null}; negative bounds count from the end and out-of-range bounds
 * are clamped. A zero {@code step} selects row {@code start} repeated {@code stop} times.
 * Bounds are kept as {@link Number}s so that a non-integral bound can be reported.
 */
public record Slice(Number start, Number stop, Number step) {

    public static Slice of(Integer start, Integer stop) {
        return new Slice(start, stop, null);
    }

    public static Slice of(Integer start, Integer stop, Integer step) {
        return new Slice(start, stop, step);
    }

    @Override
    public String toString() {
        return "slice(" + start + ", " + stop + ", " + step + ")";
    }
}
