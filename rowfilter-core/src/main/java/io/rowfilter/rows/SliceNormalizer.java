package io.rowfilter.rows;

import io.rowfilter.core.SelectorValueException;

/**
 * Converts {@link Slice} and {@link Range} selectors into {@code (start, count, step)} triples
 * against a known number of rows.
 */
final class SliceNormalizer {

    record Triple(int start, int count, int step) {
    }

    private static final Triple EMPTY = new Triple(0, 0, 1);

    private SliceNormalizer() {
    }

    static Triple normalize(Slice slice, int nrows) {
        var start = integral(slice, slice.start());
        var stop = integral(slice, slice.stop());
        var step = integral(slice, slice.step());
        if (step == null) {
            step = 1L;
        }

        if (step == 0) {
            // (start, count, 0) repeats a single row
            if (start != null && stop != null && start >= 0 && stop >= 0 && stop <= Integer.MAX_VALUE) {
                if (start < nrows) {
                    return new Triple(start.intValue(), stop.intValue(), 0);
                }
                if (stop == 0) {
                    return new Triple(0, 0, 0);
                }
            }
            throw new SelectorValueException("Invalid " + slice + " for a frame with " + RowFilters.plural(nrows, "row"));
        }

        long lower = step > 0 ? 0 : -1;
        long upper = step > 0 ? nrows : nrows - 1L;
        long first = clamp(start, step > 0 ? lower : upper, lower, upper, nrows);
        long last = clamp(stop, step > 0 ? upper : lower, lower, upper, nrows);

        long count;
        if (step > 0) {
            count = last > first ? (last - first - 1) / step + 1 : 0;
        } else {
            count = first > last ? (first - last - 1) / -step + 1 : 0;
        }
        if (count == 0) {
            return EMPTY;
        }
        return new Triple((int) first, (int) count, (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, step)));
    }

    /**
     * Returns {@code null} if the range refers to rows outside of the frame.
     */
    static Triple normalize(Range range, int nrows) {
        long count;
        try {
            count = range.count();
        } catch (ArithmeticException e) {
            // wider than any frame
            return null;
        }
        if (count == 0) {
            return EMPTY;
        }
        if (count > nrows) {
            return null;
        }
        var start = range.start();
        var finish = start + (count - 1) * range.step();
        if (start >= 0) {
            if (start >= nrows || finish < 0 || finish >= nrows) {
                return null;
            }
        } else {
            start += nrows;
            finish += nrows;
            if (start < 0 || finish < 0 || finish >= nrows) {
                return null;
            }
        }
        return new Triple((int) start, (int) count, (int) range.step());
    }

    private static long clamp(Long bound, long fallback, long lower, long upper, int nrows) {
        if (bound == null) {
            return fallback;
        }
        long value = bound;
        if (value < 0) {
            value += nrows;
            return Math.max(value, lower);
        }
        return Math.min(value, upper);
    }

    private static Long integral(Slice slice, Number bound) {
        if (bound == null) {
            return null;
        }
        if (bound instanceof Integer || bound instanceof Long || bound instanceof Short || bound instanceof Byte) {
            return bound.longValue();
        }
        throw new SelectorValueException(slice + " is not integer-valued");
    }
}
