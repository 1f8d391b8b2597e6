package io.rowfilter.kernel;

/**
 * Row index described by a {@code (start, count, step)} triple, addressing
 * {@code start + i * step} for {@code i} in {@code [0, count)}.
 * <p>
 * The step may be negative or zero; a zero step repeats {@code start} {@code count} times.
 */
public final class SliceRowIndex implements RowIndex {
    private final int start;
    private final int count;
    private final int step;

    SliceRowIndex(int start, int count, int step) {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
        if (count > 0 && start + (long) (count - 1) * step < 0) {
            throw new IllegalArgumentException(
                    "slice (" + start + ", " + count + ", " + step + ") produces negative positions");
        }
        this.start = start;
        this.count = count;
        this.step = step;
    }

    public int start() {
        return start;
    }

    public int count() {
        return count;
    }

    public int step() {
        return step;
    }

    @Override
    public int size() {
        return count;
    }

    @Override
    public int get(int i) {
        if (i < 0 || i >= count) {
            throw new IndexOutOfBoundsException("Index " + i + " out of bounds for slice of " + count + " rows");
        }
        return start + i * step;
    }

    @Override
    public int max() {
        if (count == 0) {
            return -1;
        }
        return step >= 0 ? start + (count - 1) * step : start;
    }

    @Override
    public int[] toIntArray() {
        var result = new int[count];
        for (var i = 0; i < count; i++) {
            result[i] = start + i * step;
        }
        return result;
    }

    @Override
    public boolean isSlice() {
        return true;
    }

    @Override
    public RowIndex uplift(RowIndex parent) {
        RowIndexes.checkUplift(this, parent);
        if (count == 0) {
            return RowIndexes.empty();
        }
        if (parent instanceof SliceRowIndex p) {
            // slice of a slice stays a slice
            return new SliceRowIndex(p.start + start * p.step, count, step * p.step);
        }
        var result = new int[count];
        for (var i = 0; i < count; i++) {
            result[i] = parent.get(start + i * step);
        }
        return new ArrayRowIndex(result);
    }

    @Override
    public RowIndex inverse(int nrows) {
        RowIndexes.checkInverse(this, nrows);
        if (step == 1 || count <= 1) {
            // contiguous run: the complement is at most two runs
            var end = start + count;
            if (count == 0) {
                return RowIndexes.fromSlice(0, nrows, 1);
            }
            if (start == 0) {
                return RowIndexes.fromSlice(end, nrows - end, 1);
            }
            if (end == nrows) {
                return RowIndexes.fromSlice(0, start, 1);
            }
        }
        return RowIndexes.complement(this, nrows);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof RowIndex other && RowIndexes.sameRows(this, other);
    }

    @Override
    public int hashCode() {
        return RowIndexes.rowsHash(this);
    }

    @Override
    public String toString() {
        return "SliceRowIndex[start=" + start + ", count=" + count + ", step=" + step + "]";
    }
}
