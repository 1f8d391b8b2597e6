package io.rowfilter.kernel;

import java.util.Arrays;

/**
 * Row index backed by an explicit array of positions.
 */
public final class ArrayRowIndex implements RowIndex {
    private final int[] positions;
    private final int max;

    /**
     * Takes ownership of {@code positions}; callers must not modify the array afterwards.
     */
    ArrayRowIndex(int[] positions) {
        var m = -1;
        for (var position : positions) {
            if (position < 0) {
                throw new IllegalArgumentException("row position must be non-negative, got " + position);
            }
            if (position > m) {
                m = position;
            }
        }
        this.positions = positions;
        this.max = m;
    }

    @Override
    public int size() {
        return positions.length;
    }

    @Override
    public int get(int i) {
        return positions[i];
    }

    @Override
    public int max() {
        return max;
    }

    @Override
    public int[] toIntArray() {
        return positions.clone();
    }

    @Override
    public boolean isSlice() {
        return false;
    }

    @Override
    public RowIndex uplift(RowIndex parent) {
        RowIndexes.checkUplift(this, parent);
        var result = new int[positions.length];
        for (var i = 0; i < positions.length; i++) {
            result[i] = parent.get(positions[i]);
        }
        return new ArrayRowIndex(result);
    }

    @Override
    public RowIndex inverse(int nrows) {
        RowIndexes.checkInverse(this, nrows);
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
        if (positions.length <= 16) {
            return "ArrayRowIndex" + Arrays.toString(positions);
        }
        return "ArrayRowIndex[size=" + positions.length + ", max=" + max + "]";
    }
}
