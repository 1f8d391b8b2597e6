package io.rowfilter.kernel;

import io.rowfilter.core.SelectorValueException;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Factory methods for {@link RowIndex} instances.
 */
public final class RowIndexes {
    private static final RowIndex EMPTY = new SliceRowIndex(0, 0, 0);

    private RowIndexes() {
    }

    /**
     * Index that addresses no rows.
     */
    public static RowIndex empty() {
        return EMPTY;
    }

    public static RowIndex fromSlice(int start, int count, int step) {
        if (count == 0 && start == 0 && step == 0) {
            return EMPTY;
        }
        return new SliceRowIndex(start, count, step);
    }

    public static RowIndex fromArray(int[] positions) {
        return new ArrayRowIndex(positions.clone());
    }

    public static RowIndex fromArray(List<Integer> positions) {
        var result = new int[positions.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = positions.get(i);
        }
        return new ArrayRowIndex(result);
    }

    /**
     * Builds an index out of a list of slices {@code (bases[i], counts[i], steps[i])}.
     * <p>
     * {@code counts} and {@code steps} may be shorter than {@code bases}; missing entries
     * are treated as 1.
     */
    public static RowIndex fromSliceList(List<Integer> bases, List<Integer> counts, List<Integer> steps) {
        if (counts.size() > bases.size() || steps.size() != counts.size()) {
            throw new IllegalArgumentException("counts and steps must have equal lengths not exceeding "
                    + bases.size() + ", got " + counts.size() + " and " + steps.size());
        }
        if (bases.size() == 1) {
            return fromSlice(bases.get(0), counts.isEmpty() ? 1 : counts.get(0), steps.isEmpty() ? 1 : steps.get(0));
        }
        var total = 0L;
        for (var i = 0; i < bases.size(); i++) {
            total += i < counts.size() ? counts.get(i) : 1;
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("slice list addresses too many rows: " + total);
        }
        var result = new int[(int) total];
        var k = 0;
        for (var i = 0; i < bases.size(); i++) {
            int base = bases.get(i);
            int count = i < counts.size() ? counts.get(i) : 1;
            int step = i < steps.size() ? steps.get(i) : 1;
            for (var j = 0; j < count; j++) {
                result[k++] = base + j * step;
            }
        }
        return new ArrayRowIndex(result);
    }

    /**
     * Derives an index from a single column.
     * <p>
     * A boolean column selects the positions holding {@code true}, in ascending order; an
     * integer column is used as the list of positions itself.
     *
     * @throws SelectorValueException if an integer column holds a negative value
     * @throws IllegalArgumentException for any other column type
     */
    public static RowIndex fromColumn(Column column) {
        if (column instanceof BooleanColumn mask) {
            var values = mask.values();
            var result = new IntBuffer(Math.max(16, values.length / 4));
            for (var i = 0; i < values.length; i++) {
                if (values[i]) {
                    result.add(i);
                }
            }
            return new ArrayRowIndex(result.toArray());
        }
        if (column instanceof IntColumn ints) {
            var values = ints.values();
            for (var i = 0; i < values.length; i++) {
                if (values[i] < 0) {
                    throw new SelectorValueException("Row indices in an integer column cannot be negative, got "
                            + values[i] + " at position " + i);
                }
            }
            return new ArrayRowIndex(values);
        }
        throw new IllegalArgumentException("Cannot create a row index from a column of type " + column.type());
    }

    /**
     * Builds an index by running a compiled predicate over {@code nrows} rows in chunks of
     * {@code chunkSize}.
     */
    public static RowIndex fromFilterFunction(FilterFunction function, int nrows, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        var chunk = new int[Math.min(chunkSize, Math.max(nrows, 1))];
        var nOuts = new int[1];
        var result = new IntBuffer(16);
        for (var row0 = 0; row0 < nrows; row0 += chunk.length) {
            var row1 = Math.min(nrows, row0 + chunk.length);
            nOuts[0] = 0;
            function.apply(row0, row1, chunk, nOuts);
            if (nOuts[0] < 0 || nOuts[0] > row1 - row0) {
                throw new IllegalStateException("Filter function reported " + nOuts[0]
                        + " rows for a chunk of " + (row1 - row0));
            }
            result.addAll(chunk, nOuts[0]);
        }
        return new ArrayRowIndex(result.toArray());
    }

    static void checkUplift(RowIndex child, RowIndex parent) {
        if (parent == null) {
            throw new IllegalArgumentException("parent row index required");
        }
        if (child.max() >= parent.size()) {
            throw new IllegalArgumentException("Row index refers to row " + child.max()
                    + " but the parent index has only " + parent.size() + " rows");
        }
    }

    static void checkInverse(RowIndex index, int nrows) {
        if (nrows < 0) {
            throw new IllegalArgumentException("nrows must be non-negative");
        }
        if (index.max() >= nrows) {
            throw new IllegalArgumentException("Cannot invert a row index referring to row " + index.max()
                    + " over " + nrows + " rows");
        }
    }

    static RowIndex complement(RowIndex index, int nrows) {
        var present = new BitSet(nrows);
        for (var i = 0; i < index.size(); i++) {
            present.set(index.get(i));
        }
        var result = new int[nrows - present.cardinality()];
        var k = 0;
        for (var row = present.nextClearBit(0); row < nrows; row = present.nextClearBit(row + 1)) {
            result[k++] = row;
        }
        return compact(result);
    }

    /**
     * Represents an ascending run with a constant positive stride as a slice.
     */
    static RowIndex compact(int[] positions) {
        if (positions.length == 0) {
            return EMPTY;
        }
        if (positions.length == 1) {
            return new SliceRowIndex(positions[0], 1, 1);
        }
        var step = positions[1] - positions[0];
        if (step <= 0) {
            return new ArrayRowIndex(positions);
        }
        for (var i = 2; i < positions.length; i++) {
            if (positions[i] - positions[i - 1] != step) {
                return new ArrayRowIndex(positions);
            }
        }
        return new SliceRowIndex(positions[0], positions.length, step);
    }

    static boolean sameRows(RowIndex a, RowIndex b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (var i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }

    static int rowsHash(RowIndex index) {
        var hash = 1;
        for (var i = 0; i < index.size(); i++) {
            hash = 31 * hash + index.get(i);
        }
        return hash;
    }

    private static final class IntBuffer {
        private int[] values;
        private int size;

        IntBuffer(int initialCapacity) {
            this.values = new int[initialCapacity];
        }

        void add(int value) {
            ensureCapacity(size + 1);
            values[size++] = value;
        }

        void addAll(int[] source, int length) {
            ensureCapacity(size + length);
            System.arraycopy(source, 0, values, size, length);
            size += length;
        }

        int[] toArray() {
            return Arrays.copyOf(values, size);
        }

        private void ensureCapacity(int required) {
            if (required > values.length) {
                values = Arrays.copyOf(values, Math.max(required, values.length * 2));
            }
        }
    }
}
