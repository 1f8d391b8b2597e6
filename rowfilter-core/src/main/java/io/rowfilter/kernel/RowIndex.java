package io.rowfilter.kernel;

/**
 * Immutable addressing of a subset (or permutation) of a frame's rows.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Positions are ordered; duplicates are allowed (a zero-step slice repeats one row).</li>
 *   <li>Instances are never mutated after construction and may be shared between frames and threads.</li>
 *   <li>Two indices are equal when they address the same positions in the same order,
 *       regardless of representation.</li>
 * </ul>
 */
public sealed interface RowIndex permits SliceRowIndex, ArrayRowIndex {

    /**
     * Returns the number of addressed rows.
     */
    int size();

    /**
     * Returns the row position stored at {@code i}.
     *
     * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
     */
    int get(int i);

    /**
     * Returns the largest addressed position, or -1 for an empty index.
     */
    int max();

    /**
     * Returns a snapshot array of all positions in order.
     */
    int[] toIntArray();

    /**
     * Whether this index is stored as a {@code (start, count, step)} triple.
     */
    boolean isSlice();

    /**
     * Reinterprets this index's positions as positions within {@code parent}.
     * <p>
     * The returned index addresses {@code parent.get(get(i))} for every {@code i}, which makes
     * it valid against the frame that {@code parent} itself indexes.
     *
     * @param parent the index of the view this index was computed against
     * @return the composed index
     * @throws IllegalArgumentException if a position of this index is not below {@code parent.size()}
     */
    RowIndex uplift(RowIndex parent);

    /**
     * Returns the ascending complement of this index over {@code [0, nrows)}.
     *
     * @throws IllegalArgumentException if a position of this index is not below {@code nrows}
     */
    RowIndex inverse(int nrows);
}
