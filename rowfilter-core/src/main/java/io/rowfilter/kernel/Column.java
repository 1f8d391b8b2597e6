package io.rowfilter.kernel;

/**
 * A named, fixed-length column of values.
 * <p>
 * Columns own their storage and are never mutated after construction. A view frame shares
 * its columns with its parent and addresses them through a {@link RowIndex}.
 */
public sealed interface Column permits BooleanColumn, IntColumn, DoubleColumn, StringColumn {
    String name();

    ColumnType type();

    int length();

    /**
     * Returns the boxed value at storage position {@code row}.
     */
    Object get(int row);

    /**
     * Returns the backing array; generated code reads it directly.
     */
    Object storage();

    /**
     * Copies the rows addressed by {@code index} into a new column. A {@code null} index
     * returns this column.
     */
    Column take(RowIndex index);

    /**
     * Returns a column holding the same data under another name.
     */
    Column rename(String name);
}
