package io.rowfilter.sort;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.kernel.BooleanColumn;
import io.rowfilter.kernel.Column;
import io.rowfilter.kernel.DoubleColumn;
import io.rowfilter.kernel.IntColumn;
import io.rowfilter.kernel.RowIndex;
import io.rowfilter.kernel.RowIndexes;
import io.rowfilter.kernel.StringColumn;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Stable sort of the target's visible rows by one column.
 * <p>
 * The resulting index holds storage positions: it is already expressed relative to the
 * target's view index. Parallel sorting kicks in above
 * {@code RowFilterConfiguration#parallelSortThreshold()} rows when enabled.
 */
public final class SortNode {
    private final EvaluationContext context;
    private final int columnIndex;
    private final boolean descending;

    public SortNode(EvaluationContext context, int columnIndex, boolean descending) {
        if (context == null) {
            throw new IllegalArgumentException("context required");
        }
        if (columnIndex < 0 || columnIndex >= context.frame().ncols()) {
            throw new IllegalArgumentException("Column index " + columnIndex + " is out of range for a frame with "
                    + context.frame().ncols() + " columns");
        }
        this.context = context;
        this.columnIndex = columnIndex;
        this.descending = descending;
    }

    public EvaluationContext context() {
        return context;
    }

    public int columnIndex() {
        return columnIndex;
    }

    public boolean descending() {
        return descending;
    }

    public RowIndex makeRowIndex() {
        var frame = context.frame();
        var rows = frame.rowIndex();
        var n = frame.nrows();
        var order = new Integer[n];
        for (var i = 0; i < n; i++) {
            order[i] = rows == null ? i : rows.get(i);
        }

        Comparator<Integer> comparator = comparator(frame.column(columnIndex));
        if (descending) {
            comparator = comparator.reversed();
        }
        var config = context.configuration();
        if (config.enableParallelSorting() && n >= config.parallelSortThreshold()) {
            Arrays.parallelSort(order, comparator);
        } else {
            Arrays.sort(order, comparator);
        }

        var result = new int[n];
        for (var i = 0; i < n; i++) {
            result[i] = order[i];
        }
        return RowIndexes.fromArray(result);
    }

    private static Comparator<Integer> comparator(Column column) {
        if (column instanceof BooleanColumn c) {
            return (a, b) -> Boolean.compare(c.getBoolean(a), c.getBoolean(b));
        }
        if (column instanceof IntColumn c) {
            return (a, b) -> Integer.compare(c.getInt(a), c.getInt(b));
        }
        if (column instanceof DoubleColumn c) {
            return (a, b) -> Double.compare(c.getDouble(a), c.getDouble(b));
        }
        var strings = (StringColumn) column;
        var natural = Comparator.nullsFirst(Comparator.<String>naturalOrder());
        return (a, b) -> natural.compare(strings.getString(a), strings.getString(b));
    }

    @Override
    public String toString() {
        return "SortNode[column=" + columnIndex + (descending ? ", descending" : "") + "]";
    }
}
