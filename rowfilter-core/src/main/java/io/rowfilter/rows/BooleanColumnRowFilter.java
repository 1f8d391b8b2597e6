package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.ColumnType;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.RowIndexes;

/**
 * Selects the rows where a single-column boolean mask holds {@code true}. The mask has as
 * many rows as the target.
 */
public final class BooleanColumnRowFilter extends RowFilter {
    private final Frame mask;

    public BooleanColumnRowFilter(EvaluationContext context, Frame mask) {
        super(context);
        if (mask == null || mask.ncols() != 1 || mask.column(0).type() != ColumnType.BOOL) {
            throw new IllegalArgumentException("single boolean column required");
        }
        if (mask.nrows() != context.nrows()) {
            throw new IllegalArgumentException("mask has " + mask.nrows() + " rows, expected " + context.nrows());
        }
        this.mask = mask;
    }

    public Frame mask() {
        return mask;
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        var column = mask.materialize().column(0);
        return SourceRowIndex.of(RowIndexes.fromColumn(column));
    }

    @Override
    public String toString() {
        return "BooleanColumnRowFilter[" + mask + "]";
    }
}
