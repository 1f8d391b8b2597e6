package io.rowfilter.rows;

import io.rowfilter.core.SelectorValueException;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.ColumnType;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.RowIndexes;

/**
 * Treats the values of a single integer column as the positions of the rows to select.
 */
public final class IntegerColumnRowFilter extends RowFilter {
    private final Frame positions;

    public IntegerColumnRowFilter(EvaluationContext context, Frame positions) {
        super(context);
        if (positions == null || positions.ncols() != 1 || positions.column(0).type() != ColumnType.INT) {
            throw new IllegalArgumentException("single integer column required");
        }
        this.positions = positions;
    }

    public Frame positions() {
        return positions;
    }

    /**
     * @throws SelectorValueException if the column refers to a row the target does not have
     */
    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        var rowIndex = RowIndexes.fromColumn(positions.materialize().column(0));
        var nrows = context.nrows();
        if (rowIndex.max() >= nrows) {
            throw new SelectorValueException("The data column contains index " + rowIndex.max()
                    + " which is not allowed for a frame with " + RowFilters.plural(nrows, "row"));
        }
        return SourceRowIndex.of(rowIndex);
    }

    @Override
    public String toString() {
        return "IntegerColumnRowFilter[" + positions + "]";
    }
}
