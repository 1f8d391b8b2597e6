package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.RowIndexes;

import java.util.List;

/**
 * Rows given by an explicit list of positions. Positions are expected to be within
 * {@code [0, nrows)} already; they are not re-validated here.
 */
public final class ArrayRowFilter extends RowFilter {
    private final List<Integer> positions;

    public ArrayRowFilter(EvaluationContext context, List<Integer> positions) {
        super(context);
        if (positions == null) {
            throw new IllegalArgumentException("positions required");
        }
        this.positions = List.copyOf(positions);
    }

    public List<Integer> positions() {
        return positions;
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.of(RowIndexes.fromArray(positions));
    }

    @Override
    public String toString() {
        return "ArrayRowFilter" + positions;
    }
}
