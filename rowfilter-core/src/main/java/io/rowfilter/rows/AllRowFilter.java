package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;

/**
 * Selection of all rows.
 * <p>
 * Kept apart from a full slice because it is the most common selector and because consumers
 * can skip indexing entirely when they know nothing was filtered.
 */
public final class AllRowFilter extends RowFilter {

    public AllRowFilter(EvaluationContext context) {
        super(context);
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.absent();
    }

    @Override
    public String toString() {
        return "AllRowFilter";
    }
}
