package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.RowIndex;
import io.rowfilter.kernel.RowIndexes;

/**
 * A resolved rows selector.
 * <p>
 * A row filter computes a {@link RowIndex} and stores it into its {@link EvaluationContext}.
 * The filter is always applied to some frame, called the target. When the target is a view
 * the index computed against its visible rows (the "source" index) has to be uplifted through
 * the target's own index; the result (the "final" index) addresses the target's storage.
 * <p>
 * Instances are built by {@link RowFilters#make(Object, EvaluationContext)}, executed once and
 * discarded.
 */
public abstract sealed class RowFilter permits AllRowFilter, SliceRowFilter, ArrayRowFilter,
        MultiSliceRowFilter, BooleanColumnRowFilter, IntegerColumnRowFilter, FilterExprRowFilter,
        SortedRowFilter {

    protected final EvaluationContext context;
    private boolean inverse;
    private boolean executed;

    protected RowFilter(EvaluationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context required");
        }
        this.context = context;
    }

    public EvaluationContext context() {
        return context;
    }

    /**
     * Toggles selection of the complementary set of rows.
     */
    public void negate() {
        inverse = !inverse;
    }

    public boolean isInverse() {
        return inverse;
    }

    /**
     * Computes the source and final indices and stores them in the context. The final index
     * also becomes the context's current index.
     *
     * @throws IllegalStateException if this filter has already been executed
     */
    public void execute() {
        markExecuted();
        var source = makeSourceRowIndex();
        context.setSourceRowIndex(source);

        var target = context.targetRowIndex();
        var rowIndex = makeFinalRowIndex(source);
        context.setFinalRowIndex(rowIndex, target);
        context.setCurrentRowIndex(rowIndex);
    }

    protected final void markExecuted() {
        if (executed) {
            throw new IllegalStateException(getClass().getSimpleName() + " has already been executed");
        }
        executed = true;
    }

    /**
     * Builds the index against the visible rows of the target.
     */
    protected abstract SourceRowIndex makeSourceRowIndex();

    /**
     * Builds the index against the target's storage. An absent source selects every row, so
     * the result is the target's own index, or nothing at all when negated.
     */
    protected RowIndex makeFinalRowIndex(SourceRowIndex source) {
        if (source.isAbsent()) {
            return inverse ? RowIndexes.empty() : context.targetRowIndex();
        }
        if (source.isDeferred()) {
            throw new IllegalStateException(getClass().getSimpleName() + " must compute its final index itself");
        }
        return invertAndUplift(source.rowIndex());
    }

    /**
     * Negation happens against the visible rows of the target, before uplifting.
     */
    protected final RowIndex invertAndUplift(RowIndex rowIndex) {
        var result = inverse ? rowIndex.inverse(context.nrows()) : rowIndex;
        var target = context.targetRowIndex();
        return target == null ? result : result.uplift(target);
    }
}
