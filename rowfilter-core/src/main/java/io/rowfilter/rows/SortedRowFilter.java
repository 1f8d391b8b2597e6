package io.rowfilter.rows;

import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.sort.SortNode;

/**
 * Orders the target's rows by a precomputed sort.
 * <p>
 * The sort already runs against the target's visible rows and yields storage positions, so
 * its result is used as the final index directly. The target's index is only recorded next
 * to it.
 */
public final class SortedRowFilter extends RowFilter {
    private final SortNode sortNode;

    public SortedRowFilter(SortNode sortNode) {
        super(sortNode.context());
        this.sortNode = sortNode;
    }

    public SortNode sortNode() {
        return sortNode;
    }

    @Override
    public void negate() {
        throw new UnsupportedOperationException("A sorted selection cannot be negated");
    }

    @Override
    public void execute() {
        markExecuted();
        var target = context.targetRowIndex();
        var rowIndex = sortNode.makeRowIndex();
        context.setSourceRowIndex(SourceRowIndex.deferred());
        context.setFinalRowIndex(rowIndex, target);
        context.setCurrentRowIndex(rowIndex);
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.deferred();
    }

    @Override
    public String toString() {
        return "SortedRowFilter[" + sortNode + "]";
    }
}
