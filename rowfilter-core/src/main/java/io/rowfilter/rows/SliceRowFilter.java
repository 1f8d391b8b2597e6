package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.RowIndexes;

/**
 * Rows {@code start + i * step} for {@code i} in {@code [0, count)}.
 * <p>
 * The step may be positive, negative or zero, but every generated row must lie in
 * {@code [0, nrows)} of the target.
 */
public final class SliceRowFilter extends RowFilter {
    private final int start;
    private final int count;
    private final int step;

    public SliceRowFilter(EvaluationContext context, int start, int count, int step) {
        super(context);
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative, got " + start);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        if (count > 0 && start + (long) (count - 1) * step < 0) {
            throw new IllegalArgumentException("slice (" + start + ", " + count + ", " + step
                    + ") produces negative rows");
        }
        this.start = start;
        this.count = count;
        this.step = step;
    }

    public int start() {
        return start;
    }

    public int count() {
        return count;
    }

    public int step() {
        return step;
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.of(RowIndexes.fromSlice(start, count, step));
    }

    @Override
    public String toString() {
        return "SliceRowFilter[start=" + start + ", count=" + count + ", step=" + step + "]";
    }
}
