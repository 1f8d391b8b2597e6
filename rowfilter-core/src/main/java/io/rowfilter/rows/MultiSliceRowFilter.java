package io.rowfilter.rows;

import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.kernel.RowIndexes;

import java.util.List;

/**
 * Rows given by a list of slices; generalizes {@link SliceRowFilter} and {@link ArrayRowFilter}.
 * <p>
 * Each triple {@code (bases[i], counts[i], steps[i])} describes one slice. {@code counts} and
 * {@code steps} have equal lengths but may be shorter than {@code bases}, in which case the
 * missing entries are 1.
 */
public final class MultiSliceRowFilter extends RowFilter {
    private final List<Integer> bases;
    private final List<Integer> counts;
    private final List<Integer> steps;

    public MultiSliceRowFilter(EvaluationContext context, List<Integer> bases, List<Integer> counts,
            List<Integer> steps) {
        super(context);
        if (bases == null || counts == null || steps == null) {
            throw new IllegalArgumentException("bases, counts and steps required");
        }
        if (counts.size() != steps.size() || counts.size() > bases.size()) {
            throw new IllegalArgumentException("counts and steps must have equal lengths not exceeding bases");
        }
        this.bases = List.copyOf(bases);
        this.counts = List.copyOf(counts);
        this.steps = List.copyOf(steps);
    }

    public List<Integer> bases() {
        return bases;
    }

    public List<Integer> counts() {
        return counts;
    }

    public List<Integer> steps() {
        return steps;
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.of(RowIndexes.fromSliceList(bases, counts, steps));
    }

    @Override
    public String toString() {
        return "MultiSliceRowFilter[bases=" + bases + ", counts=" + counts + ", steps=" + steps + "]";
    }
}
