package io.rowfilter;

import io.rowfilter.core.RowFilterConfiguration;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.expr.Expr;
import io.rowfilter.kernel.Column;
import io.rowfilter.kernel.Frame;
import io.rowfilter.rows.RowFilter;
import io.rowfilter.rows.RowFilters;
import io.rowfilter.rows.SortedRowFilter;
import io.rowfilter.sort.SortNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for selecting rows of a frame.
 * <p>
 * Every call runs one selection in its own {@link EvaluationContext}: the selector is
 * resolved into a {@link RowFilter}, code is generated if the context compiles filters, and
 * the filter executes. Results are views sharing storage with the input frame.
 * <pre>
 * var selector = new RowSelector();
 * Frame firstTen = selector.select(frame, Rows.slice(0, 10));
 * Frame adults = selector.select(frame, (RowsFunction) f -&gt; f.col("age").ge(18));
 * </pre>
 */
public final class RowSelector {
    private static final Logger log = LoggerFactory.getLogger(RowSelector.class);

    private final RowFilterConfiguration configuration;

    public RowSelector() {
        this(RowFilterConfiguration.defaults());
    }

    public RowSelector(RowFilterConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    public RowFilterConfiguration configuration() {
        return configuration;
    }

    /**
     * Returns a view of the rows of {@code frame} addressed by {@code rows}.
     */
    public Frame select(Frame frame, Object rows) {
        return run(frame, rows, false).resultFrame();
    }

    /**
     * Returns a view of the rows of {@code frame} that {@code rows} does not address.
     */
    public Frame delete(Frame frame, Object rows) {
        return run(frame, rows, true).resultFrame();
    }

    /**
     * Returns a view of {@code frame} ordered by column {@code column}. Equal values keep
     * their relative order.
     */
    public Frame sortBy(Frame frame, String column, boolean descending) {
        var context = EvaluationContext.create(frame, configuration);
        var filter = new SortedRowFilter(new SortNode(context, frame.columnIndex(column), descending));
        filter.execute();
        return context.resultFrame();
    }

    /**
     * Evaluates {@code expr} over the rows of {@code frame} addressed by {@code rows}.
     */
    public Column evaluate(Frame frame, Object rows, Expr expr) {
        var context = run(frame, rows, false);
        return expr.evaluate(context);
    }

    private EvaluationContext run(Frame frame, Object rows, boolean negate) {
        if (frame == null) {
            throw new IllegalArgumentException("frame required");
        }
        var context = EvaluationContext.create(frame, configuration);
        var filter = RowFilters.make(rows, context);
        if (negate) {
            filter.negate();
        }
        context.prepare();
        filter.execute();
        if (log.isDebugEnabled()) {
            var selected = context.finalRowIndex() == null ? frame.storageRows() : context.finalRowIndex().size();
            log.debug("{} selected {} of {} rows", filter, selected, frame.nrows());
        }
        return context;
    }
}
