package io.rowfilter.rows;

import io.rowfilter.expr.ColumnScope;

/**
 * A rows selector computed from the frame's columns. The returned value may be any selector
 * except another {@code RowsFunction}.
 */
@FunctionalInterface
public interface RowsFunction {
    Object apply(ColumnScope f);
}
