package io.rowfilter.expr;

import io.rowfilter.kernel.Frame;

/**
 * Column namespace handed to row functions, conventionally named {@code f}:
 * <pre>
 * RowSelector.select(frame, (RowsFunction) f -&gt; f.col("price").gt(100));
 * </pre>
 */
public final class ColumnScope {
    private final Frame frame;

    public ColumnScope(Frame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame required");
        }
        this.frame = frame;
    }

    public Expr.ColumnRef col(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name required");
        }
        return new Expr.ColumnRef(name, -1);
    }

    public Expr.ColumnRef col(int index) {
        return new Expr.ColumnRef(null, index);
    }

    /**
     * Number of visible rows in the frame being selected from.
     */
    public int nrows() {
        return frame.nrows();
    }

    public Frame frame() {
        return frame;
    }
}
