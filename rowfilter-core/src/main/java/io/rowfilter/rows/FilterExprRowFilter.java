package io.rowfilter.rows;

import io.rowfilter.codegen.CodegenNode;
import io.rowfilter.codegen.CodegenSession;
import io.rowfilter.core.SelectorTypeException;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.engine.SourceRowIndex;
import io.rowfilter.expr.Expr;
import io.rowfilter.kernel.ColumnType;
import io.rowfilter.kernel.RowIndex;
import io.rowfilter.kernel.RowIndexes;

/**
 * Selects the rows for which a boolean expression is true.
 * <p>
 * In an eager context the expression is evaluated into a mask column when the filter
 * executes, which is equivalent to a {@link BooleanColumnRowFilter} over that mask. In a
 * compiling context the filter reserves a function name, emits a loop collecting the passing
 * rows during code generation, and builds its index from the compiled function.
 * <p>
 * Either way the index is produced against the visible rows of the target, so this filter
 * negates and uplifts it itself.
 */
public final class FilterExprRowFilter extends RowFilter implements CodegenNode {
    static final String FUNCTION_PREFIX = "make_rowindex";

    private final Expr expr;
    private final String functionName;

    /**
     * @throws SelectorTypeException if {@code expr} does not produce a boolean
     */
    public FilterExprRowFilter(EvaluationContext context, Expr expr) {
        super(context);
        if (expr == null) {
            throw new IllegalArgumentException("expr required");
        }
        var type = expr.type(context.frame());
        if (type != ColumnType.BOOL) {
            throw new SelectorTypeException("Filter expression " + expr + " must be boolean, got " + type);
        }
        this.expr = expr;
        var codegen = context.codegen();
        if (codegen != null) {
            this.functionName = codegen.makeFunctionName(FUNCTION_PREFIX);
            codegen.addNode(this);
        } else {
            this.functionName = null;
        }
    }

    public Expr expr() {
        return expr;
    }

    /**
     * Name of the generated function, or {@code null} when the filter runs eagerly.
     */
    public String functionName() {
        return functionName;
    }

    public boolean isCompiled() {
        return functionName != null;
    }

    @Override
    protected SourceRowIndex makeSourceRowIndex() {
        return SourceRowIndex.deferred();
    }

    @Override
    protected RowIndex makeFinalRowIndex(SourceRowIndex source) {
        var nrows = context.nrows();
        RowIndex rowIndex;
        if (functionName != null) {
            var function = context.codegen().getResult(functionName);
            rowIndex = RowIndexes.fromFilterFunction(function, nrows, context.configuration().filterChunkSize());
        } else {
            var mask = expr.evaluate(context);
            rowIndex = RowIndexes.fromColumn(mask);
        }
        return invertAndUplift(rowIndex);
    }

    @Override
    public void generateCode(CodegenSession session) {
        var loop = session.newLoop(functionName);
        var condition = expr.toJava(loop);
        loop.addToPreamble("int j = 0;");
        loop.addToMainLoop("if (" + condition + ") {");
        loop.addToMainLoop("    out[j++] = i;");
        loop.addToMainLoop("}");
        loop.addToEpilogue("nOuts[0] = j;");
        loop.setExtraArgs("int[] out, int[] nOuts");
        loop.generate();
    }

    @Override
    public String toString() {
        return "FilterExprRowFilter[" + expr + (functionName != null ? ", " + functionName : "") + "]";
    }
}
