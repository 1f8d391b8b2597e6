package io.rowfilter.engine;

import io.rowfilter.codegen.CodegenSession;
import io.rowfilter.codegen.FilterFunctionCompiler;
import io.rowfilter.core.RowFilterConfiguration;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.RowIndex;

/**
 * State of a single row-selection operation over a frame.
 * <p>
 * The context holds the target frame together with three index slots:
 * <ul>
 *   <li><b>source</b> - the selection expressed against the visible rows of the target;</li>
 *   <li><b>final</b> - the selection expressed against the target's storage, i.e. already
 *       composed with the target's own view index;</li>
 *   <li><b>current</b> - the index later expression evaluation reads columns through. It starts
 *       as the target's view index and becomes the final index once a row filter executes.</li>
 * </ul>
 * A context optionally carries a {@link CodegenSession}; its presence is what makes the
 * context a compiling one. Contexts are not thread-safe and serve one operation.
 */
public final class EvaluationContext {
    private final Frame frame;
    private final RowFilterConfiguration configuration;
    private final CodegenSession codegen;

    private SourceRowIndex sourceRowIndex;
    private RowIndex finalRowIndex;
    private RowIndex finalTarget;
    private boolean finalized;
    private RowIndex currentRowIndex;

    private EvaluationContext(Frame frame, RowFilterConfiguration configuration, CodegenSession codegen) {
        if (frame == null) {
            throw new IllegalArgumentException("frame required");
        }
        this.frame = frame;
        this.configuration = configuration == null ? RowFilterConfiguration.defaults() : configuration;
        this.codegen = codegen;
        this.currentRowIndex = frame.rowIndex();
    }

    /**
     * Creates a compiling context when code generation is enabled and a Java compiler is
     * available, an eager one otherwise.
     */
    public static EvaluationContext create(Frame frame, RowFilterConfiguration configuration) {
        var config = configuration == null ? RowFilterConfiguration.defaults() : configuration;
        var compiler = FilterFunctionCompiler.shared();
        if (config.codegenEnabled() && compiler.isAvailable()) {
            return new EvaluationContext(frame, config, new CodegenSession(frame, compiler));
        }
        return new EvaluationContext(frame, config, null);
    }

    public static EvaluationContext eager(Frame frame) {
        return new EvaluationContext(frame, RowFilterConfiguration.defaults(), null);
    }

    public static EvaluationContext eager(Frame frame, RowFilterConfiguration configuration) {
        return new EvaluationContext(frame, configuration, null);
    }

    /**
     * Creates a compiling context using {@code compiler}.
     */
    public static EvaluationContext compiling(Frame frame, RowFilterConfiguration configuration,
            FilterFunctionCompiler compiler) {
        if (!compiler.isAvailable()) {
            throw new IllegalStateException("No system Java compiler is available");
        }
        return new EvaluationContext(frame, configuration, new CodegenSession(frame, compiler));
    }

    public Frame frame() {
        return frame;
    }

    /**
     * Number of visible rows of the target frame.
     */
    public int nrows() {
        return frame.nrows();
    }

    /**
     * The target frame's own view index, or {@code null} if it is not a view.
     */
    public RowIndex targetRowIndex() {
        return frame.rowIndex();
    }

    public RowFilterConfiguration configuration() {
        return configuration;
    }

    public boolean isCompiling() {
        return codegen != null;
    }

    /**
     * The code generation capability of this context, or {@code null} for an eager context.
     */
    public CodegenSession codegen() {
        return codegen;
    }

    /**
     * Runs code generation for every registered node. A no-op for eager contexts.
     */
    public void prepare() {
        if (codegen != null) {
            codegen.generate();
        }
    }

    public SourceRowIndex sourceRowIndex() {
        return sourceRowIndex;
    }

    public void setSourceRowIndex(SourceRowIndex sourceRowIndex) {
        if (sourceRowIndex == null) {
            throw new IllegalArgumentException("sourceRowIndex required, use SourceRowIndex.absent()");
        }
        this.sourceRowIndex = sourceRowIndex;
    }

    /**
     * Stores the final index along with the target index it was composed against.
     *
     * @throws IllegalStateException if a final index was already stored
     */
    public void setFinalRowIndex(RowIndex finalRowIndex, RowIndex target) {
        if (finalized) {
            throw new IllegalStateException("Final row index is already set for this evaluation");
        }
        this.finalized = true;
        this.finalRowIndex = finalRowIndex;
        this.finalTarget = target;
    }

    /**
     * The final index, {@code null} meaning every stored row in storage order.
     */
    public RowIndex finalRowIndex() {
        return finalRowIndex;
    }

    /**
     * The index that was in effect on the target when the final index was stored.
     */
    public RowIndex finalTarget() {
        return finalTarget;
    }

    public boolean hasFinalRowIndex() {
        return finalized;
    }

    public RowIndex currentRowIndex() {
        return currentRowIndex;
    }

    public void setCurrentRowIndex(RowIndex currentRowIndex) {
        this.currentRowIndex = currentRowIndex;
    }

    /**
     * Frame sharing the target's storage, restricted to the final index.
     *
     * @throws IllegalStateException if no row filter has executed
     */
    public Frame resultFrame() {
        if (!finalized) {
            throw new IllegalStateException("No row filter has been executed in this context");
        }
        return frame.withRowIndex(finalRowIndex);
    }
}
