package io.rowfilter.engine;

import io.rowfilter.core.RowFilterConfiguration;
import io.rowfilter.kernel.RowIndexes;
import io.rowfilter.testutil.TestFrames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationContextTest {

    @Test
    void shouldStartWithTargetIndexAsCurrentIndex() {
        var viewIndex = RowIndexes.fromSlice(1, 3, 2);
        var context = EvaluationContext.eager(TestFrames.view(8, viewIndex));

        assertThat(context.nrows()).isEqualTo(3);
        assertThat(context.targetRowIndex()).isSameAs(viewIndex);
        assertThat(context.currentRowIndex()).isSameAs(viewIndex);
        assertThat(context.hasFinalRowIndex()).isFalse();
    }

    @Test
    void shouldCompileWhenCodegenIsEnabled() {
        var config = RowFilterConfiguration.builder().codegenEnabled(true).build();
        var context = EvaluationContext.create(TestFrames.sequential(2), config);
        assertThat(context.isCompiling()).isTrue();
        assertThat(context.codegen()).isNotNull();
    }

    @Test
    void shouldEvaluateEagerlyWhenCodegenIsDisabled() {
        var config = RowFilterConfiguration.builder().codegenEnabled(false).build();
        var context = EvaluationContext.create(TestFrames.sequential(2), config);
        assertThat(context.isCompiling()).isFalse();
        assertThat(context.codegen()).isNull();
        context.prepare();
    }

    @Test
    void shouldRecordFinalIndexOnlyOnce() {
        var context = EvaluationContext.eager(TestFrames.sequential(4));
        var target = RowIndexes.fromSlice(0, 2, 1);
        context.setFinalRowIndex(RowIndexes.fromSlice(1, 1, 1), target);

        assertThat(context.finalTarget()).isSameAs(target);
        assertThatThrownBy(() -> context.setFinalRowIndex(null, null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldBuildResultFrameFromFinalIndex() {
        var frame = TestFrames.sequential(4);
        var context = EvaluationContext.eager(frame);
        context.setFinalRowIndex(RowIndexes.fromArray(new int[] { 3, 1 }), null);

        assertThat(TestFrames.ids(context.resultFrame())).containsExactly(3, 1);
    }

    @Test
    void shouldRejectResultFrameBeforeExecution() {
        var context = EvaluationContext.eager(TestFrames.sequential(4));
        assertThatThrownBy(context::resultFrame).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldDistinguishAbsentFromDeferredSource() {
        assertThat(SourceRowIndex.absent().isAbsent()).isTrue();
        assertThat(SourceRowIndex.deferred().isDeferred()).isTrue();
        assertThat(SourceRowIndex.deferred().isAbsent()).isFalse();
        assertThat(SourceRowIndex.of(null)).isSameAs(SourceRowIndex.absent());
        assertThat(SourceRowIndex.of(RowIndexes.empty()).kind()).isEqualTo(SourceRowIndex.Kind.KNOWN);
        assertThatThrownBy(() -> new SourceRowIndex(SourceRowIndex.Kind.KNOWN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
