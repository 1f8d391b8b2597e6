package io.rowfilter;

import io.rowfilter.core.RowFilterConfiguration;
import io.rowfilter.core.SelectorValueException;
import io.rowfilter.expr.ColumnScope;
import io.rowfilter.kernel.IntColumn;
import io.rowfilter.kernel.RowIndexes;
import io.rowfilter.rows.Rows;
import io.rowfilter.rows.RowsFunction;
import io.rowfilter.testutil.TestFrames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowSelectorTest {

    private static RowSelector selector(boolean codegen) {
        return new RowSelector(RowFilterConfiguration.builder().codegenEnabled(codegen).build());
    }

    @ParameterizedTest(name = "codegen={0}")
    @ValueSource(booleans = { true, false })
    void shouldSelectRowsMatchingFunction(boolean codegen) {
        var frame = TestFrames.sequential(10);
        RowsFunction adults = f -> f.col("id").ge(7).or(f.col("name").eq("r2"));

        var result = selector(codegen).select(frame, adults);

        assertThat(TestFrames.ids(result)).containsExactly(2, 7, 8, 9);
        assertThat(result.storageRows()).isEqualTo(10);
    }

    @ParameterizedTest(name = "codegen={0}")
    @ValueSource(booleans = { true, false })
    void shouldDeleteRowsMatchingFunctionFromView(boolean codegen) {
        var view = TestFrames.view(10, RowIndexes.fromSlice(9, 5, -2));
        RowsFunction above3 = f -> f.col("id").gt(3);

        var result = selector(codegen).delete(view, above3);

        assertThat(TestFrames.ids(result)).containsExactly(3, 1);
    }

    @ParameterizedTest(name = "codegen={0}")
    @ValueSource(booleans = { true, false })
    void shouldSelectWithLongLiteral(boolean codegen) {
        RowsFunction belowHuge = f -> f.col("id").lt(5_000_000_000L);

        var result = selector(codegen).select(TestFrames.sequential(5), belowHuge);

        assertThat(TestFrames.ids(result)).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void shouldSelectFromSelection() {
        var selector = new RowSelector();
        var first = selector.select(TestFrames.sequential(20), Rows.slice(2, null, 3));
        var second = selector.select(first, List.of(-1, 0, Rows.range(1, 3)));

        assertThat(TestFrames.ids(first)).containsExactly(2, 5, 8, 11, 14, 17);
        assertThat(TestFrames.ids(second)).containsExactly(17, 2, 5, 8);
        assertThat(second.rowIndex().toIntArray()).containsExactly(17, 2, 5, 8);
    }

    @Test
    void shouldDeleteSlice() {
        var result = new RowSelector().delete(TestFrames.sequential(6), Rows.slice(null, null, 2));

        assertThat(TestFrames.ids(result)).containsExactly(1, 3, 5);
    }

    @Test
    void shouldSortView() {
        var view = TestFrames.view(6, RowIndexes.fromArray(new int[] { 4, 1, 5 }));

        var result = new RowSelector().sortBy(view, "score", true);

        assertThat(TestFrames.ids(result)).containsExactly(5, 4, 1);
    }

    @ParameterizedTest(name = "codegen={0}")
    @ValueSource(booleans = { true, false })
    void shouldEvaluateExpressionOverSelectedRows(boolean codegen) {
        var frame = TestFrames.sequential(8);
        var scope = new ColumnScope(frame);

        var column = selector(codegen).evaluate(frame, scope.col("even"), scope.col("id"));

        assertThat(column).isInstanceOf(IntColumn.class);
        assertThat(((IntColumn) column).values()).containsExactly(0, 2, 4, 6);
    }

    @Test
    void shouldPropagateSelectorErrors() {
        assertThatThrownBy(() -> new RowSelector().select(TestFrames.sequential(3), 3))
                .isInstanceOf(SelectorValueException.class)
                .hasMessage("Row `3` is invalid for a frame with 3 rows");
    }

    @Test
    void shouldRequireFrame() {
        assertThatThrownBy(() -> new RowSelector().select(null, Rows.ALL))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
