package io.rowfilter.sort;

import io.rowfilter.core.RowFilterConfiguration;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.kernel.DoubleColumn;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.IntColumn;
import io.rowfilter.kernel.RowIndexes;
import io.rowfilter.kernel.StringColumn;
import io.rowfilter.rows.SortedRowFilter;
import io.rowfilter.testutil.TestFrames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortNodeTest {

    private static Frame keyed(int... keys) {
        return Frame.of(new IntColumn("key", keys), new IntColumn("id", IntStream.range(0, keys.length).toArray()));
    }

    private static int[] sorted(EvaluationContext context, int column, boolean descending) {
        return new SortNode(context, column, descending).makeRowIndex().toIntArray();
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        void shouldKeepTiesInOriginalOrder() {
            var context = EvaluationContext.eager(keyed(3, 1, 3, 2, 1));

            assertThat(sorted(context, 0, false)).containsExactly(1, 4, 3, 0, 2);
        }

        @Test
        void shouldKeepTiesInOriginalOrderWhenDescending() {
            var context = EvaluationContext.eager(keyed(3, 1, 3, 2, 1));

            assertThat(sorted(context, 0, true)).containsExactly(0, 2, 3, 1, 4);
        }

        @Test
        void shouldPlaceMissingStringsFirst() {
            var frame = Frame.of(new StringColumn("s", "b", null, "a"));

            assertThat(sorted(EvaluationContext.eager(frame), 0, false)).containsExactly(1, 2, 0);
        }

        @Test
        void shouldSortDoubles() {
            var frame = Frame.of(new DoubleColumn("x", 2.5, -1.0, 0.0));

            assertThat(sorted(EvaluationContext.eager(frame), 0, true)).containsExactly(0, 2, 1);
        }

        @Test
        void shouldReturnStoragePositionsOfView() {
            var context = EvaluationContext.eager(TestFrames.view(12, RowIndexes.fromSlice(11, 4, -2)));

            assertThat(sorted(context, context.frame().columnIndex("id"), false)).containsExactly(5, 7, 9, 11);
        }

        @Test
        void shouldMatchSequentialResultWhenSortingInParallel() {
            var keys = IntStream.range(0, 5000).map(i -> (i * 31) % 7).toArray();
            var parallel = RowFilterConfiguration.builder().parallelSortThreshold(1).build();
            var sequential = RowFilterConfiguration.builder().enableParallelSorting(false).build();

            var expected = sorted(EvaluationContext.eager(keyed(keys), sequential), 0, false);
            assertThat(sorted(EvaluationContext.eager(keyed(keys), parallel), 0, false)).containsExactly(expected);
        }
    }

    @Test
    void shouldRejectUnknownColumn() {
        var context = EvaluationContext.eager(keyed(1, 2));

        assertThatThrownBy(() -> new SortNode(context, 2, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
    }

    @Nested
    @DisplayName("Sorted row filter")
    class Filter {

        @Test
        void shouldStoreSortIndexAsFinalIndex() {
            var viewIndex = RowIndexes.fromSlice(11, 4, -2);
            var context = EvaluationContext.eager(TestFrames.view(12, viewIndex));
            new SortedRowFilter(new SortNode(context, context.frame().columnIndex("id"), true)).execute();

            assertThat(context.sourceRowIndex().isDeferred()).isTrue();
            assertThat(context.finalRowIndex().toIntArray()).containsExactly(11, 9, 7, 5);
            assertThat(context.finalTarget()).isSameAs(viewIndex);
            assertThat(context.currentRowIndex()).isSameAs(context.finalRowIndex());
        }

        @Test
        void shouldNotBeNegatable() {
            var filter = new SortedRowFilter(new SortNode(EvaluationContext.eager(keyed(1)), 0, false));

            assertThatThrownBy(filter::negate).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void shouldExecuteOnlyOnce() {
            var filter = new SortedRowFilter(new SortNode(EvaluationContext.eager(keyed(2, 1)), 0, false));
            filter.execute();

            assertThatThrownBy(filter::execute).isInstanceOf(IllegalStateException.class);
        }
    }
}
