package io.rowfilter.kernel;

import io.rowfilter.core.SelectorValueException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowIndexesTest {

    @Test
    void shouldBuildSliceListWithDefaultedTrailingEntries() {
        var index = RowIndexes.fromSliceList(List.of(0, 5, 9), List.of(1, 3), List.of(1, 2));
        assertThat(index.toIntArray()).containsExactly(0, 5, 7, 9, 9);
    }

    @Test
    void shouldBuildSliceListWithoutCounts() {
        var index = RowIndexes.fromSliceList(List.of(4, 1, 3), List.of(), List.of());
        assertThat(index.toIntArray()).containsExactly(4, 1, 3);
    }

    @Test
    void shouldBuildSingleEntrySliceListAsSlice() {
        var index = RowIndexes.fromSliceList(List.of(2), List.of(4), List.of(2));
        assertThat(index.isSlice()).isTrue();
        assertThat(index.toIntArray()).containsExactly(2, 4, 6, 8);
    }

    @Test
    void shouldRejectMisalignedSliceList() {
        assertThatThrownBy(() -> RowIndexes.fromSliceList(List.of(1, 2), List.of(1), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSelectTruePositionsOfBooleanColumn() {
        var index = RowIndexes.fromColumn(new BooleanColumn("m", true, false, false, true, true));
        assertThat(index.toIntArray()).containsExactly(0, 3, 4);
    }

    @Test
    void shouldUseIntegerColumnValuesAsPositions() {
        var index = RowIndexes.fromColumn(new IntColumn("p", 4, 0, 4, 2));
        assertThat(index.toIntArray()).containsExactly(4, 0, 4, 2);
        assertThat(index.max()).isEqualTo(4);
    }

    @Test
    void shouldRejectNegativeIntegerColumnValue() {
        assertThatThrownBy(() -> RowIndexes.fromColumn(new IntColumn("p", 1, -2)))
                .isInstanceOf(SelectorValueException.class)
                .hasMessageContaining("-2");
    }

    @Test
    void shouldRejectUnsupportedColumnType() {
        assertThatThrownBy(() -> RowIndexes.fromColumn(new DoubleColumn("d", 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldInvokeFilterFunctionInChunks() {
        var calls = new ArrayList<String>();
        FilterFunction multiplesOfThree = (row0, row1, out, nOuts) -> {
            calls.add(row0 + "-" + row1);
            var j = 0;
            for (var i = row0; i < row1; i++) {
                if (i % 3 == 0) {
                    out[j++] = i;
                }
            }
            nOuts[0] = j;
        };

        var index = RowIndexes.fromFilterFunction(multiplesOfThree, 10, 4);

        assertThat(index.toIntArray()).containsExactly(0, 3, 6, 9);
        assertThat(calls).containsExactly("0-4", "4-8", "8-10");
    }

    @Test
    void shouldRejectFilterFunctionReportingTooManyRows() {
        FilterFunction broken = (row0, row1, out, nOuts) -> nOuts[0] = row1 - row0 + 1;
        assertThatThrownBy(() -> RowIndexes.fromFilterFunction(broken, 5, 2))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldHandleZeroRowsForFilterFunction() {
        FilterFunction never = (row0, row1, out, nOuts) -> {
            throw new AssertionError("must not be called");
        };
        assertThat(RowIndexes.fromFilterFunction(never, 0, 16).size()).isZero();
    }
}
