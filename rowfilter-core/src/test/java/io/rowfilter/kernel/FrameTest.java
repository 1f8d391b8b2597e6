package io.rowfilter.kernel;

import io.rowfilter.testutil.TestFrames;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameTest {

    @Test
    void shouldExposeShapeAndTypes() {
        var frame = TestFrames.sequential(4);
        assertThat(frame.nrows()).isEqualTo(4);
        assertThat(frame.ncols()).isEqualTo(4);
        assertThat(frame.isView()).isFalse();
        assertThat(frame.types()).containsExactly(ColumnType.INT, ColumnType.REAL, ColumnType.STR, ColumnType.BOOL);
        assertThat(frame.columnIndex("name")).isEqualTo(2);
    }

    @Test
    void shouldShareStorageInView() {
        var frame = TestFrames.sequential(6);
        var view = frame.withRowIndex(RowIndexes.fromSlice(5, 3, -2));
        assertThat(view.isView()).isTrue();
        assertThat(view.nrows()).isEqualTo(3);
        assertThat(view.storageRows()).isEqualTo(6);
        assertThat(view.column(0)).isSameAs(frame.column(0));
        assertThat(TestFrames.ids(view)).containsExactly(5, 3, 1);
    }

    @Test
    void shouldMaterializeVisibleRows() {
        var view = TestFrames.view(5, RowIndexes.fromArray(new int[] { 4, 0 }));
        var copy = view.materialize();
        assertThat(copy.isView()).isFalse();
        assertThat(((StringColumn) copy.column("name")).values()).containsExactly("r4", "r0");
    }

    @Test
    void shouldRejectIndexBeyondStorage() {
        var frame = TestFrames.sequential(3);
        assertThatThrownBy(() -> frame.withRowIndex(RowIndexes.fromArray(new int[] { 3 })))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectColumnsOfDifferentLengths() {
        assertThatThrownBy(() -> new Frame(List.of(new IntColumn("a", 1, 2), new IntColumn("b", 1)), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectUnknownColumn() {
        assertThatThrownBy(() -> TestFrames.sequential(1).column("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }
}
