package io.rowfilter.rows;

import io.rowfilter.core.SelectorValueException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SliceNormalizerTest {

    static Stream<Arguments> slices() {
        return Stream.of(
                Arguments.of(Rows.slice(null, null), 10, new SliceNormalizer.Triple(0, 10, 1)),
                Arguments.of(Rows.slice(2, 8, 3), 10, new SliceNormalizer.Triple(2, 2, 3)),
                Arguments.of(Rows.slice(-3, null), 10, new SliceNormalizer.Triple(7, 3, 1)),
                Arguments.of(Rows.slice(-30, 30), 10, new SliceNormalizer.Triple(0, 10, 1)),
                Arguments.of(Rows.slice(null, null, -1), 5, new SliceNormalizer.Triple(4, 5, -1)),
                Arguments.of(Rows.slice(8, 2, -2), 10, new SliceNormalizer.Triple(8, 3, -2)),
                Arguments.of(Rows.slice(5, 2), 10, new SliceNormalizer.Triple(0, 0, 1)),
                Arguments.of(Rows.slice(3, 4, 0), 10, new SliceNormalizer.Triple(3, 4, 0)),
                Arguments.of(Rows.slice(12, 0, 0), 10, new SliceNormalizer.Triple(0, 0, 0)));
    }

    @ParameterizedTest(name = "{0} over {1} rows")
    @MethodSource("slices")
    void shouldNormalizeSlice(Slice slice, int nrows, SliceNormalizer.Triple expected) {
        assertThat(SliceNormalizer.normalize(slice, nrows)).isEqualTo(expected);
    }

    @Test
    void shouldRejectRepeatOfMissingRow() {
        assertThatThrownBy(() -> SliceNormalizer.normalize(Rows.slice(10, 2, 0), 10))
                .isInstanceOf(SelectorValueException.class)
                .hasMessage("Invalid slice(10, 2, 0) for a frame with 10 rows");
    }

    @Test
    void shouldRejectFractionalBounds() {
        assertThatThrownBy(() -> SliceNormalizer.normalize(new Slice(1.5, null, null), 10))
                .isInstanceOf(SelectorValueException.class)
                .hasMessageContaining("is not integer-valued");
    }

    @Test
    void shouldNormalizeRangeWithNegativeStart() {
        assertThat(SliceNormalizer.normalize(Rows.range(-3, 0), 10)).isEqualTo(new SliceNormalizer.Triple(7, 3, 1));
        assertThat(SliceNormalizer.normalize(Rows.range(9, -1, -3), 10)).isEqualTo(new SliceNormalizer.Triple(9, 4, -3));
    }

    @Test
    void shouldReturnNullForRangeWiderThanLong() {
        assertThat(SliceNormalizer.normalize(Rows.range(Long.MIN_VALUE, Long.MAX_VALUE), 10)).isNull();
        assertThat(SliceNormalizer.normalize(Rows.range(Long.MAX_VALUE, Long.MIN_VALUE, -1), 10)).isNull();
    }

    @Test
    void shouldCountRangeValues() {
        assertThat(new Range(10, 0, -3).count()).isEqualTo(4);
        assertThat(new Range(5, -10, Long.MIN_VALUE).count()).isEqualTo(1);
        assertThat(new Range(0, Long.MAX_VALUE, Long.MAX_VALUE).count()).isEqualTo(1);
        assertThatThrownBy(() -> new Range(Long.MIN_VALUE, Long.MAX_VALUE, 1).count())
                .isInstanceOf(ArithmeticException.class);
    }

    @Test
    void shouldReturnNullForRangeOutsideFrame() {
        assertThat(SliceNormalizer.normalize(Rows.range(0, 11), 10)).isNull();
        assertThat(SliceNormalizer.normalize(Rows.range(-11, -5), 10)).isNull();
        assertThat(SliceNormalizer.normalize(Rows.range(5, 5), 10)).isEqualTo(new SliceNormalizer.Triple(0, 0, 1));
    }
}
