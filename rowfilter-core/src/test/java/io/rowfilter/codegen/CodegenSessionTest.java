package io.rowfilter.codegen;

import io.rowfilter.kernel.RowIndexes;
import io.rowfilter.testutil.TestFrames;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodegenSessionTest {

    @Test
    void shouldReserveUniqueFunctionNames() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        assertThat(session.makeFunctionName("fn")).isEqualTo("fn_1");
        assertThat(session.makeFunctionName("fn")).isEqualTo("fn_2");
        assertThat(session.makeFunctionName("other")).isEqualTo("other_3");
    }

    @Test
    void shouldGenerateRegisteredNodesOnce() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        var calls = new ArrayList<String>();
        session.addNode(s -> calls.add("node"));

        session.generate();
        session.generate();

        assertThat(calls).containsExactly("node");
        assertThat(session.isGenerated()).isTrue();
    }

    @Test
    void shouldCompileLoopReadingColumnsThroughViewIndex() {
        var frame = TestFrames.view(10, RowIndexes.fromSlice(9, 5, -2));
        var session = new CodegenSession(frame, new FilterFunctionCompiler());
        session.addNode(s -> {
            var loop = s.newLoop("big_ids");
            var ids = loop.column(frame.columnIndex("id"));
            loop.addToPreamble("int j = 0;");
            loop.addToMainLoop("if (" + ids + "[r] > 4) {");
            loop.addToMainLoop("    out[j++] = i;");
            loop.addToMainLoop("}");
            loop.addToEpilogue("nOuts[0] = j;");
            loop.setExtraArgs("int[] out, int[] nOuts");
            loop.generate();
        });

        session.generate();
        var index = RowIndexes.fromFilterFunction(session.getResult("big_ids"), frame.nrows(), 2);

        // visible ids are 9, 7, 5, 3, 1
        assertThat(index.toIntArray()).containsExactly(0, 1, 2);
    }

    @Test
    void shouldRejectResultBeforeGeneration() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        assertThatThrownBy(() -> session.getResult("fn_1"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectUnknownResult() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        session.generate();
        assertThatThrownBy(() -> session.getResult("fn_1"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectNodesAfterGeneration() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        session.generate();
        assertThatThrownBy(() -> session.addNode(s -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldPassConstantsThroughDataArgument() {
        var frame = TestFrames.sequential(4);
        var session = new CodegenSession(frame, new FilterFunctionCompiler());
        var low = session.newLoop("fn");
        var high = session.newLoop("fn");
        low.addToMainLoop("if (" + low.column(0) + "[r] > " + low.constant(1) + ") { }");
        high.addToMainLoop("if (" + high.column(0) + "[r] > " + high.constant(3_000_000_000L) + ") { }");
        var other = session.newLoop("fn");
        other.addToMainLoop("if (" + other.column(0) + "[r] > " + other.constant(2) + ") { }");

        assertThat(other.toJavaSource()).isEqualTo(low.toJavaSource());
        assertThat(low.toJavaSource()).contains("final int k0 = (Integer) data[2];");
        assertThat(high.toJavaSource()).contains("final long k0 = (Long) data[2];");
        assertThat(low.data()[2]).isEqualTo(1);
        assertThat(other.data()[2]).isEqualTo(2);
    }

    @Test
    void shouldRejectUnsupportedConstant() {
        var loop = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler()).newLoop("fn");
        assertThatThrownBy(() -> loop.constant(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectColumnOutOfRange() {
        var session = new CodegenSession(TestFrames.sequential(2), new FilterFunctionCompiler());
        var loop = session.newLoop("fn");
        assertThatThrownBy(() -> loop.column(4))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
