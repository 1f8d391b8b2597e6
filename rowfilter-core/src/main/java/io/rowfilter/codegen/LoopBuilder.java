package io.rowfilter.codegen;

import io.rowfilter.kernel.Frame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds one generated function that iterates over the visible rows of a frame.
 * <p>
 * The builder owns the iteration: inside the main loop the visible row number is available
 * as {@code i} and the matching storage row as {@code r}. Callers contribute source
 * fragments to the preamble, the loop body and the epilogue, reference columns through
 * {@link #column(int)} and constants through {@link #constant(Object)}, and may declare
 * extra parameters that the function accepts after the {@code (row0, row1)} range.
 * <p>
 * Constants are passed in the {@code data} argument rather than written into the source,
 * so functions differing only in their constants share one compiled class.
 * <p>
 * Equivalent generated Java (simplified):
 * <pre>
 * public static void make_rowindex_1(Object[] data, int row0, int row1, int[] out, int[] nOuts) {
 *     final int[] ri = (int[]) data[0];
 *     final int[] c0 = (int[]) data[1];
 *     final int k0 = (Integer) data[2];
 *     int j = 0;
 *     for (int i = row0; i &lt; row1; i++) {
 *         final int r = ri == null ? i : ri[i];
 *         if (c0[r] &gt; k0) {
 *             out[j++] = i;
 *         }
 *     }
 *     nOuts[0] = j;
 * }
 * </pre>
 */
public final class LoopBuilder {
    private static final String INDENT = "        ";

    private final String name;
    private final Frame frame;
    private final CodegenSession session;
    private final Map<Integer, String> columnVariables = new LinkedHashMap<>();
    private final List<Object> constants = new ArrayList<>();
    private final List<String> preamble = new ArrayList<>();
    private final List<String> mainLoop = new ArrayList<>();
    private final List<String> epilogue = new ArrayList<>();
    private String extraArgs = "";
    private boolean generated;

    LoopBuilder(String name, Frame frame, CodegenSession session) {
        this.name = name;
        this.frame = frame;
        this.session = session;
    }

    public String name() {
        return name;
    }

    public Frame frame() {
        return frame;
    }

    /**
     * Returns the local variable holding the storage array of column {@code index}.
     */
    public String column(int index) {
        if (index < 0 || index >= frame.ncols()) {
            throw new IllegalArgumentException("Column index " + index + " is out of range for a frame with "
                    + frame.ncols() + " columns");
        }
        return columnVariables.computeIfAbsent(index, k -> "c" + columnVariables.size());
    }

    /**
     * Returns the local variable holding {@code value}, an {@code Integer}, {@code Long},
     * {@code Double}, {@code Boolean} or {@code String}.
     */
    public String constant(Object value) {
        if (!(value instanceof Integer || value instanceof Long || value instanceof Double
                || value instanceof Boolean || value instanceof String)) {
            throw new IllegalArgumentException("Unsupported constant " + value);
        }
        constants.add(value);
        return "k" + (constants.size() - 1);
    }

    public LoopBuilder addToPreamble(String line) {
        preamble.add(line);
        return this;
    }

    public LoopBuilder addToMainLoop(String line) {
        mainLoop.add(line);
        return this;
    }

    public LoopBuilder addToEpilogue(String line) {
        epilogue.add(line);
        return this;
    }

    /**
     * Declares parameters appended to the function signature, e.g. {@code "int[] out, int[] nOuts"}.
     */
    public LoopBuilder setExtraArgs(String extraArgs) {
        this.extraArgs = extraArgs == null ? "" : extraArgs.trim();
        return this;
    }

    /**
     * Hands the finished function to the session for compilation.
     */
    public void generate() {
        if (generated) {
            throw new IllegalStateException("Function " + name + " was already generated");
        }
        generated = true;
        session.addFunction(this);
    }

    /**
     * Values passed as the {@code data} argument: the view index, the storage of every
     * referenced column in variable order, then the constants.
     */
    Object[] data() {
        var data = new Object[columnVariables.size() + constants.size() + 1];
        data[0] = frame.rowIndex() == null ? null : frame.rowIndex().toIntArray();
        var k = 1;
        for (var index : columnVariables.keySet()) {
            data[k++] = frame.column(index).storage();
        }
        for (var value : constants) {
            data[k++] = value;
        }
        return data;
    }

    String toJavaSource() {
        var sb = new StringBuilder();
        sb.append("    public static void ").append(name).append("(Object[] data, int row0, int row1");
        if (!extraArgs.isEmpty()) {
            sb.append(", ").append(extraArgs);
        }
        sb.append(") {\n");
        sb.append(INDENT).append("final int[] ri = (int[]) data[0];\n");
        var k = 1;
        for (var entry : columnVariables.entrySet()) {
            var type = frame.column(entry.getKey()).type().javaType();
            sb.append(INDENT).append("final ").append(type).append("[] ").append(entry.getValue())
                    .append(" = (").append(type).append("[]) data[").append(k++).append("];\n");
        }
        for (var c = 0; c < constants.size(); c++) {
            var value = constants.get(c);
            sb.append(INDENT).append("final ").append(primitiveType(value)).append(" k").append(c)
                    .append(" = (").append(boxedType(value)).append(") data[").append(k++).append("];\n");
        }
        for (var line : preamble) {
            sb.append(INDENT).append(line).append('\n');
        }
        sb.append(INDENT).append("for (int i = row0; i < row1; i++) {\n");
        sb.append(INDENT).append("    final int r = ri == null ? i : ri[i];\n");
        for (var line : mainLoop) {
            sb.append(INDENT).append("    ").append(line).append('\n');
        }
        sb.append(INDENT).append("}\n");
        for (var line : epilogue) {
            sb.append(INDENT).append(line).append('\n');
        }
        sb.append("    }\n");
        return sb.toString();
    }

    private static String primitiveType(Object value) {
        if (value instanceof Integer) {
            return "int";
        }
        if (value instanceof Long) {
            return "long";
        }
        if (value instanceof Double) {
            return "double";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        return "String";
    }

    private static String boxedType(Object value) {
        return value.getClass().getSimpleName();
    }
}
