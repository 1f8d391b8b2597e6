package io.rowfilter.rows;

import io.rowfilter.core.SelectorTypeException;
import io.rowfilter.core.SelectorValueException;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.expr.ColumnScope;
import io.rowfilter.expr.Expr;
import io.rowfilter.kernel.BooleanColumn;
import io.rowfilter.kernel.ColumnType;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.IntColumn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.stream.BaseStream;

/**
 * Factory that resolves a rows selector into a {@link RowFilter}.
 * <p>
 * Accepted selectors:
 * <ul>
 *   <li>{@code null} or {@link Rows#ALL} - every row;</li>
 *   <li>an integer ({@code Integer}, {@code Long}, {@code Short}, {@code Byte}), a {@link Slice}
 *       or a {@link Range};</li>
 *   <li>a {@link Collection} or {@code Object[]} of integers, slices and ranges;</li>
 *   <li>an {@link Iterator}, a {@link BaseStream} or a non-collection {@link Iterable}, which
 *       is materialized first;</li>
 *   <li>a one-dimensional {@code boolean[]}, {@code byte[]}, {@code short[]}, {@code int[]} or
 *       {@code long[]}, or a two-dimensional one with an axis of length 1;</li>
 *   <li>a single-column boolean (mask) or integer (positions) {@link Frame};</li>
 *   <li>a boolean {@link Expr};</li>
 *   <li>a {@link RowsFunction} returning any of the above.</li>
 * </ul>
 * Boolean literals are rejected so they cannot be mistaken for rows 0 and 1.
 */
public final class RowFilters {
    private static final Logger log = LoggerFactory.getLogger(RowFilters.class);

    private RowFilters() {
    }

    /**
     * Creates the row filter for {@code rows} within {@code context}.
     *
     * @throws SelectorTypeException if the selector has an unusable shape
     * @throws SelectorValueException if a value in the selector is invalid for the target frame
     */
    public static RowFilter make(Object rows, EvaluationContext context) {
        var filter = make(rows, context, false);
        if (log.isDebugEnabled()) {
            log.debug("Resolved rows selector {} into {}", describe(rows), filter);
        }
        return filter;
    }

    private static RowFilter make(Object rows, EvaluationContext context, boolean nested) {
        var nrows = context.nrows();
        if (rows == null || rows == Rows.ALL) {
            return new AllRowFilter(context);
        }

        if (rows instanceof Boolean) {
            throw new SelectorTypeException("Boolean value cannot be used as a rows selector");
        }

        if (isInteger(rows) || rows instanceof Slice || rows instanceof Range) {
            rows = List.of(rows);
        }

        var fromGenerator = false;
        if (rows instanceof Iterator<?> || rows instanceof BaseStream<?, ?>
                || (rows instanceof Iterable<?> && !(rows instanceof Collection<?>))) {
            // Indices can only be validated once the whole sequence is known.
            rows = materialize(rows);
            fromGenerator = true;
        }

        if (rows instanceof Collection<?> list) {
            return fromList(list, context, fromGenerator);
        }
        if (rows instanceof Object[] tuple && !isPrimitiveArray(tuple.getClass().getComponentType())) {
            return fromList(Arrays.asList(tuple), context, false);
        }

        if (rows.getClass().isArray()) {
            rows = arrayToFrame(rows, nrows);
        }

        if (rows instanceof Frame frame) {
            return fromFrame(frame, context);
        }

        if (rows instanceof RowsFunction function && !nested) {
            return make(function.apply(new ColumnScope(context.frame())), context, true);
        }

        if (rows instanceof Expr expr) {
            return new FilterExprRowFilter(context, expr);
        }

        if (nested) {
            throw new SelectorTypeException("Unexpected result produced by the rows function: " + describe(rows));
        }
        throw new SelectorTypeException("Unexpected rows argument: " + describe(rows));
    }

    private static RowFilter fromList(Collection<?> rows, EvaluationContext context, boolean fromGenerator) {
        var nrows = context.nrows();
        var bases = new ArrayList<Integer>();
        var counts = new ArrayList<Integer>();
        var steps = new ArrayList<Integer>();
        var i = 0;
        for (var elem : rows) {
            if (isInteger(elem)) {
                var value = ((Number) elem).longValue();
                if (value < -nrows || value >= nrows) {
                    throw new SelectorValueException("Row `" + value + "` is invalid for a frame with "
                            + plural(nrows, "row"));
                }
                bases.add((int) Math.floorMod(value, (long) nrows));
            } else if (elem instanceof Slice || elem instanceof Range) {
                SliceNormalizer.Triple triple;
                if (elem instanceof Range range) {
                    triple = SliceNormalizer.normalize(range, nrows);
                    if (triple == null) {
                        throw new SelectorValueException("Invalid " + range + " for a frame with "
                                + plural(nrows, "row"));
                    }
                } else {
                    triple = SliceNormalizer.normalize((Slice) elem, nrows);
                }
                if (triple.count() == 1) {
                    bases.add(triple.start());
                } else if (triple.count() > 1) {
                    // keep counts/steps aligned with every base collected so far
                    while (counts.size() < bases.size()) {
                        counts.add(1);
                        steps.add(1);
                    }
                    bases.add(triple.start());
                    counts.add(triple.count());
                    steps.add(triple.step());
                }
            } else if (fromGenerator) {
                throw new SelectorValueException("Invalid row selector " + describe(elem)
                        + " generated at position " + i);
            } else {
                throw new SelectorValueException("Invalid row selector " + describe(elem)
                        + " at element " + i + " of the rows list");
            }
            i++;
        }

        if (counts.isEmpty()) {
            if (bases.size() == 1) {
                if (bases.get(0) == 0 && nrows == 1) {
                    return new AllRowFilter(context);
                }
                return new SliceRowFilter(context, bases.get(0), 1, 1);
            }
            return new ArrayRowFilter(context, bases);
        }
        if (bases.size() == 1) {
            if (bases.get(0) == 0 && counts.get(0) == nrows && steps.get(0) == 1) {
                return new AllRowFilter(context);
            }
            return new SliceRowFilter(context, bases.get(0), counts.get(0), steps.get(0));
        }
        return new MultiSliceRowFilter(context, bases, counts, steps);
    }

    private static RowFilter fromFrame(Frame rows, EvaluationContext context) {
        var nrows = context.nrows();
        if (rows.ncols() != 1) {
            throw new SelectorValueException("rows argument should be a single-column frame, got " + rows);
        }
        var type = rows.column(0).type();
        if (type == ColumnType.BOOL) {
            if (rows.nrows() != nrows) {
                throw new SelectorValueException("rows frame has " + plural(rows.nrows(), "row")
                        + ", but applied to a frame with " + plural(nrows, "row"));
            }
            return new BooleanColumnRowFilter(context, rows);
        }
        if (type == ColumnType.INT) {
            return new IntegerColumnRowFilter(context, rows);
        }
        throw new SelectorTypeException("rows frame should be either a boolean or an integer column, however it has type "
                + type);
    }

    /**
     * Converts a primitive array selector into a single-column frame, flattening a 2D array
     * with one axis of length 1.
     */
    private static Frame arrayToFrame(Object array, int nrows) {
        var flat = array;
        var componentType = array.getClass().getComponentType();
        if (componentType.isArray()) {
            var outer = Array.getLength(array);
            var inner = outer == 0 ? 0 : Array.getLength(Array.get(array, 0));
            for (var i = 1; i < outer; i++) {
                if (Array.getLength(Array.get(array, i)) != inner) {
                    throw new SelectorValueException("Only a single-dimensional array is allowed as a rows argument, got a jagged "
                            + describe(array));
                }
            }
            if (componentType.getComponentType().isArray() || Math.min(outer, inner) != 1) {
                throw new SelectorValueException("Only a single-dimensional array is allowed as a rows argument, got "
                        + describe(array));
            }
            flat = outer == 1 ? Array.get(array, 0) : column(array, outer);
        }

        var name = "C0";
        if (flat instanceof boolean[] mask) {
            if (mask.length != nrows) {
                throw new SelectorValueException("Cannot apply a boolean array of length " + mask.length
                        + " to a frame with " + plural(nrows, "row"));
            }
            return Frame.of(new BooleanColumn(name, mask));
        }
        if (flat instanceof int[] ints) {
            return Frame.of(new IntColumn(name, ints));
        }
        if (flat instanceof long[] || flat instanceof short[] || flat instanceof byte[]) {
            var length = Array.getLength(flat);
            var values = new int[length];
            for (var i = 0; i < length; i++) {
                var value = ((Number) Array.get(flat, i)).longValue();
                if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    throw new SelectorValueException("Row index " + value + " at position " + i
                            + " of the rows array exceeds the supported range");
                }
                values[i] = (int) value;
            }
            return Frame.of(new IntColumn(name, values));
        }
        throw new SelectorValueException("Either a boolean or an integer array is expected for rows argument, got "
                + describe(array));
    }

    /**
     * First element of every row of an {@code n x 1} array.
     */
    private static Object column(Object array, int outer) {
        var result = Array.newInstance(array.getClass().getComponentType().getComponentType(), outer);
        for (var i = 0; i < outer; i++) {
            Array.set(result, i, Array.get(Array.get(array, i), 0));
        }
        return result;
    }

    private static List<Object> materialize(Object rows) {
        Iterator<?> iterator;
        if (rows instanceof BaseStream<?, ?> stream) {
            iterator = stream.iterator();
        } else if (rows instanceof Iterable<?> iterable) {
            iterator = iterable.iterator();
        } else {
            iterator = (Iterator<?>) rows;
        }
        var result = new ArrayList<Object>();
        iterator.forEachRemaining(result::add);
        return result;
    }

    private static boolean isPrimitiveArray(Class<?> type) {
        return type.isArray() && type.getComponentType().isPrimitive();
    }

    private static boolean isInteger(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        var type = value.getClass();
        if (type.isArray()) {
            var sb = new StringBuilder();
            var dims = new StringBuilder();
            var current = value;
            var component = type;
            while (component.isArray()) {
                var length = current == null ? 0 : Array.getLength(current);
                dims.append('[').append(length).append(']');
                current = length == 0 ? null : Array.get(current, 0);
                component = component.getComponentType();
            }
            return sb.append(component.getSimpleName()).append(dims).toString();
        }
        if (value instanceof String s) {
            return "\"" + s + "\"";
        }
        return value.toString();
    }

    static String plural(int n, String word) {
        return n + " " + (n == 1 ? word : word + "s");
    }
}
