package io.rowfilter.expr;

import io.rowfilter.codegen.LoopBuilder;
import io.rowfilter.core.SelectorTypeException;
import io.rowfilter.core.SelectorValueException;
import io.rowfilter.engine.EvaluationContext;
import io.rowfilter.kernel.BooleanColumn;
import io.rowfilter.kernel.Column;
import io.rowfilter.kernel.ColumnType;
import io.rowfilter.kernel.DoubleColumn;
import io.rowfilter.kernel.Frame;
import io.rowfilter.kernel.IntColumn;
import io.rowfilter.kernel.StringColumn;

import java.util.Objects;

/**
 * Column expression evaluated row by row against a frame.
 * <p>
 * Expressions can be evaluated eagerly into a column ({@link #evaluate(EvaluationContext)})
 * or rendered as a Java expression inside a generated loop ({@link #toJava(LoopBuilder)}).
 * Both forms use Java's primitive comparison semantics, so they agree on every row.
 */
public sealed interface Expr permits Expr.ColumnRef, Expr.Literal, Expr.Comparison,
        Expr.And, Expr.Or, Expr.Not {

    enum Operator {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        boolean isOrdering() {
            return this != EQ && this != NE;
        }

        boolean test(int cmp) {
            return switch (this) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case LT -> cmp < 0;
                case LE -> cmp <= 0;
                case GT -> cmp > 0;
                case GE -> cmp >= 0;
            };
        }
    }

    /**
     * Resolves the type this expression produces against {@code frame}.
     *
     * @throws SelectorTypeException if operand types are incompatible
     */
    ColumnType type(Frame frame);

    /**
     * Value of this expression at storage row {@code row} of {@code frame}.
     */
    Object value(Frame frame, int row);

    /**
     * Java source of this expression inside a loop built by {@code loop}, where {@code r}
     * is the current storage row.
     */
    String toJava(LoopBuilder loop);

    /**
     * Evaluates this expression over the rows addressed by the context's current index.
     */
    default Column evaluate(EvaluationContext context) {
        var frame = context.frame();
        var type = type(frame);
        var rows = context.currentRowIndex();
        var n = rows == null ? frame.storageRows() : rows.size();
        var name = toString();
        switch (type) {
            case BOOL -> {
                var values = new boolean[n];
                for (var i = 0; i < n; i++) {
                    values[i] = (Boolean) value(frame, rows == null ? i : rows.get(i));
                }
                return new BooleanColumn(name, values);
            }
            case INT -> {
                var values = new int[n];
                for (var i = 0; i < n; i++) {
                    var number = (Number) value(frame, rows == null ? i : rows.get(i));
                    if (number instanceof Long l) {
                        throw new SelectorValueException("Value " + l + " of " + name + " does not fit an int column");
                    }
                    values[i] = number.intValue();
                }
                return new IntColumn(name, values);
            }
            case REAL -> {
                var values = new double[n];
                for (var i = 0; i < n; i++) {
                    values[i] = ((Number) value(frame, rows == null ? i : rows.get(i))).doubleValue();
                }
                return new DoubleColumn(name, values);
            }
            default -> {
                var values = new String[n];
                for (var i = 0; i < n; i++) {
                    values[i] = (String) value(frame, rows == null ? i : rows.get(i));
                }
                return new StringColumn(name, values);
            }
        }
    }

    static Expr of(Object value) {
        return value instanceof Expr expr ? expr : new Literal(value);
    }

    default Expr eq(Object other) {
        return new Comparison(Operator.EQ, this, of(other));
    }

    default Expr ne(Object other) {
        return new Comparison(Operator.NE, this, of(other));
    }

    default Expr lt(Object other) {
        return new Comparison(Operator.LT, this, of(other));
    }

    default Expr le(Object other) {
        return new Comparison(Operator.LE, this, of(other));
    }

    default Expr gt(Object other) {
        return new Comparison(Operator.GT, this, of(other));
    }

    default Expr ge(Object other) {
        return new Comparison(Operator.GE, this, of(other));
    }

    default Expr and(Expr other) {
        return new And(this, other);
    }

    default Expr or(Expr other) {
        return new Or(this, other);
    }

    default Expr not() {
        return new Not(this);
    }

    /**
     * Reference to a frame column, either by name or by position.
     */
    record ColumnRef(String name, int index) implements Expr {
        public ColumnRef {
            if (name == null && index < 0) {
                throw new IllegalArgumentException("column name or non-negative index required");
            }
        }

        public int resolve(Frame frame) {
            if (name != null) {
                return frame.columnIndex(name);
            }
            if (index >= frame.ncols()) {
                throw new IllegalArgumentException("Column index " + index + " is out of range for a frame with "
                        + frame.ncols() + " columns");
            }
            return index;
        }

        @Override
        public ColumnType type(Frame frame) {
            return frame.column(resolve(frame)).type();
        }

        @Override
        public Object value(Frame frame, int row) {
            return frame.column(resolve(frame)).get(row);
        }

        @Override
        public String toJava(LoopBuilder loop) {
            return loop.column(resolve(loop.frame())) + "[r]";
        }

        @Override
        public String toString() {
            return name != null ? "f." + name : "f[" + index + "]";
        }
    }

    record Literal(Object value) implements Expr {
        public Literal {
            if (value instanceof Long l) {
                // only values beyond the int range stay long
                value = l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (Object) l.intValue() : l;
            } else if (value instanceof Short || value instanceof Byte) {
                value = ((Number) value).intValue();
            } else if (value instanceof Float f) {
                value = f.doubleValue();
            } else if (!(value instanceof Integer || value instanceof Double
                    || value instanceof Boolean || value instanceof String)) {
                throw new IllegalArgumentException("Unsupported literal " + value);
            }
        }

        @Override
        public ColumnType type(Frame frame) {
            if (value instanceof Boolean) {
                return ColumnType.BOOL;
            }
            if (value instanceof Integer || value instanceof Long) {
                return ColumnType.INT;
            }
            if (value instanceof Double) {
                return ColumnType.REAL;
            }
            return ColumnType.STR;
        }

        @Override
        public Object value(Frame frame, int row) {
            return value;
        }

        @Override
        public String toJava(LoopBuilder loop) {
            return loop.constant(value);
        }

        private static String quote(String s) {
            var sb = new StringBuilder("\"");
            for (var i = 0; i < s.length(); i++) {
                var c = s.charAt(i);
                switch (c) {
                    case '"' -> sb.append("\\\"");
                    case '\\' -> sb.append("\\\\");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> {
                        if (c < 0x20 || c > 0x7e) {
                            sb.append(String.format("\\u%04x", (int) c));
                        } else {
                            sb.append(c);
                        }
                    }
                }
            }
            return sb.append('"').toString();
        }

        @Override
        public String toString() {
            return value instanceof String ? quote((String) value) : String.valueOf(value);
        }
    }

    record Comparison(Operator operator, Expr left, Expr right) implements Expr {
        public Comparison {
            if (operator == null) {
                throw new IllegalArgumentException("operator required");
            }
            if (left == null || right == null) {
                throw new IllegalArgumentException("left and right required");
            }
        }

        @Override
        public ColumnType type(Frame frame) {
            var lt = left.type(frame);
            var rt = right.type(frame);
            if (lt.isNumeric() && rt.isNumeric()) {
                return ColumnType.BOOL;
            }
            if (lt == rt && (lt == ColumnType.STR || !operator.isOrdering())) {
                return ColumnType.BOOL;
            }
            throw new SelectorTypeException("Operator " + operator.symbol() + " cannot be applied to "
                    + lt + " and " + rt + " in " + this);
        }

        @Override
        public Object value(Frame frame, int row) {
            var a = left.value(frame, row);
            var b = right.value(frame, row);
            if ((a instanceof Integer || a instanceof Long) && (b instanceof Integer || b instanceof Long)) {
                return operator.test(Long.compare(((Number) a).longValue(), ((Number) b).longValue()));
            }
            if (a instanceof Number x && b instanceof Number y) {
                var dx = x.doubleValue();
                var dy = y.doubleValue();
                return switch (operator) {
                    case EQ -> dx == dy;
                    case NE -> dx != dy;
                    case LT -> dx < dy;
                    case LE -> dx <= dy;
                    case GT -> dx > dy;
                    case GE -> dx >= dy;
                };
            }
            if (a instanceof String || b instanceof String) {
                if (!operator.isOrdering()) {
                    return (operator == Operator.EQ) == Objects.equals(a, b);
                }
                return a != null && b != null && operator.test(((String) a).compareTo((String) b));
            }
            return (operator == Operator.EQ) == Objects.equals(a, b);
        }

        @Override
        public String toJava(LoopBuilder loop) {
            var frame = loop.frame();
            var lt = left.type(frame);
            var rt = right.type(frame);
            var l = left.toJava(loop);
            var r = right.toJava(loop);
            if (lt == ColumnType.STR && rt == ColumnType.STR) {
                if (!operator.isOrdering()) {
                    var eq = "java.util.Objects.equals(" + l + ", " + r + ")";
                    return operator == Operator.EQ ? eq : "!" + eq;
                }
                return "(" + l + " != null && " + r + " != null && " + l + ".compareTo(" + r + ") "
                        + operator.symbol() + " 0)";
            }
            return "(" + l + " " + operator.symbol() + " " + r + ")";
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    record And(Expr left, Expr right) implements Expr {
        public And {
            if (left == null || right == null) {
                throw new IllegalArgumentException("left and right required");
            }
        }

        @Override
        public ColumnType type(Frame frame) {
            return Logic.requireBoolean(frame, this, left, right);
        }

        @Override
        public Object value(Frame frame, int row) {
            return (Boolean) left.value(frame, row) && (Boolean) right.value(frame, row);
        }

        @Override
        public String toJava(LoopBuilder loop) {
            return "(" + left.toJava(loop) + " && " + right.toJava(loop) + ")";
        }

        @Override
        public String toString() {
            return "(" + left + " & " + right + ")";
        }
    }

    record Or(Expr left, Expr right) implements Expr {
        public Or {
            if (left == null || right == null) {
                throw new IllegalArgumentException("left and right required");
            }
        }

        @Override
        public ColumnType type(Frame frame) {
            return Logic.requireBoolean(frame, this, left, right);
        }

        @Override
        public Object value(Frame frame, int row) {
            return (Boolean) left.value(frame, row) || (Boolean) right.value(frame, row);
        }

        @Override
        public String toJava(LoopBuilder loop) {
            return "(" + left.toJava(loop) + " || " + right.toJava(loop) + ")";
        }

        @Override
        public String toString() {
            return "(" + left + " | " + right + ")";
        }
    }

    record Not(Expr operand) implements Expr {
        public Not {
            if (operand == null) {
                throw new IllegalArgumentException("operand required");
            }
        }

        @Override
        public ColumnType type(Frame frame) {
            return Logic.requireBoolean(frame, this, operand, operand);
        }

        @Override
        public Object value(Frame frame, int row) {
            return !(Boolean) operand.value(frame, row);
        }

        @Override
        public String toJava(LoopBuilder loop) {
            return "!" + operand.toJava(loop);
        }

        @Override
        public String toString() {
            return "~" + operand;
        }
    }

    final class Logic {
        private Logic() {
        }

        static ColumnType requireBoolean(Frame frame, Expr owner, Expr left, Expr right) {
            var lt = left.type(frame);
            var rt = right.type(frame);
            if (lt != ColumnType.BOOL || rt != ColumnType.BOOL) {
                throw new SelectorTypeException("Logical operators require boolean operands, got "
                        + lt + " and " + rt + " in " + owner);
            }
            return ColumnType.BOOL;
        }
    }
}
