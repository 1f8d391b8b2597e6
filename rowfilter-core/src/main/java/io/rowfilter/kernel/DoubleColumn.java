package io.rowfilter.kernel;

import java.util.Arrays;

public final class DoubleColumn implements Column {
    private final String name;
    private final double[] values;

    public DoubleColumn(String name, double... values) {
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        this.name = name;
        this.values = values.clone();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnType type() {
        return ColumnType.REAL;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public Object get(int row) {
        return values[row];
    }

    public double getDouble(int row) {
        return values[row];
    }

    /**
     * Returns a copy of the column values.
     */
    public double[] values() {
        return values.clone();
    }

    @Override
    public Object storage() {
        return values;
    }

    @Override
    public DoubleColumn take(RowIndex index) {
        if (index == null) {
            return this;
        }
        var result = new double[index.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = values[index.get(i)];
        }
        return new DoubleColumn(name, result);
    }

    @Override
    public DoubleColumn rename(String name) {
        return new DoubleColumn(name, values);
    }

    @Override
    public String toString() {
        return "DoubleColumn[" + name + ", " + Arrays.toString(values) + "]";
    }
}
