package io.rowfilter.kernel;

import java.util.Arrays;

public final class IntColumn implements Column {
    private final String name;
    private final int[] values;

    public IntColumn(String name, int... values) {
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
        return ColumnType.INT;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public Object get(int row) {
        return values[row];
    }

    public int getInt(int row) {
        return values[row];
    }

    /**
     * Returns a copy of the column values.
     */
    public int[] values() {
        return values.clone();
    }

    @Override
    public Object storage() {
        return values;
    }

    @Override
    public IntColumn take(RowIndex index) {
        if (index == null) {
            return this;
        }
        var result = new int[index.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = values[index.get(i)];
        }
        return new IntColumn(name, result);
    }

    @Override
    public IntColumn rename(String name) {
        return new IntColumn(name, values);
    }

    @Override
    public String toString() {
        return "IntColumn[" + name + ", " + Arrays.toString(values) + "]";
    }
}
