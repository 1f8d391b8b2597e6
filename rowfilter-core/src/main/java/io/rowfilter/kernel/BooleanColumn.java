package io.rowfilter.kernel;

import java.util.Arrays;

public final class BooleanColumn implements Column {
    private final String name;
    private final boolean[] values;

    public BooleanColumn(String name, boolean... values) {
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
        return ColumnType.BOOL;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public Object get(int row) {
        return values[row];
    }

    public boolean getBoolean(int row) {
        return values[row];
    }

    /**
     * Returns a copy of the column values.
     */
    public boolean[] values() {
        return values.clone();
    }

    @Override
    public Object storage() {
        return values;
    }

    @Override
    public BooleanColumn take(RowIndex index) {
        if (index == null) {
            return this;
        }
        var result = new boolean[index.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = values[index.get(i)];
        }
        return new BooleanColumn(name, result);
    }

    @Override
    public BooleanColumn rename(String name) {
        return new BooleanColumn(name, values);
    }

    @Override
    public String toString() {
        return "BooleanColumn[" + name + ", " + Arrays.toString(values) + "]";
    }
}
