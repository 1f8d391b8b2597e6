package io.rowfilter.kernel;

import java.util.Arrays;

public final class StringColumn implements Column {
    private final String name;
    private final String[] values;

    public StringColumn(String name, String... values) {
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
        return ColumnType.STR;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public Object get(int row) {
        return values[row];
    }

    public String getString(int row) {
        return values[row];
    }

    /**
     * Returns a copy of the column values.
     */
    public String[] values() {
        return values.clone();
    }

    @Override
    public Object storage() {
        return values;
    }

    @Override
    public StringColumn take(RowIndex index) {
        if (index == null) {
            return this;
        }
        var result = new String[index.size()];
        for (var i = 0; i < result.length; i++) {
            result[i] = values[index.get(i)];
        }
        return new StringColumn(name, result);
    }

    @Override
    public StringColumn rename(String name) {
        return new StringColumn(name, values);
    }

    @Override
    public String toString() {
        return "StringColumn[" + name + ", " + Arrays.toString(values) + "]";
    }
}
