package io.rowfilter.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Columnar table.
 * <p>
 * A frame either owns its rows outright or is a <em>view</em>: its visible rows are the
 * storage positions addressed by {@link #rowIndex()}. Views share column storage with the
 * frame they were derived from.
 */
public final class Frame {
    private final List<Column> columns;
    private final Map<String, Integer> positions;
    private final int storageRows;
    private final RowIndex rowIndex;

    public Frame(List<Column> columns, RowIndex rowIndex) {
        if (columns == null) {
            throw new IllegalArgumentException("columns required");
        }
        this.columns = List.copyOf(columns);
        this.positions = new HashMap<>();
        var rows = this.columns.isEmpty() ? 0 : this.columns.get(0).length();
        for (var i = 0; i < this.columns.size(); i++) {
            var column = this.columns.get(i);
            if (column.length() != rows) {
                throw new IllegalArgumentException("Column " + column.name() + " has " + column.length()
                        + " rows, expected " + rows);
            }
            if (positions.putIfAbsent(column.name(), i) != null) {
                throw new IllegalArgumentException("Duplicate column name " + column.name());
            }
        }
        if (rowIndex != null && rowIndex.max() >= rows) {
            throw new IllegalArgumentException("Row index refers to row " + rowIndex.max()
                    + " of a frame with " + rows + " stored rows");
        }
        this.storageRows = rows;
        this.rowIndex = rowIndex;
    }

    public static Frame of(Column... columns) {
        return new Frame(Arrays.asList(columns), null);
    }

    /**
     * Number of visible rows.
     */
    public int nrows() {
        return rowIndex == null ? storageRows : rowIndex.size();
    }

    public int ncols() {
        return columns.size();
    }

    /**
     * Number of rows held by the column storage, which exceeds {@link #nrows()} for most views.
     */
    public int storageRows() {
        return storageRows;
    }

    /**
     * The index of a view frame, or {@code null} if this frame owns its rows.
     */
    public RowIndex rowIndex() {
        return rowIndex;
    }

    public boolean isView() {
        return rowIndex != null;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public Column column(String name) {
        var index = positions.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Column " + name + " does not exist in the frame");
        }
        return columns.get(index);
    }

    public int columnIndex(String name) {
        var index = positions.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Column " + name + " does not exist in the frame");
        }
        return index;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<ColumnType> types() {
        var types = new ArrayList<ColumnType>(columns.size());
        for (var column : columns) {
            types.add(column.type());
        }
        return types;
    }

    /**
     * Returns a frame sharing this frame's storage with {@code index} as its row index.
     * The index must already be expressed in storage positions.
     */
    public Frame withRowIndex(RowIndex index) {
        return new Frame(columns, index);
    }

    /**
     * Copies the visible rows into a frame that owns its storage.
     */
    public Frame materialize() {
        if (rowIndex == null) {
            return this;
        }
        var copied = new ArrayList<Column>(columns.size());
        for (var column : columns) {
            copied.add(column.take(rowIndex));
        }
        return new Frame(copied, null);
    }

    @Override
    public String toString() {
        return "Frame[nrows=" + nrows() + ", ncols=" + ncols() + (isView() ? ", view" : "") + "]";
    }
}
