package com.frameforge.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An in-memory table with labelled, natively typed columns, the equivalent of a
 * pandas {@code DataFrame}.
 *
 * <p>All columns have the same number of rows.
 *
 * <p>Example usage:
 * <pre>
 *   LocalFrame frame = LocalFrame.builder()
 *       .column("id", ColumnStorage.INT64, 1L, 2L)
 *       .column("name", ColumnStorage.OBJECT, "a", "b")
 *       .build();
 * </pre>
 */
public final class LocalFrame {

    private final List<FrameColumn> columns;
    private final int rowCount;

    /**
     * Creates a frame.
     *
     * @param columns the columns in order
     * @throws IllegalArgumentException if the columns differ in length
     */
    public LocalFrame(List<FrameColumn> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rowCount = this.columns.isEmpty() ? 0 : this.columns.get(0).size();
        for (FrameColumn column : this.columns) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has "
                    + column.size() + " values, expected " + rowCount);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<FrameColumn> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    @Override
    public String toString() {
        return String.format("LocalFrame(columns=%d, rows=%d)", columns.size(), rowCount);
    }

    /**
     * Accumulates columns for a {@link LocalFrame}.
     */
    public static final class Builder {

        private final List<FrameColumn> columns = new ArrayList<>();

        private Builder() {}

        public Builder column(Object label, ColumnStorage storage, Object... values) {
            columns.add(FrameColumn.of(label, storage, values));
            return this;
        }

        public Builder column(Object label, ColumnStorage storage, List<?> values) {
            columns.add(new FrameColumn(label, storage, new ArrayList<Object>(values)));
            return this;
        }

        public LocalFrame build() {
            return new LocalFrame(columns);
        }
    }
}
