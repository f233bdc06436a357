package com.frameforge.input;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A rectangular array of booleans or numbers stored as one flat, row-major primitive
 * buffer, the equivalent of a NumPy {@code ndarray}.
 *
 * <p>Any rank can be represented; the ingestion pipeline accepts ranks 1 and 2 only.
 * A rank-2 array of shape {@code (rows, cols)} is read as {@code cols} columns.
 */
public final class NdArray {

    private final ColumnStorage storage;
    private final int[] shape;
    private final Object data;

    private NdArray(ColumnStorage storage, int[] shape, Object data) {
        this.storage = storage;
        this.shape = shape;
        this.data = data;
    }

    /**
     * Wraps a flat primitive buffer with the given shape.
     *
     * @param shape the dimensions, row-major
     * @param data a {@code boolean[]}, {@code byte[]}, {@code short[]}, {@code int[]},
     *             {@code long[]}, {@code float[]} or {@code double[]}
     * @return the array
     * @throws IllegalArgumentException if the buffer is not a supported primitive array
     *         or its length does not match the shape
     */
    public static NdArray of(int[] shape, Object data) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(data, "data must not be null");
        ColumnStorage storage = storageOf(data.getClass());
        long expected = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            expected *= dim;
        }
        if (expected != Array.getLength(data)) {
            throw new IllegalArgumentException("Buffer of length " + Array.getLength(data)
                + " does not match shape " + Arrays.toString(shape));
        }
        return new NdArray(storage, shape.clone(), data);
    }

    /**
     * Wraps a one-dimensional primitive array without copying.
     *
     * @param data the primitive array
     * @return the rank-1 array
     */
    public static NdArray of(Object data) {
        Objects.requireNonNull(data, "data must not be null");
        return of(new int[] {Array.getLength(data)}, data);
    }

    /**
     * Copies a two-dimensional primitive array (e.g. {@code double[][]}) into a rank-2 array.
     *
     * @param rows the rows; all must have the same length
     * @return the rank-2 array
     * @throws IllegalArgumentException if the rows are ragged
     */
    public static NdArray ofRows(Object[] rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        Class<?> rowClass = rows.getClass().getComponentType();
        Class<?> elementClass = rowClass.getComponentType();
        if (elementClass == null || !elementClass.isPrimitive()) {
            throw new IllegalArgumentException("Expected a two-dimensional primitive array, got "
                + rows.getClass().getSimpleName());
        }
        int cols = rows.length == 0 ? 0 : Array.getLength(rows[0]);
        Object flat = Array.newInstance(elementClass, rows.length * cols);
        for (int r = 0; r < rows.length; r++) {
            if (Array.getLength(rows[r]) != cols) {
                throw new IllegalArgumentException("Row " + r + " has " + Array.getLength(rows[r])
                    + " elements, expected " + cols);
            }
            System.arraycopy(rows[r], 0, flat, r * cols, cols);
        }
        return of(new int[] {rows.length, cols}, flat);
    }

    /**
     * Returns true if the given object is a one-dimensional primitive array this class can wrap.
     *
     * @param data the object to test
     * @return true for supported primitive arrays
     */
    public static boolean isPrimitiveArray(Object data) {
        return data != null && data.getClass().isArray()
            && data.getClass().getComponentType().isPrimitive()
            && data.getClass() != char[].class;
    }

    /**
     * Returns the number of dimensions of a Java primitive array such as {@code double[]}
     * or {@code long[][]}, counting nested array levels down to a supported primitive.
     *
     * @param data the object to inspect
     * @return the rank, or 0 if the object is not a (nested) supported primitive array
     */
    public static int arrayRank(Object data) {
        if (data == null) {
            return 0;
        }
        int rank = 0;
        Class<?> type = data.getClass();
        while (type.isArray()) {
            rank++;
            type = type.getComponentType();
        }
        if (rank == 0 || !type.isPrimitive() || type == char.class) {
            return 0;
        }
        return rank;
    }

    private static ColumnStorage storageOf(Class<?> arrayClass) {
        if (arrayClass == boolean[].class) return ColumnStorage.BOOL;
        if (arrayClass == byte[].class) return ColumnStorage.INT8;
        if (arrayClass == short[].class) return ColumnStorage.INT16;
        if (arrayClass == int[].class) return ColumnStorage.INT32;
        if (arrayClass == long[].class) return ColumnStorage.INT64;
        if (arrayClass == float[].class) return ColumnStorage.FLOAT32;
        if (arrayClass == double[].class) return ColumnStorage.FLOAT64;
        throw new IllegalArgumentException("Unsupported array buffer: " + arrayClass.getSimpleName());
    }

    public ColumnStorage storage() {
        return storage;
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    /**
     * Returns the length of the first axis.
     *
     * @return the number of rows
     */
    public int length() {
        return shape.length == 0 ? 1 : shape[0];
    }

    /**
     * Returns the number of columns: 1 for rank 1, the second dimension for rank 2.
     *
     * @return the column count
     * @throws IllegalStateException for other ranks
     */
    public int columnCount() {
        if (shape.length == 1) {
            return 1;
        }
        if (shape.length == 2) {
            return shape[1];
        }
        throw new IllegalStateException("Array of rank " + shape.length + " has no columns");
    }

    /**
     * Returns the boxed values of one column.
     *
     * @param index the column index
     * @return the column values, top to bottom
     */
    public List<Object> column(int index) {
        int cols = columnCount();
        if (index < 0 || index >= cols) {
            throw new IndexOutOfBoundsException("Column " + index + " out of range [0, " + cols + ")");
        }
        int rows = length();
        List<Object> values = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            values.add(Array.get(data, r * cols + index));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() {
        return String.format("NdArray(storage=%s, shape=%s)", storage, Arrays.toString(shape));
    }
}
