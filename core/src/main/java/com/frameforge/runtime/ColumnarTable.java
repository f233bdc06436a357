package com.frameforge.runtime;

import com.frameforge.types.StructType;
import com.frameforge.types.TypeMapper;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An Arrow-backed table: ordered, named columns of equal length.
 *
 * <p>The table owns its vectors and must be closed by whoever holds it last. Column
 * names may repeat.
 */
public final class ColumnarTable implements AutoCloseable {

    private final BufferAllocator allocator;
    private VectorSchemaRoot root;

    private ColumnarTable(VectorSchemaRoot root, BufferAllocator allocator) {
        this.root = root;
        this.allocator = allocator;
    }

    /**
     * Takes ownership of an existing root.
     *
     * @param root the vectors
     * @param allocator the allocator the vectors were created with
     * @return the table
     */
    public static ColumnarTable of(VectorSchemaRoot root, BufferAllocator allocator) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");
        return new ColumnarTable(root, allocator);
    }

    /**
     * Takes ownership of filled vectors.
     *
     * @param vectors the columns, in order
     * @param rowCount the number of rows in every column
     * @param allocator the allocator the vectors were created with
     * @return the table
     */
    public static ColumnarTable fromVectors(List<FieldVector> vectors, int rowCount,
                                            BufferAllocator allocator) {
        VectorSchemaRoot root = new VectorSchemaRoot(new ArrayList<>(vectors));
        root.setRowCount(rowCount);
        return of(root, allocator);
    }

    /**
     * Creates a table with no rows.
     *
     * @param schema the column names and types
     * @param allocator the allocator for the (empty) vectors
     * @return the table
     * @throws com.frameforge.exception.UnsupportedTypeForEncodingException if a type has no encoding
     */
    public static ColumnarTable empty(StructType schema, BufferAllocator allocator) {
        Schema arrowSchema = TypeMapper.toArrowSchema(schema.deduplicateFieldNames());
        VectorSchemaRoot root = VectorSchemaRoot.create(arrowSchema, allocator);
        root.setRowCount(0);
        return of(root, allocator).renameColumns(schema.fieldNames());
    }

    public int columnCount() {
        return root.getFieldVectors().size();
    }

    public int rowCount() {
        return root.getRowCount();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columnCount());
        for (FieldVector vector : root.getFieldVectors()) {
            names.add(vector.getField().getName());
        }
        return Collections.unmodifiableList(names);
    }

    public Schema arrowSchema() {
        return root.getSchema();
    }

    public FieldVector getVector(int index) {
        return root.getVector(index);
    }

    /**
     * Returns the underlying root. The table keeps ownership.
     *
     * @return the root
     */
    public VectorSchemaRoot root() {
        return root;
    }

    public BufferAllocator allocator() {
        return allocator;
    }

    /**
     * Renames the columns positionally, moving the buffers into new vectors without
     * copying. Types and values are unchanged.
     *
     * @param names one name per column
     * @return this table
     * @throws IllegalArgumentException if the name count differs from the column count
     */
    public ColumnarTable renameColumns(List<String> names) {
        if (names.size() != columnCount()) {
            throw new IllegalArgumentException("Expected " + columnCount() + " column names, got "
                + names.size());
        }
        if (names.equals(columnNames())) {
            return this;
        }

        int rowCount = root.getRowCount();
        List<FieldVector> renamed = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            FieldVector source = root.getVector(i);
            Field field = source.getField();
            Field target = new Field(names.get(i), field.getFieldType(), field.getChildren());
            FieldVector vector = target.createVector(allocator);
            source.makeTransferPair(vector).transfer();
            renamed.add(vector);
        }
        root.close();
        root = new VectorSchemaRoot(renamed);
        root.setRowCount(rowCount);
        return this;
    }

    @Override
    public void close() {
        root.close();
    }

    @Override
    public String toString() {
        return String.format("ColumnarTable(columns=%s, rows=%d)", columnNames(), rowCount());
    }
}
