package com.frameforge.logical;

import com.frameforge.runtime.ColumnarTable;
import com.frameforge.types.StructType;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Local data ready to be attached to a query plan: an Arrow table paired with the
 * schema that describes it.
 *
 * <p>The column names of the table and the field names of the schema always agree, in
 * number and order. The relation owns the table; closing the relation closes it.
 *
 * <p>The pair can be shipped as-is:
 * <ul>
 *   <li>{@link #schemaJson()} gives the schema in Spark's JSON format</li>
 *   <li>{@link #toArrowIpc()} gives the table in Arrow IPC streaming format</li>
 * </ul>
 */
public final class LocalRelation implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LocalRelation.class);

    private final ColumnarTable table;
    private final StructType schema;

    /**
     * Creates a local relation.
     *
     * @param table the table
     * @param schema the schema
     * @throws IllegalArgumentException if the schema does not have one field per column
     */
    public LocalRelation(ColumnarTable table, StructType schema) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        if (schema.size() != table.columnCount()) {
            throw new IllegalArgumentException("Schema has " + schema.size()
                + " fields but the table has " + table.columnCount() + " columns");
        }
    }

    public ColumnarTable table() {
        return table;
    }

    public StructType schema() {
        return schema;
    }

    public int rowCount() {
        return table.rowCount();
    }

    /**
     * Returns the schema as a Spark JSON schema string.
     *
     * @return the JSON schema
     */
    public String schemaJson() {
        return schema.json();
    }

    /**
     * Serializes the table as a single batch in Arrow IPC streaming format.
     *
     * @return the IPC bytes
     * @throws UncheckedIOException if writing fails
     */
    public byte[] toArrowIpc() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ArrowStreamWriter writer = new ArrowStreamWriter(table.root(), null, out)) {
            writer.start();
            writer.writeBatch();
            writer.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize local relation to Arrow IPC", e);
        }
        logger.debug("Serialized {} rows to {} bytes of Arrow IPC", table.rowCount(), out.size());
        return out.toByteArray();
    }

    @Override
    public void close() {
        table.close();
    }

    @Override
    public String toString() {
        return String.format("LocalRelation(rows=%d, schema=%s)", table.rowCount(), schema.simpleString());
    }
}
