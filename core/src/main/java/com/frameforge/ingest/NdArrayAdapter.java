package com.frameforge.ingest;

import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.exception.InvalidRankException;
import com.frameforge.input.NdArray;
import com.frameforge.runtime.ArrowVectorWriter;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.runtime.ValueConverter;
import com.frameforge.schema.SchemaInferrer;
import com.frameforge.types.DataType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import org.apache.arrow.memory.BufferAllocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a table from a one- or two-dimensional {@link NdArray}.
 *
 * <p>Each column of the array becomes one table column. Without a schema the columns
 * keep the array's storage type and are named {@code value} (a single column) or
 * {@code _1 .. _k}; caller-supplied names must match the column count exactly. Naming
 * is settled here, so the reconciler gets no name list.
 */
public class NdArrayAdapter implements TableSourceAdapter<NdArray> {

    private final ArrowVectorWriter writer;

    public NdArrayAdapter(IngestionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.writer = new ArrowVectorWriter(new ValueConverter(options.timeZone(), options.safeArrayCast()));
    }

    @Override
    public AdapterResult adapt(NdArray array, DataType schema, List<String> columnNames,
                               BufferAllocator allocator) {
        if (array.rank() != 1 && array.rank() != 2) {
            throw new InvalidRankException(array.rank());
        }
        int columnCount = array.columnCount();

        if (schema != null) {
            StructType struct = schema instanceof StructType
                ? (StructType) schema
                : new StructType(new StructField(SchemaInferrer.VALUE_FIELD, schema, true));
            if (struct.size() != columnCount) {
                throw new AxisLengthMismatchException(struct.size(), columnCount);
            }
            ColumnarTable table = writer.writeTable(struct, columns(array), array.length(), allocator);
            return AdapterResult.of(table, struct);
        }

        List<String> names = columnNames != null ? columnNames : defaultNames(columnCount);
        if (names.size() != columnCount) {
            throw new AxisLengthMismatchException(names.size(), columnCount);
        }

        DataType type = array.storage().nativeType();
        List<StructField> fields = new ArrayList<>(columnCount);
        for (String name : names) {
            fields.add(new StructField(name, type, true));
        }
        ColumnarTable table = writer.writeTable(new StructType(fields), columns(array), array.length(), allocator);
        return new AdapterResult(table, null, null, null);
    }

    /**
     * Returns the default column names of an array.
     *
     * @param columnCount the number of columns
     * @return {@code [value]} for one column, otherwise {@code [_1, .., _k]}
     */
    static List<String> defaultNames(int columnCount) {
        if (columnCount == 1) {
            return List.of(SchemaInferrer.VALUE_FIELD);
        }
        return SchemaInferrer.positionalNames(null, columnCount);
    }

    private static List<List<Object>> columns(NdArray array) {
        List<List<Object>> columns = new ArrayList<>(array.columnCount());
        for (int i = 0; i < array.columnCount(); i++) {
            columns.add(array.column(i));
        }
        return columns;
    }
}
