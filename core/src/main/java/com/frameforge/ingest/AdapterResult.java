package com.frameforge.ingest;

import com.frameforge.runtime.ColumnarTable;
import com.frameforge.types.StructType;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link TableSourceAdapter} hands to the {@link SchemaReconciler}.
 *
 * @param table the built table, owned by the result until reconciled
 * @param schema the resolved schema, or null to derive it from the table
 * @param columnNames names to apply to the table positionally, or null to keep its names
 * @param expectedColumnCount the column count the caller asked for, or null if unconstrained
 */
public record AdapterResult(ColumnarTable table,
                            StructType schema,
                            List<String> columnNames,
                            Integer expectedColumnCount) {

    public AdapterResult {
        Objects.requireNonNull(table, "table must not be null");
        columnNames = columnNames == null ? null : List.copyOf(columnNames);
    }

    /**
     * A result whose table and schema already agree.
     *
     * @param table the table
     * @param schema the schema
     * @return the result
     */
    public static AdapterResult of(ColumnarTable table, StructType schema) {
        return new AdapterResult(table, schema, null, null);
    }
}
