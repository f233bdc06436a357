package com.frameforge.ingest;

import com.frameforge.exception.UnresolvedTypeException;
import com.frameforge.runtime.ArrowVectorWriter;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.runtime.ValueConverter;
import com.frameforge.schema.RecordAccess;
import com.frameforge.schema.SchemaInferrer;
import com.frameforge.types.DataType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a table from a generic sequence of records: maps, tuples and lists, named rows
 * and Java records, or bare scalars.
 *
 * <p>The records are first normalized. Maps are ordered by key, and if the first
 * non-null element is a scalar every element is wrapped into a one-element list, so
 * {@code [1, 2, 3]} becomes a one-column table named {@code value}.
 *
 * <p>Without a schema the schema is inferred, and it must be fully typed: a field that
 * only ever held nulls fails with {@link UnresolvedTypeException}. The table is then
 * written record by record against the schema with safe value conversion.
 */
public class RecordSequenceAdapter implements TableSourceAdapter<Object> {

    private static final Logger logger = LoggerFactory.getLogger(RecordSequenceAdapter.class);

    private final SchemaInferrer inferrer;
    private final ArrowVectorWriter writer;

    public RecordSequenceAdapter(IngestionOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.inferrer = new SchemaInferrer(options.inference());
        this.writer = new ArrowVectorWriter(new ValueConverter(options.timeZone(), true));
    }

    @Override
    public AdapterResult adapt(Object data, DataType schema, List<String> columnNames,
                               BufferAllocator allocator) {
        List<Object> raw = materialize(data);
        boolean scalars = holdsScalars(raw);
        List<Object> records = normalize(raw, scalars);
        List<String> names = columnNames;
        if (names == null && scalars) {
            names = List.of(SchemaInferrer.VALUE_FIELD);
        }

        StructType struct;
        Integer expected;
        if (schema != null) {
            struct = schema instanceof StructType
                ? (StructType) schema
                : new StructType(new StructField(SchemaInferrer.VALUE_FIELD, schema, true));
            expected = struct.size();
            names = null;
        } else {
            struct = inferrer.infer(records, names);
            if (names != null) {
                // Positional records wider than the name list extend it with _k
                names = SchemaInferrer.positionalNames(names, Math.max(names.size(), widestSequence(records)));
            }
            expected = names == null ? null : names.size();
            if (SchemaInferrer.hasNullType(struct)) {
                throw new UnresolvedTypeException(struct);
            }
        }

        logger.debug("Writing {} records against schema {}", records.size(), struct.simpleString());
        ColumnarTable table = writer.writeTable(struct, columns(records, struct), records.size(), allocator);
        return new AdapterResult(table, struct, names, expected);
    }

    /**
     * Copies the input into a list.
     *
     * @param data an {@link Iterable} or an object array
     * @return the elements in order
     */
    static List<Object> materialize(Object data) {
        if (data instanceof Object[]) {
            return new ArrayList<>(Arrays.asList((Object[]) data));
        }
        List<Object> records = new ArrayList<>();
        for (Object record : (Iterable<?>) data) {
            records.add(record);
        }
        return records;
    }

    private static List<Object> normalize(List<Object> records, boolean scalars) {
        if (!scalars) {
            List<Object> normalized = new ArrayList<>(records.size());
            for (Object record : records) {
                normalized.add(record instanceof Map ? RecordAccess.sortedEntries((Map<?, ?>) record) : record);
            }
            return normalized;
        }
        List<Object> wrapped = new ArrayList<>(records.size());
        for (Object record : records) {
            wrapped.add(Collections.singletonList(record));
        }
        return wrapped;
    }

    private static boolean holdsScalars(List<Object> records) {
        for (Object record : records) {
            if (record != null) {
                return !RecordAccess.isRecordShaped(record);
            }
        }
        return false;
    }

    private static int widestSequence(List<Object> records) {
        int widest = 0;
        for (Object record : records) {
            if (record != null && RecordAccess.isSequence(record)) {
                widest = Math.max(widest, RecordAccess.sequenceValues(record).size());
            }
        }
        return widest;
    }

    private List<List<Object>> columns(List<Object> records, StructType struct) {
        List<List<Object>> columns = new ArrayList<>(struct.size());
        for (int i = 0; i < struct.size(); i++) {
            columns.add(new ArrayList<>(records.size()));
        }
        for (Object record : records) {
            if (record == null) {
                for (List<Object> column : columns) {
                    column.add(null);
                }
                continue;
            }
            List<Object> values = writer.getConverter().structValues(record, struct, "record");
            for (int i = 0; i < struct.size(); i++) {
                columns.get(i).add(values.get(i));
            }
        }
        return columns;
    }
}
