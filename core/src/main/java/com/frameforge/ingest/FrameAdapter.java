package com.frameforge.ingest;

import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.exception.UnsupportedTypeForEncodingException;
import com.frameforge.input.FrameColumn;
import com.frameforge.input.LocalFrame;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.runtime.FrameBatchSerializer;
import com.frameforge.schema.InferenceOptions;
import com.frameforge.schema.ValueTypeInference;
import com.frameforge.types.DataType;
import com.frameforge.types.NullType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import com.frameforge.types.TypeMerger;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds a table from a {@link LocalFrame}.
 *
 * <p>Column types come from the caller's struct schema when there is one. Otherwise each
 * column is typed by its storage: date-time storage as timestamp, duration storage as
 * interval day to second, fixed-width storage as its native type, and object storage by
 * inference over the values (nested maps as structs).
 *
 * <p>A column name list shorter than the frame is padded with {@code _k}. A longer list
 * is passed on unchanged and fails in the reconciler, after the table was built.
 */
public class FrameAdapter implements TableSourceAdapter<LocalFrame> {

    private static final Logger logger = LoggerFactory.getLogger(FrameAdapter.class);

    private final IngestionOptions options;
    private final FrameBatchSerializer serializer;

    public FrameAdapter(IngestionOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.serializer = new FrameBatchSerializer(options.timeZone(), options.safeArrayCast());
    }

    @Override
    public AdapterResult adapt(LocalFrame frame, DataType schema, List<String> columnNames,
                               BufferAllocator allocator) {
        if (schema != null && !(schema instanceof StructType)) {
            throw new UnsupportedTypeForEncodingException(schema);
        }

        if (schema != null) {
            StructType struct = (StructType) schema;
            if (struct.size() != frame.columnCount()) {
                throw new AxisLengthMismatchException(struct.size(), frame.columnCount());
            }
            ColumnarTable table = serializer.serialize(frame, struct, allocator);
            return new AdapterResult(table, struct, null, struct.size());
        }

        List<String> names = null;
        Integer expected = null;
        if (columnNames != null) {
            names = new ArrayList<>(columnNames);
            for (int i = names.size(); i < frame.columnCount(); i++) {
                names.add("_" + (i + 1));
            }
            expected = names.size();
            if (names.size() > frame.columnCount()) {
                logger.debug("{} column names for a frame of {} columns", names.size(), frame.columnCount());
            }
        }

        StructType physical = physicalSchema(frame);
        ColumnarTable table = serializer.serialize(frame, physical, allocator);
        return new AdapterResult(table, null, names, expected);
    }

    /**
     * Derives the column types of a frame from its storage kinds.
     *
     * @param frame the frame
     * @return one nullable field per column, named after the column label
     */
    StructType physicalSchema(LocalFrame frame) {
        InferenceOptions objectInference = new InferenceOptions(true,
            options.inference().inferArrayFromFirstElement(),
            options.inference().preferTimestampNtz());

        List<StructField> fields = new ArrayList<>(frame.columnCount());
        for (FrameColumn column : frame.columns()) {
            DataType type = column.storage().nativeType();
            if (type == null) {
                type = NullType.get();
                for (Object value : column.values()) {
                    type = TypeMerger.merge(type, ValueTypeInference.inferType(value, objectInference));
                }
            }
            fields.add(new StructField(column.name(), type, true));
        }
        return new StructType(fields);
    }
}
