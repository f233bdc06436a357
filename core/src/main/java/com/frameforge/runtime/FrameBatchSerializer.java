package com.frameforge.runtime;

import com.frameforge.input.FrameColumn;
import com.frameforge.input.LocalFrame;
import com.frameforge.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serializes the columns of a {@link LocalFrame} into one Arrow batch.
 *
 * <p>The serializer is keyed by the session time zone, in which naive date-times are
 * localized when written to timestamp columns, and by the safe-cast flag, which decides
 * whether lossy numeric conversions fail or truncate.
 */
public class FrameBatchSerializer {

    private static final Logger logger = LoggerFactory.getLogger(FrameBatchSerializer.class);

    private final ArrowVectorWriter writer;

    /**
     * Creates a serializer.
     *
     * @param timeZone the session time zone
     * @param safeCast whether lossy conversions are refused
     */
    public FrameBatchSerializer(ZoneId timeZone, boolean safeCast) {
        this.writer = new ArrowVectorWriter(new ValueConverter(timeZone, safeCast));
    }

    /**
     * Builds the batch.
     *
     * @param frame the frame
     * @param schema one field per frame column, giving the column's name and type
     * @param allocator the allocator that will own the vectors
     * @return the table; the caller must close it
     * @throws IllegalArgumentException if the schema width differs from the frame's
     * @throws com.frameforge.exception.ValueConversionException if a value does not fit its column
     */
    public ColumnarTable serialize(LocalFrame frame, StructType schema, BufferAllocator allocator) {
        Objects.requireNonNull(frame, "frame must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        List<List<Object>> columns = new ArrayList<>(frame.columnCount());
        for (FrameColumn column : frame.columns()) {
            columns.add(column.values());
        }

        long startNanos = System.nanoTime();
        ColumnarTable table = writer.writeTable(schema, columns, frame.rowCount(), allocator);
        logger.debug("Serialized frame of {} rows x {} columns in {} us (timeZone={}, safe={})",
            frame.rowCount(), frame.columnCount(), (System.nanoTime() - startNanos) / 1_000,
            writer.getConverter().getTimeZone(), writer.getConverter().isSafe());
        return table;
    }
}
