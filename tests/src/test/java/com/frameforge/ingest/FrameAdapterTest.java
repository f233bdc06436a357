package com.frameforge.ingest;

import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.exception.UnsupportedTypeForEncodingException;
import com.frameforge.exception.ValueConversionException;
import com.frameforge.input.ColumnStorage;
import com.frameforge.input.LocalFrame;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.schema.InferenceOptions;
import com.frameforge.test.TestBase;
import com.frameforge.test.TestCategories;
import com.frameforge.types.*;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.TimeStampMicroTZVector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for FrameAdapter.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("FrameAdapter Tests")
public class FrameAdapterTest extends TestBase {

    private static final IngestionOptions OPTIONS =
        new IngestionOptions(InferenceOptions.DEFAULTS, ZoneId.of("Asia/Tokyo"), false);

    private BufferAllocator allocator;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator(Long.MAX_VALUE);
    }

    @Override
    protected void doTearDown() {
        allocator.close();
    }

    @Test
    @DisplayName("Column types follow the storage kinds")
    void testPhysicalSchema() {
        LocalFrame frame = LocalFrame.builder()
            .column("id", ColumnStorage.INT64, 1L)
            .column("name", ColumnStorage.OBJECT, "a")
            .column("at", ColumnStorage.DATETIME, LocalDateTime.of(1970, 1, 1, 9, 0))
            .column("took", ColumnStorage.TIMEDELTA, Duration.ofSeconds(1))
            .column("props", ColumnStorage.OBJECT, Map.of("k", 1))
            .build();

        assertThat(new FrameAdapter(OPTIONS).physicalSchema(frame)).isEqualTo(new StructType(
            new StructField("id", LongType.get(), true),
            new StructField("name", StringType.get(), true),
            new StructField("at", TimestampType.get(), true),
            new StructField("took", DayTimeIntervalType.get(), true),
            new StructField("props", new StructType(new StructField("k", IntegerType.get(), true)), true)));
    }

    @Test
    @DisplayName("Naive date-times are localized in the session time zone")
    void testLocalization() {
        LocalFrame frame = LocalFrame.builder()
            .column("at", ColumnStorage.DATETIME, LocalDateTime.of(1970, 1, 1, 9, 0))
            .build();

        AdapterResult result = new FrameAdapter(OPTIONS).adapt(frame, null, null, allocator);
        try (ColumnarTable table = result.table()) {
            assertThat(((TimeStampMicroTZVector) table.getVector(0)).get(0)).isZero();
            assertThat(result.schema()).isNull();
            assertThat(result.columnNames()).isNull();
        }
    }

    @Test
    @DisplayName("Short name lists are padded with positional names")
    void testShortNames() {
        LocalFrame frame = LocalFrame.builder()
            .column("a", ColumnStorage.INT32, 1)
            .column("b", ColumnStorage.INT32, 2)
            .column("c", ColumnStorage.INT32, 3)
            .build();

        AdapterResult result = new FrameAdapter(OPTIONS).adapt(frame, null, List.of("x"), allocator);
        try (ColumnarTable table = result.table()) {
            assertThat(result.columnNames()).containsExactly("x", "_2", "_3");
            assertThat(result.expectedColumnCount()).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("Long name lists are passed on for the reconciler to reject")
    void testLongNames() {
        LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT32, 1).build();

        AdapterResult result = new FrameAdapter(OPTIONS).adapt(frame, null, List.of("x", "y"), allocator);

        assertThat(result.expectedColumnCount()).isEqualTo(2);
        assertThatThrownBy(() -> new SchemaReconciler().reconcile(result))
            .isInstanceOf(AxisLengthMismatchException.class);
    }

    @Test
    @DisplayName("Struct schema types the columns")
    void testStructSchema() {
        LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT64, 7L).build();
        StructType schema = new StructType(new StructField("n", IntegerType.get(), true));

        AdapterResult result = new FrameAdapter(OPTIONS).adapt(frame, schema, null, allocator);
        try (ColumnarTable table = result.table()) {
            assertThat(table.columnNames()).containsExactly("n");
            assertThat(result.schema()).isEqualTo(schema);
        }
    }

    @Test
    @DisplayName("Schema width must match the frame")
    void testSchemaWidth() {
        LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT64, 7L).build();
        StructType schema = new StructType(
            new StructField("a", LongType.get(), true),
            new StructField("b", LongType.get(), true));

        assertThatThrownBy(() -> new FrameAdapter(OPTIONS).adapt(frame, schema, null, allocator))
            .isInstanceOf(AxisLengthMismatchException.class);
    }

    @Test
    @DisplayName("Atomic schema is not accepted for frames")
    void testAtomicSchema() {
        LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT64, 7L).build();

        assertThatThrownBy(() -> new FrameAdapter(OPTIONS).adapt(frame, LongType.get(), null, allocator))
            .isInstanceOf(UnsupportedTypeForEncodingException.class);
    }

    @Test
    @DisplayName("Safe cast refuses truncation, unsafe cast truncates")
    void testSafeCast() {
        LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.FLOAT64, 1.5).build();
        StructType schema = new StructType(new StructField("a", IntegerType.get(), true));
        IngestionOptions safe = new IngestionOptions(InferenceOptions.DEFAULTS, ZoneId.of("UTC"), true);

        assertThatThrownBy(() -> new FrameAdapter(safe).adapt(frame, schema, null, allocator))
            .isInstanceOf(ValueConversionException.class);
        try (ColumnarTable table = new FrameAdapter(OPTIONS).adapt(frame, schema, null, allocator).table()) {
            assertThat(table.getVector(0).getObject(0)).isEqualTo(1);
        }
    }
}
