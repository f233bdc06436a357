package com.frameforge.ingest;

import com.frameforge.config.ConfigDefaults;
import com.frameforge.config.SessionConfig;
import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.exception.EmptyInputException;
import com.frameforge.exception.IngestionException;
import com.frameforge.exception.InvalidInputTypeException;
import com.frameforge.exception.InvalidRankException;
import com.frameforge.exception.UnresolvedTypeException;
import com.frameforge.input.ColumnStorage;
import com.frameforge.input.LocalFrame;
import com.frameforge.input.NdArray;
import com.frameforge.input.Row;
import com.frameforge.logical.LocalRelation;
import com.frameforge.test.TestBase;
import com.frameforge.test.TestCategories;
import com.frameforge.types.*;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.TimeStampMicroVector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for LocalDataIngestor.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("LocalDataIngestor Tests")
public class LocalDataIngestorTest extends TestBase {

    private BufferAllocator allocator;
    private SessionConfig config;
    private LocalDataIngestor ingestor;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator(Long.MAX_VALUE);
        config = new SessionConfig().set(ConfigDefaults.SESSION_TIME_ZONE, "UTC");
        ingestor = new LocalDataIngestor(allocator, config);
    }

    @Override
    protected void doTearDown() {
        allocator.close();
    }

    @Nested
    @DisplayName("Record Sequences")
    class RecordSequences {

        @Test
        @DisplayName("Scalars become a single value column")
        void testScalars() {
            try (LocalRelation relation = ingestor.createDataFrame(List.of(1, 2, 3))) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<value:int>");
                assertThat(relation.rowCount()).isEqualTo(3);
            }
        }

        @Test
        @DisplayName("Map keys are ordered lexicographically")
        void testMapKeyOrder() {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("b", 2);
            record.put("a", 1);

            try (LocalRelation relation = ingestor.createDataFrame(List.of(record))) {
                assertThat(relation.schema().fieldNames()).containsExactly("a", "b");
                assertThat(relation.table().columnNames()).containsExactly("a", "b");
            }
        }

        @Test
        @DisplayName("Named rows with names")
        void testNamedRows() {
            List<Row> rows = List.of(
                Row.named(List.of("name", "age"), List.of("Alice", 30)),
                Row.named(List.of("name", "age"), List.of("Bob", 25)));

            try (LocalRelation relation = ingestor.createDataFrame(rows)) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<name:string,age:int>");
            }
        }

        @Test
        @DisplayName("Column names rename tuples")
        void testColumnNames() {
            try (LocalRelation relation = ingestor.createDataFrame(
                    List.of(Row.of("Alice", 1L)), List.of("name", "id"))) {
                assertThat(relation.schema().fieldNames()).containsExactly("name", "id");
                assertThat(relation.table().columnNames()).containsExactly("name", "id");
            }
        }

        @Test
        @DisplayName("A column of only nulls cannot be typed")
        void testUnresolved() {
            assertThatThrownBy(() -> ingestor.createDataFrame(List.of(Row.of("Alice", null, 80.1))))
                .isInstanceOf(UnresolvedTypeException.class)
                .hasMessageContaining("CANNOT_DETERMINE_TYPE");
        }

        @Test
        @DisplayName("A schema types an all-null column")
        void testSchemaResolvesNulls() {
            try (LocalRelation relation = ingestor.createDataFrame(
                    List.of(Row.of("Alice", null, 80.1)), "name string, age int, score double")) {
                assertThat(relation.schema().fieldAt(1).dataType()).isEqualTo(IntegerType.get());
                assertThat(relation.table().getVector(1).isNull(0)).isTrue();
            }
        }

        @Test
        @DisplayName("Nested maps infer as structs when configured")
        void testDictAsStruct() {
            config.set(ConfigDefaults.INFER_DICT_AS_STRUCT, "true");
            List<Map<String, Object>> data = List.of(Map.of("p", Map.of("x", 1)));

            try (LocalRelation relation = ingestor.createDataFrame(data)) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<p:struct<x:int>>");
            }
        }
    }

    @Nested
    @DisplayName("Frames And Arrays")
    class FramesAndArrays {

        @Test
        @DisplayName("Frame columns keep their labels")
        void testFrame() {
            LocalFrame frame = LocalFrame.builder()
                .column("id", ColumnStorage.INT64, 1L, 2L)
                .column(7, ColumnStorage.OBJECT, "a", null)
                .build();

            try (LocalRelation relation = ingestor.createDataFrame(frame)) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<id:bigint,7:string>");
                assertThat(relation.rowCount()).isEqualTo(2);
            }
        }

        @Test
        @DisplayName("Frame names shorter than the columns are padded")
        void testFrameShortNames() {
            LocalFrame frame = LocalFrame.builder()
                .column("a", ColumnStorage.INT32, 1)
                .column("b", ColumnStorage.INT32, 2)
                .build();

            try (LocalRelation relation = ingestor.createDataFrame(frame, List.of("x"))) {
                assertThat(relation.schema().fieldNames()).containsExactly("x", "_2");
            }
        }

        @Test
        @DisplayName("Frame names longer than the columns fail")
        void testFrameLongNames() {
            LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT32, 1).build();

            assertThatThrownBy(() -> ingestor.createDataFrame(frame, List.of("x", "y")))
                .isInstanceOf(AxisLengthMismatchException.class);
            assertThat(allocator.getAllocatedMemory()).isZero();
        }

        @Test
        @DisplayName("Preferred timestamp_ntz applies to object columns")
        void testTimestampNtz() {
            config.set(ConfigDefaults.TIMESTAMP_TYPE, "TIMESTAMP_NTZ");
            LocalFrame frame = LocalFrame.builder()
                .column("at", ColumnStorage.OBJECT, LocalDateTime.of(1970, 1, 1, 0, 0, 2))
                .build();

            try (LocalRelation relation = ingestor.createDataFrame(frame)) {
                assertThat(relation.schema().fieldAt(0).dataType()).isEqualTo(TimestampNTZType.get());
                assertThat(((TimeStampMicroVector) relation.table().getVector(0)).get(0)).isEqualTo(2_000_000L);
            }
        }

        @Test
        @DisplayName("Array with too few names fails with both lengths")
        void testArrayNameMismatch() {
            NdArray array = NdArray.ofRows(new double[][] {{1, 2, 3}, {4, 5, 6}});

            assertThatThrownBy(() -> ingestor.createDataFrame(array, List.of("a", "b")))
                .isInstanceOf(AxisLengthMismatchException.class)
                .satisfies(e -> {
                    AxisLengthMismatchException mismatch = (AxisLengthMismatchException) e;
                    assertThat(mismatch.getExpected()).isEqualTo(2);
                    assertThat(mismatch.getActual()).isEqualTo(3);
                });
        }

        @Test
        @DisplayName("Primitive arrays are accepted directly")
        void testPrimitiveArray() {
            try (LocalRelation relation = ingestor.createDataFrame(new long[] {1, 2})) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<value:bigint>");
            }
        }

        @Test
        @DisplayName("Three-dimensional arrays are rejected")
        void testRank() {
            NdArray cube = NdArray.of(new int[] {2, 2, 2}, new double[8]);

            assertThatThrownBy(() -> ingestor.createDataFrame(cube))
                .isInstanceOf(InvalidRankException.class)
                .satisfies(e -> assertThat(((InvalidRankException) e).getRank()).isEqualTo(3));
        }

        @Test
        @DisplayName("Two-dimensional Java arrays are read as rows of columns")
        void testNestedPrimitiveArray() {
            try (LocalRelation relation = ingestor.createDataFrame(new double[][] {{1}, {2}})) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<value:double>");
                assertThat(relation.rowCount()).isEqualTo(2);
            }
        }

        @Test
        @DisplayName("Three-dimensional Java arrays are rejected before any column is built")
        void testNestedPrimitiveArrayRank() {
            assertThatThrownBy(() -> ingestor.createDataFrame(new double[2][2][2]))
                .isInstanceOf(InvalidRankException.class)
                .satisfies(e -> assertThat(((InvalidRankException) e).getRank()).isEqualTo(3));
            assertThat(allocator.getAllocatedMemory()).isZero();
        }
    }

    @Nested
    @DisplayName("Empty And Invalid Input")
    class EmptyAndInvalidInput {

        @Test
        @DisplayName("Empty input without schema cannot be inferred")
        void testEmptyWithoutSchema() {
            assertThatThrownBy(() -> ingestor.createDataFrame(Collections.emptyList()))
                .isInstanceOf(EmptyInputException.class);
        }

        @Test
        @DisplayName("Empty frame with schema gives an empty table")
        void testEmptyFrameWithSchema() {
            LocalFrame frame = LocalFrame.builder().column("a", ColumnStorage.INT64, List.of()).build();
            StructType schema = new StructType(new StructField("a", LongType.get(), true));

            try (LocalRelation relation = ingestor.createDataFrame(frame, schema)) {
                assertThat(relation.rowCount()).isZero();
                assertThat(relation.schema()).isEqualTo(schema);
            }
        }

        @Test
        @DisplayName("Empty list with an atomic schema gives an empty value column")
        void testEmptyWithAtomicSchema() {
            try (LocalRelation relation = ingestor.createDataFrame(List.of(), StringType.get())) {
                assertThat(relation.schema().simpleString()).isEqualTo("struct<value:string>");
            }
        }

        @Test
        @DisplayName("Already built relations are not accepted as input")
        void testRelationInput() {
            try (LocalRelation relation = ingestor.createDataFrame(List.of(1))) {
                assertThatThrownBy(() -> ingestor.createDataFrame(relation))
                    .isInstanceOf(InvalidInputTypeException.class)
                    .satisfies(e -> assertThat(((IngestionException) e).getMessageParameters())
                        .containsEntry("data_type", "LocalRelation"));
            }
        }

        @Test
        @DisplayName("Unsupported input classes are rejected")
        void testUnsupportedInput() {
            assertThatThrownBy(() -> ingestor.createDataFrame("text"))
                .isInstanceOf(InvalidInputTypeException.class);
        }

        @Test
        @DisplayName("Malformed DDL is rejected")
        void testMalformedDdl() {
            assertThatThrownBy(() -> ingestor.createDataFrame(List.of(1), "a foo"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Null input is rejected")
        void testNullInput() {
            assertThatThrownBy(() -> ingestor.createDataFrame(null))
                .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("Records mixing incompatible types fail")
        void testMergeConflict() {
            assertThatThrownBy(() -> ingestor.createDataFrame(Arrays.asList(Row.of(1), Row.of("x"))))
                .isInstanceOf(IngestionException.class)
                .satisfies(e -> assertThat(((IngestionException) e).getErrorClass()).isEqualTo("CANNOT_MERGE_TYPE"));
        }
    }
}
