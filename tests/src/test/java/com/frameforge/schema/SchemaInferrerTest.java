package com.frameforge.schema;

import com.frameforge.config.ConfigDefaults;
import com.frameforge.config.SessionConfig;
import com.frameforge.exception.EmptyInputException;
import com.frameforge.exception.InvalidInputTypeException;
import com.frameforge.exception.TypeMergeException;
import com.frameforge.exception.UnresolvedTypeException;
import com.frameforge.input.Row;
import com.frameforge.test.TestBase;
import com.frameforge.test.TestCategories;
import com.frameforge.types.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaInferrer and the value type rules behind it.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SchemaInferrer Tests")
public class SchemaInferrerTest extends TestBase {

    record Person(String name, int age) {}

    private final SchemaInferrer inferrer = new SchemaInferrer(InferenceOptions.DEFAULTS);

    private static DataType typeOf(Object value) {
        return ValueTypeInference.inferType(value, InferenceOptions.DEFAULTS);
    }

    @Nested
    @DisplayName("Value Types")
    class ValueTypes {

        @Test
        @DisplayName("Boxed primitives map to their own width")
        void testPrimitives() {
            assertThat(typeOf(null)).isEqualTo(NullType.get());
            assertThat(typeOf(true)).isEqualTo(BooleanType.get());
            assertThat(typeOf((byte) 1)).isEqualTo(ByteType.get());
            assertThat(typeOf((short) 1)).isEqualTo(ShortType.get());
            assertThat(typeOf(1)).isEqualTo(IntegerType.get());
            assertThat(typeOf(1L)).isEqualTo(LongType.get());
            assertThat(typeOf(1.0f)).isEqualTo(FloatType.get());
            assertThat(typeOf(1.0)).isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("Big numbers, text and bytes")
        void testObjects() {
            assertThat(typeOf(BigInteger.TEN)).isEqualTo(new DecimalType(38, 0));
            assertThat(typeOf(new BigDecimal("1.5"))).isEqualTo(new DecimalType(38, 18));
            assertThat(typeOf("x")).isEqualTo(StringType.get());
            assertThat(typeOf('x')).isEqualTo(StringType.get());
            assertThat(typeOf(new byte[] {1, 2})).isEqualTo(BinaryType.get());
        }

        @Test
        @DisplayName("Temporal values")
        void testTemporal() {
            assertThat(typeOf(LocalDate.of(2024, 1, 1))).isEqualTo(DateType.get());
            assertThat(typeOf(LocalDateTime.of(2024, 1, 1, 12, 0))).isEqualTo(TimestampType.get());
            assertThat(typeOf(Instant.EPOCH)).isEqualTo(TimestampType.get());
            assertThat(typeOf(Duration.ofSeconds(5))).isEqualTo(DayTimeIntervalType.get());
        }

        @Test
        @DisplayName("Local date-times infer as timestamp_ntz when preferred")
        void testPreferNtz() {
            InferenceOptions ntz = new InferenceOptions(false, false, true);

            assertThat(ValueTypeInference.inferType(LocalDateTime.of(2024, 1, 1, 0, 0), ntz))
                .isEqualTo(TimestampNTZType.get());
            assertThat(ValueTypeInference.inferType(Instant.EPOCH, ntz)).isEqualTo(TimestampType.get());
        }

        @Test
        @DisplayName("Lists merge their element types")
        void testArrays() {
            assertThat(typeOf(List.of(1, 2L))).isEqualTo(new ArrayType(LongType.get(), true));
            assertThat(typeOf(Arrays.asList(1, null))).isEqualTo(new ArrayType(IntegerType.get(), true));
            assertThat(typeOf(List.of())).isEqualTo(new ArrayType(NullType.get(), true));
            assertThat(typeOf(new int[] {1, 2})).isEqualTo(new ArrayType(IntegerType.get(), true));
        }

        @Test
        @DisplayName("First-element array inference ignores later elements")
        void testArrayFromFirstElement() {
            InferenceOptions first = new InferenceOptions(false, true, false);

            assertThat(ValueTypeInference.inferType(List.of(1, "a"), first))
                .isEqualTo(new ArrayType(IntegerType.get(), true));
            assertThatThrownBy(() -> typeOf(List.of(1, "a")))
                .isInstanceOf(TypeMergeException.class);
        }

        @Test
        @DisplayName("Maps infer as map types unless inferred as structs")
        void testMaps() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("b", 1);
            map.put("a", 2L);

            assertThat(typeOf(map)).isEqualTo(new MapType(StringType.get(), LongType.get(), true));
            assertThat(ValueTypeInference.inferType(map, new InferenceOptions(true, false, false)))
                .isEqualTo(new StructType(
                    new StructField("a", LongType.get(), true),
                    new StructField("b", IntegerType.get(), true)));
        }

        @Test
        @DisplayName("Positional rows become _k structs, records keep component order")
        void testNested() {
            assertThat(typeOf(Row.of(1, "x"))).isEqualTo(new StructType(
                new StructField("_1", IntegerType.get(), true),
                new StructField("_2", StringType.get(), true)));
            assertThat(typeOf(new Person("a", 1))).isEqualTo(new StructType(
                new StructField("name", StringType.get(), true),
                new StructField("age", IntegerType.get(), true)));
        }

        @Test
        @DisplayName("Values of unknown classes are rejected")
        void testUnknownClass() {
            assertThatThrownBy(() -> typeOf(new Object()))
                .isInstanceOf(InvalidInputTypeException.class)
                .satisfies(e -> assertThat(((InvalidInputTypeException) e).getErrorClass())
                    .isEqualTo("INVALID_TYPE"));
        }
    }

    @Nested
    @DisplayName("Record Schemas")
    class RecordSchemas {

        @Test
        @DisplayName("Map records are ordered by key")
        void testMapRecords() {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("b", "x");
            record.put("a", 1);

            StructType schema = inferrer.infer(List.of(record), null);

            assertThat(schema.fieldNames()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Records are merged across the input")
        void testMerge() {
            StructType schema = inferrer.infer(List.of(
                Arrays.asList(1, null),
                Arrays.asList(2L, "x")), null);

            assertThat(schema).isEqualTo(new StructType(
                new StructField("_1", LongType.get(), true),
                new StructField("_2", StringType.get(), true)));
        }

        @Test
        @DisplayName("Caller names apply to positional records")
        void testColumnNames() {
            StructType schema = inferrer.infer(List.of(List.of(1, "x", 2.0)), List.of("id", "name"));

            assertThat(schema.fieldNames()).containsExactly("id", "name", "_3");
        }

        @Test
        @DisplayName("Scalars are named value")
        void testScalars() {
            StructType schema = inferrer.infer(List.of(1, 2), null);

            assertThat(schema).isEqualTo(new StructType(new StructField("value", IntegerType.get(), true)));
        }

        @Test
        @DisplayName("Null records are skipped")
        void testNullRecords() {
            StructType schema = inferrer.infer(Arrays.asList(null, List.of("x")), null);

            assertThat(schema.fieldNames()).containsExactly("_1");
        }

        @Test
        @DisplayName("Empty input cannot be inferred")
        void testEmpty() {
            assertThatThrownBy(() -> inferrer.infer(Collections.emptyList(), null))
                .isInstanceOf(EmptyInputException.class)
                .hasMessageContaining("CANNOT_INFER_EMPTY_SCHEMA");
        }

        @Test
        @DisplayName("All-null input leaves nothing to infer")
        void testAllNull() {
            assertThatThrownBy(() -> inferrer.infer(Arrays.asList(null, null), null))
                .isInstanceOf(UnresolvedTypeException.class);
        }

        @Test
        @DisplayName("A field seen only as null stays NullType")
        void testNullField() {
            StructType schema = inferrer.infer(List.of(Arrays.asList("Alice", null, 80.1)), null);

            assertThat(schema.fieldAt(1).dataType()).isEqualTo(NullType.get());
            assertThat(SchemaInferrer.hasNullType(schema)).isTrue();
        }
    }

    @Nested
    @DisplayName("Helpers")
    class Helpers {

        @Test
        @DisplayName("positionalNames pads and cuts to the width")
        void testPositionalNames() {
            assertThat(SchemaInferrer.positionalNames(null, 3)).containsExactly("_1", "_2", "_3");
            assertThat(SchemaInferrer.positionalNames(List.of("a"), 3)).containsExactly("a", "_2", "_3");
            assertThat(SchemaInferrer.positionalNames(List.of("a", "b", "c"), 2)).containsExactly("a", "b");
        }

        @Test
        @DisplayName("hasNullType looks inside nested types")
        void testHasNullType() {
            assertThat(SchemaInferrer.hasNullType(IntegerType.get())).isFalse();
            assertThat(SchemaInferrer.hasNullType(new ArrayType(NullType.get(), true))).isTrue();
            assertThat(SchemaInferrer.hasNullType(new MapType(StringType.get(), NullType.get(), true))).isTrue();
            assertThat(SchemaInferrer.hasNullType(new StructType(
                new StructField("s", new StructType(new StructField("n", NullType.get(), true)), true))))
                .isTrue();
        }

        @Test
        @DisplayName("Inference options are read from the session configuration")
        void testOptionsFromConfig() {
            SessionConfig config = new SessionConfig()
                .set(ConfigDefaults.INFER_DICT_AS_STRUCT, "true")
                .set(ConfigDefaults.TIMESTAMP_TYPE, "TIMESTAMP_NTZ");

            assertThat(InferenceOptions.fromConfig(config)).isEqualTo(new InferenceOptions(true, false, true));
            assertThat(InferenceOptions.fromConfig(new SessionConfig())).isEqualTo(InferenceOptions.DEFAULTS);
        }
    }
}
