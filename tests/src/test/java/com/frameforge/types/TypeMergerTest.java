package com.frameforge.types;

import com.frameforge.exception.TypeMergeException;
import com.frameforge.test.TestBase;
import com.frameforge.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeMerger.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("TypeMerger Tests")
public class TypeMergerTest extends TestBase {

    static Stream<Arguments> promotions() {
        return Stream.of(
            Arguments.of(ByteType.get(), ShortType.get(), ShortType.get()),
            Arguments.of(ShortType.get(), IntegerType.get(), IntegerType.get()),
            Arguments.of(IntegerType.get(), LongType.get(), LongType.get()),
            Arguments.of(LongType.get(), FloatType.get(), FloatType.get()),
            Arguments.of(FloatType.get(), DoubleType.get(), DoubleType.get()),
            Arguments.of(IntegerType.get(), DoubleType.get(), DoubleType.get()),
            Arguments.of(IntegerType.get(), new DecimalType(5, 2), new DecimalType(12, 2)),
            Arguments.of(LongType.get(), DecimalType.BIG_INTEGER, DecimalType.BIG_INTEGER),
            Arguments.of(new DecimalType(10, 2), new DecimalType(5, 4), new DecimalType(12, 4)),
            Arguments.of(DecimalType.SYSTEM_DEFAULT, DecimalType.BIG_INTEGER, new DecimalType(38, 18)),
            Arguments.of(DecimalType.SYSTEM_DEFAULT, DoubleType.get(), DoubleType.get())
        );
    }

    @Nested
    @DisplayName("Atomic Types")
    class AtomicTypes {

        @Test
        @DisplayName("Equal types merge to themselves")
        void testEqual() {
            assertThat(TypeMerger.merge(StringType.get(), StringType.get())).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("NullType yields to the other side")
        void testNullType() {
            assertThat(TypeMerger.merge(NullType.get(), LongType.get())).isEqualTo(LongType.get());
            assertThat(TypeMerger.merge(DateType.get(), NullType.get())).isEqualTo(DateType.get());
            assertThat(TypeMerger.merge(NullType.get(), NullType.get())).isEqualTo(NullType.get());
        }

        @Test
        @DisplayName("Incompatible types fail with both types in the error")
        void testIncompatible() {
            assertThatThrownBy(() -> TypeMerger.merge(StringType.get(), IntegerType.get()))
                .isInstanceOf(TypeMergeException.class)
                .satisfies(e -> {
                    TypeMergeException tme = (TypeMergeException) e;
                    assertThat(tme.getLeft()).isEqualTo(StringType.get());
                    assertThat(tme.getRight()).isEqualTo(IntegerType.get());
                    assertThat(tme.getErrorClass()).isEqualTo("CANNOT_MERGE_TYPE");
                });
        }

        @Test
        @DisplayName("Timestamp and timestamp_ntz do not merge")
        void testTimestampKinds() {
            assertThatThrownBy(() -> TypeMerger.merge(TimestampType.get(), TimestampNTZType.get()))
                .isInstanceOf(TypeMergeException.class);
        }
    }

    @Nested
    @DisplayName("Numeric Promotion")
    class NumericPromotion {

        @ParameterizedTest(name = "{0} + {1} = {2}")
        @MethodSource("com.frameforge.types.TypeMergerTest#promotions")
        @DisplayName("Numeric types promote to the wider type")
        void testPromotion(DataType left, DataType right, DataType expected) {
            assertThat(TypeMerger.merge(left, right)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} + {1} is commutative")
        @MethodSource("com.frameforge.types.TypeMergerTest#promotions")
        @DisplayName("Numeric promotion is commutative")
        void testCommutative(DataType left, DataType right, DataType expected) {
            assertThat(TypeMerger.merge(right, left)).isEqualTo(TypeMerger.merge(left, right));
        }
    }

    @Nested
    @DisplayName("Nested Types")
    class NestedTypes {

        @Test
        @DisplayName("Arrays merge element types and containsNull")
        void testArrays() {
            DataType merged = TypeMerger.merge(
                new ArrayType(IntegerType.get(), false), new ArrayType(LongType.get(), true));

            assertThat(merged).isEqualTo(new ArrayType(LongType.get(), true));
        }

        @Test
        @DisplayName("Array of NullType takes the other element type")
        void testEmptyArray() {
            DataType merged = TypeMerger.merge(
                new ArrayType(NullType.get(), true), new ArrayType(StringType.get(), true));

            assertThat(merged).isEqualTo(new ArrayType(StringType.get(), true));
        }

        @Test
        @DisplayName("Maps merge key and value types")
        void testMaps() {
            DataType merged = TypeMerger.merge(
                new MapType(StringType.get(), IntegerType.get(), false),
                new MapType(StringType.get(), NullType.get(), true));

            assertThat(merged).isEqualTo(new MapType(StringType.get(), IntegerType.get(), true));
        }

        @Test
        @DisplayName("Array and map do not merge")
        void testArrayAndMap() {
            assertThatThrownBy(() -> TypeMerger.merge(
                new ArrayType(StringType.get()), new MapType(StringType.get(), StringType.get())))
                .isInstanceOf(TypeMergeException.class);
        }
    }

    @Nested
    @DisplayName("Struct Merging")
    class StructMerging {

        @Test
        @DisplayName("Fields merge by name, new right fields are appended and nullable")
        void testByName() {
            StructType left = new StructType(
                new StructField("a", IntegerType.get(), false),
                new StructField("b", NullType.get(), true));
            StructType right = new StructType(
                new StructField("b", StringType.get(), false),
                new StructField("c", DoubleType.get(), false));

            StructType merged = TypeMerger.mergeStructs(left, right);

            assertThat(merged.fieldNames()).containsExactly("a", "b", "c");
            assertThat(merged.fieldAt(0)).isEqualTo(new StructField("a", IntegerType.get(), true));
            assertThat(merged.fieldAt(1)).isEqualTo(new StructField("b", StringType.get(), true));
            assertThat(merged.fieldAt(2)).isEqualTo(new StructField("c", DoubleType.get(), true));
        }

        @Test
        @DisplayName("Fields present on both sides keep non-nullability")
        void testBothNonNullable() {
            StructType left = new StructType(new StructField("a", IntegerType.get(), false));
            StructType right = new StructType(new StructField("a", LongType.get(), false));

            assertThat(TypeMerger.mergeStructs(left, right).fieldAt(0))
                .isEqualTo(new StructField("a", LongType.get(), false));
        }

        @Test
        @DisplayName("A field null in one record and typed in another becomes typed and nullable")
        void testNullThenTyped() {
            StructType first = new StructType(new StructField("x", NullType.get(), false));
            StructType second = new StructType(new StructField("x", IntegerType.get(), false));

            StructField merged = TypeMerger.mergeStructs(first, second).fieldAt(0);

            assertThat(merged.dataType()).isEqualTo(IntegerType.get());
            assertThat(merged.nullable()).isTrue();
        }

        @Test
        @DisplayName("Identical name lists with duplicates merge by position")
        void testDuplicateNames() {
            StructType left = new StructType(
                new StructField("a", IntegerType.get(), true),
                new StructField("a", NullType.get(), true));
            StructType right = new StructType(
                new StructField("a", NullType.get(), true),
                new StructField("a", StringType.get(), true));

            StructType merged = TypeMerger.mergeStructs(left, right);

            assertThat(merged.fieldAt(0).dataType()).isEqualTo(IntegerType.get());
            assertThat(merged.fieldAt(1).dataType()).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("Struct merge is commutative up to field order")
        void testCommutativeUpToOrder() {
            StructType left = new StructType(
                new StructField("a", IntegerType.get(), true),
                new StructField("b", StringType.get(), true));
            StructType right = new StructType(
                new StructField("c", LongType.get(), true),
                new StructField("a", LongType.get(), true));

            StructType lr = TypeMerger.mergeStructs(left, right);
            StructType rl = TypeMerger.mergeStructs(right, left);

            assertThat(lr.fieldNames()).containsExactly("a", "b", "c");
            assertThat(rl.fieldNames()).containsExactly("c", "a", "b");
            for (StructField field : lr.fields()) {
                assertThat(rl.fieldByName(field.name())).isEqualTo(field);
            }
        }

        @Test
        @DisplayName("Conflicting field types fail")
        void testConflict() {
            StructType left = new StructType(new StructField("a", IntegerType.get(), true));
            StructType right = new StructType(new StructField("a", BooleanType.get(), true));

            assertThatThrownBy(() -> TypeMerger.merge(left, right))
                .isInstanceOf(TypeMergeException.class);
        }
    }
}
