package com.frameforge.types;

import com.frameforge.test.TestBase;
import com.frameforge.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StructType.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("StructType Tests")
public class StructTypeTest extends TestBase {

    @Test
    @DisplayName("Duplicate names get ordinal suffixes, unique names are kept")
    void testDeduplicateFieldNames() {
        StructType schema = new StructType(
            new StructField("a", IntegerType.get(), true),
            new StructField("b", StringType.get(), true),
            new StructField("a", LongType.get(), true));

        StructType deduped = schema.deduplicateFieldNames();

        assertThat(deduped.fieldNames()).containsExactly("a_0", "b", "a_1");
        assertThat(deduped.fieldAt(2).dataType()).isEqualTo(LongType.get());
    }

    @Test
    @DisplayName("Deduplication reaches structs nested in arrays")
    void testDeduplicateNested() {
        StructType inner = new StructType(
            new StructField("x", IntegerType.get(), true),
            new StructField("x", IntegerType.get(), true));
        StructType schema = new StructType(new StructField("arr", new ArrayType(inner, true), true));

        ArrayType array = (ArrayType) schema.deduplicateFieldNames().fieldAt(0).dataType();

        assertThat(((StructType) array.elementType()).fieldNames()).containsExactly("x_0", "x_1");
    }

    @Test
    @DisplayName("withFieldNames renames positionally and checks the count")
    void testWithFieldNames() {
        StructType schema = new StructType(
            new StructField("a", IntegerType.get(), false),
            new StructField("b", StringType.get(), true));

        StructType renamed = schema.withFieldNames(List.of("x", "y"));

        assertThat(renamed.fieldAt(0)).isEqualTo(new StructField("x", IntegerType.get(), false));
        assertThatThrownBy(() -> schema.withFieldNames(List.of("x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("json() produces Spark's JSON schema format")
    void testJson() {
        StructType schema = new StructType(
            new StructField("id", LongType.get(), false),
            new StructField("tags", new ArrayType(StringType.get(), true), true));

        assertThat(schema.json()).isEqualTo(
            "{\"type\":\"struct\",\"fields\":["
                + "{\"name\":\"id\",\"type\":\"long\",\"nullable\":false,\"metadata\":{}},"
                + "{\"name\":\"tags\",\"type\":{\"type\":\"array\",\"elementType\":\"string\",\"containsNull\":true},"
                + "\"nullable\":true,\"metadata\":{}}]}");
    }

    @Test
    @DisplayName("Lookup by name finds the first match")
    void testLookup() {
        StructType schema = new StructType(
            new StructField("a", IntegerType.get(), true),
            new StructField("b", StringType.get(), true),
            new StructField("b", LongType.get(), true));

        assertThat(schema.fieldIndex("b")).isEqualTo(1);
        assertThat(schema.fieldIndex("z")).isEqualTo(-1);
        assertThat(schema.fieldByName("b").dataType()).isEqualTo(StringType.get());
        assertThat(schema.fieldByName("z")).isNull();
    }

    @Test
    @DisplayName("add() appends a nullable field without changing the original")
    void testAdd() {
        StructType schema = StructType.EMPTY.add("value", IntegerType.get());

        assertThat(schema.fieldAt(0)).isEqualTo(new StructField("value", IntegerType.get(), true));
        assertThat(StructType.EMPTY.size()).isZero();
        assertThat(schema.simpleString()).isEqualTo("struct<value:int>");
    }
}
