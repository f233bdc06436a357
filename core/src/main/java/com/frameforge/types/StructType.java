package com.frameforge.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Represents a struct type (row schema) with named fields.
 *
 * <p>This is analogous to Spark's StructType and represents the schema of a local
 * table. Each field has a name, data type, and nullability flag. Field names are not
 * required to be unique; {@link #deduplicateFieldNames()} produces a copy with unique
 * names for consumers that need them.
 */
public final class StructType implements DataType {

    /** Empty struct type with no fields. */
    public static final StructType EMPTY = new StructType(Collections.emptyList());

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final List<StructField> fields;

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(List<StructField> fields) {
        this.fields = new ArrayList<>(fields);
    }

    /**
     * Creates a StructType with the given fields.
     *
     * @param fields the fields in this struct
     */
    public StructType(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this struct.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * Returns the field names in order.
     *
     * @return the field names
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            names.add(field.name());
        }
        return names;
    }

    /**
     * Returns the number of fields in this struct.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Returns the field at the given index.
     *
     * @param index the field index
     * @return the field
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the field with the given name, or null if not found.
     *
     * @param name the field name
     * @return the field, or null if not found
     */
    public StructField fieldByName(String name) {
        return fields.stream()
            .filter(f -> f.name().equals(name))
            .findFirst()
            .orElse(null);
    }

    /**
     * Returns the index of the field with the given name, or -1 if not found.
     *
     * @param name the field name
     * @return the field index, or -1 if not found
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns a new struct with a nullable field appended.
     *
     * @param name the field name
     * @param dataType the field type
     * @return the extended struct
     */
    public StructType add(String name, DataType dataType) {
        List<StructField> extended = new ArrayList<>(fields);
        extended.add(new StructField(name, dataType, true));
        return new StructType(extended);
    }

    /**
     * Returns a copy of this struct with the fields renamed positionally.
     *
     * @param names the new names, one per field
     * @return the renamed struct
     * @throws IllegalArgumentException if the name count differs from the field count
     */
    public StructType withFieldNames(List<String> names) {
        if (names.size() != fields.size()) {
            throw new IllegalArgumentException(
                "Expected " + fields.size() + " field names, got " + names.size());
        }
        List<StructField> renamed = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            renamed.add(fields.get(i).withName(names.get(i)));
        }
        return new StructType(renamed);
    }

    /**
     * Returns a copy of this struct in which duplicated field names are made unique
     * by suffixing {@code _0, _1, ...} in order of appearance. Unique names are kept.
     * Nested structs (also inside arrays and maps) are processed recursively.
     *
     * @return the deduplicated struct
     */
    public StructType deduplicateFieldNames() {
        Map<String, Integer> counts = new HashMap<>();
        for (StructField field : fields) {
            counts.merge(field.name(), 1, Integer::sum);
        }

        Map<String, Integer> next = new HashMap<>();
        List<StructField> deduped = new ArrayList<>(fields.size());
        for (StructField field : fields) {
            String name = field.name();
            if (counts.get(name) > 1) {
                int ordinal = next.merge(name, 1, Integer::sum) - 1;
                name = name + "_" + ordinal;
            }
            deduped.add(new StructField(name, deduplicate(field.dataType()), field.nullable()));
        }
        return new StructType(deduped);
    }

    private static DataType deduplicate(DataType type) {
        if (type instanceof StructType) {
            return ((StructType) type).deduplicateFieldNames();
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            return new ArrayType(deduplicate(array.elementType()), array.containsNull());
        }
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            return new MapType(deduplicate(map.keyType()), deduplicate(map.valueType()),
                map.valueContainsNull());
        }
        return type;
    }

    /**
     * Returns this schema in Spark's JSON schema format.
     *
     * <p>Example: {@code {"type":"struct","fields":[{"name":"id","type":"integer","nullable":true,"metadata":{}}]}}
     *
     * @return the JSON string
     */
    public String json() {
        try {
            return objectMapper.writeValueAsString(toJsonNode(this));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema to JSON", e);
        }
    }

    static JsonNode toJsonNode(DataType type) {
        if (type instanceof StructType) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "struct");
            ArrayNode fieldsNode = node.putArray("fields");
            for (StructField field : ((StructType) type).fields) {
                ObjectNode fieldNode = fieldsNode.addObject();
                fieldNode.put("name", field.name());
                fieldNode.set("type", toJsonNode(field.dataType()));
                fieldNode.put("nullable", field.nullable());
                fieldNode.putObject("metadata");
            }
            return node;
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "array");
            node.set("elementType", toJsonNode(array.elementType()));
            node.put("containsNull", array.containsNull());
            return node;
        }
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "map");
            node.set("keyType", toJsonNode(map.keyType()));
            node.set("valueType", toJsonNode(map.valueType()));
            node.put("valueContainsNull", map.valueContainsNull());
            return node;
        }
        return TextNode.valueOf(type.typeName());
    }

    @Override
    public String typeName() {
        return "struct";
    }

    @Override
    public String simpleString() {
        StringBuilder sb = new StringBuilder("struct<");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            StructField field = fields.get(i);
            sb.append(field.name()).append(':').append(field.dataType().simpleString());
        }
        return sb.append('>').toString();
    }

    @Override
    public int defaultSize() {
        return -1; // Variable length
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructType that = (StructType) o;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
