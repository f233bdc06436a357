package com.frameforge.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses schema strings into StructType objects.
 *
 * <p>Supports two formats:
 * <ul>
 *   <li>Spark DDL format: {@code struct<name:type,name2:type2>} or {@code name type, name2 type2}</li>
 *   <li>JSON format: {@code {"type":"struct","fields":[{"name":"id","type":"integer","nullable":false},...]}}</li>
 * </ul>
 *
 * <p>Examples (DDL format):
 * <ul>
 *   <li>{@code struct<id:int,name:string>}</li>
 *   <li>{@code id int NOT NULL, name string}</li>
 *   <li>{@code struct<tags:array<string>>}</li>
 *   <li>{@code struct<data:map<string,int>>}</li>
 *   <li>{@code struct<point:struct<x:double,y:double>>}</li>
 * </ul>
 */
public class SchemaParser implements DdlParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String NOT_NULL_SUFFIX = " not null";

    /**
     * Parses a declaration that is either a field list or a single type.
     *
     * <p>A string that parses as a single type ({@code "int"}, {@code "array<string>"})
     * yields that type; anything else is parsed as a field list.
     *
     * @param ddl the declaration
     * @return the parsed type
     * @throws IllegalArgumentException if the declaration is invalid
     */
    @Override
    public DataType parseDdl(String ddl) {
        if (ddl == null || ddl.trim().isEmpty()) {
            throw new IllegalArgumentException("Schema string cannot be null or empty");
        }
        String trimmed = ddl.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("\"")) {
            return parseJsonDataType(readJson(trimmed));
        }
        if (isSingleType(trimmed)) {
            return parseType(trimmed);
        }
        return parseStructFields(trimmed);
    }

    /**
     * Returns true if a declaration names one type rather than a list of fields: it has
     * no top-level comma or colon, is not a quoted name, and has no top-level whitespace
     * except inside an {@code interval} type name.
     */
    private static boolean isSingleType(String declaration) {
        if (declaration.startsWith("`")) {
            return false;
        }
        boolean multiWordName = declaration.toLowerCase(Locale.ROOT).startsWith("interval ");
        int depth = 0;
        for (int i = 0; i < declaration.length(); i++) {
            char c = declaration.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (depth == 0) {
                if (c == ',' || c == ':') {
                    return false;
                }
                if (Character.isWhitespace(c) && !multiWordName) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Parses a Spark schema string into a StructType.
     *
     * @param schemaStr the schema string in DDL or JSON format
     * @return the parsed StructType
     * @throws IllegalArgumentException if the schema string is invalid
     */
    public static StructType parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isEmpty()) {
            throw new IllegalArgumentException("Schema string cannot be null or empty");
        }

        String trimmed = schemaStr.trim();

        // Handle JSON format: {"type":"struct","fields":[...]}
        if (trimmed.startsWith("{")) {
            return parseJsonStructType(readJson(trimmed));
        }

        // Handle struct<...> format (DDL)
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("struct<") && trimmed.endsWith(">")) {
            String inner = trimmed.substring(7, trimmed.length() - 1);
            return parseStructFields(inner);
        }

        // Try parsing as simple field list (fallback)
        return parseStructFields(trimmed);
    }

    /**
     * Parses a single type string such as {@code bigint} or {@code map<string,array<int>>}.
     *
     * @param typeStr the type string
     * @return the parsed DataType
     * @throws IllegalArgumentException if the type string is invalid
     */
    public static DataType parseDataType(String typeStr) {
        return parseType(typeStr);
    }

    private static JsonNode readJson(String jsonStr) {
        try {
            return objectMapper.readTree(jsonStr);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON schema: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON node representing a struct type.
     */
    private static StructType parseJsonStructType(JsonNode node) {
        JsonNode fieldsNode = node.get("fields");
        if (fieldsNode == null || !fieldsNode.isArray()) {
            return new StructType(new ArrayList<>());
        }

        List<StructField> fields = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            String name = fieldNode.get("name").asText();
            boolean nullable = fieldNode.has("nullable") ? fieldNode.get("nullable").asBoolean() : true;
            DataType dataType = parseJsonDataType(fieldNode.get("type"));
            fields.add(new StructField(name, dataType, nullable));
        }

        return new StructType(fields);
    }

    /**
     * Parses a JSON node representing a data type.
     * Handles both simple types (string like "integer") and complex types (object like {"type":"array",...}).
     */
    private static DataType parseJsonDataType(JsonNode typeNode) {
        if (typeNode == null) {
            throw new IllegalArgumentException("Type node cannot be null");
        }

        // Simple type as string: "integer", "string", etc.
        if (typeNode.isTextual()) {
            return parsePrimitiveType(typeNode.asText().toLowerCase(Locale.ROOT));
        }

        // Complex type as object: {"type":"array", "elementType":...}
        if (typeNode.isObject()) {
            String typeName = typeNode.get("type").asText().toLowerCase(Locale.ROOT);

            switch (typeName) {
                case "array":
                    JsonNode elementType = typeNode.get("elementType");
                    boolean containsNull = !typeNode.has("containsNull")
                        || typeNode.get("containsNull").asBoolean();
                    return new ArrayType(parseJsonDataType(elementType), containsNull);

                case "map":
                    JsonNode keyType = typeNode.get("keyType");
                    JsonNode valueType = typeNode.get("valueType");
                    boolean valueContainsNull = !typeNode.has("valueContainsNull")
                        || typeNode.get("valueContainsNull").asBoolean();
                    return new MapType(parseJsonDataType(keyType), parseJsonDataType(valueType),
                        valueContainsNull);

                case "struct":
                    return parseJsonStructType(typeNode);

                default:
                    // Could be a primitive type in object form
                    return parsePrimitiveType(typeName);
            }
        }

        throw new IllegalArgumentException("Unsupported type node: " + typeNode);
    }

    /**
     * Parses the inner content of a struct (field definitions).
     *
     * @param fieldsStr the comma-separated field definitions
     * @return the parsed StructType
     */
    private static StructType parseStructFields(String fieldsStr) {
        if (fieldsStr.trim().isEmpty()) {
            return new StructType(new ArrayList<>());
        }

        List<StructField> fields = new ArrayList<>();
        List<String> fieldDefs = splitTopLevel(fieldsStr, ',');

        for (String fieldDef : fieldDefs) {
            fields.add(parseField(fieldDef.trim()));
        }

        return new StructType(fields);
    }

    /**
     * Parses a single field definition.
     *
     * @param fieldDef the field definition (e.g., "name:string", "id int" or "id int NOT NULL")
     * @return the parsed StructField
     */
    private static StructField parseField(String fieldDef) {
        String name;
        String rest;
        if (fieldDef.startsWith("`")) {
            int closing = fieldDef.indexOf('`', 1);
            if (closing == -1) {
                throw new IllegalArgumentException("Unterminated quoted field name: " + fieldDef);
            }
            name = fieldDef.substring(1, closing);
            rest = fieldDef.substring(closing + 1).trim();
        } else {
            int end = 0;
            while (end < fieldDef.length()
                    && fieldDef.charAt(end) != ':'
                    && !Character.isWhitespace(fieldDef.charAt(end))) {
                end++;
            }
            name = fieldDef.substring(0, end);
            rest = fieldDef.substring(end).trim();
        }
        if (rest.startsWith(":")) {
            rest = rest.substring(1).trim();
        }
        if (name.isEmpty() || rest.isEmpty()) {
            throw new IllegalArgumentException("Invalid field definition: " + fieldDef);
        }

        boolean nullable = true;
        if (rest.toLowerCase(Locale.ROOT).endsWith(NOT_NULL_SUFFIX)) {
            nullable = false;
            rest = rest.substring(0, rest.length() - NOT_NULL_SUFFIX.length()).trim();
        }

        DataType dataType = parseType(rest);
        return new StructField(name, dataType, nullable);
    }

    /**
     * Parses a type string into a DataType.
     *
     * @param typeStr the type string
     * @return the parsed DataType
     */
    private static DataType parseType(String typeStr) {
        String trimmed = typeStr.trim();
        String normalized = trimmed.toLowerCase(Locale.ROOT);

        // Handle array types: array<elementType>
        if (normalized.startsWith("array<") && normalized.endsWith(">")) {
            String elementTypeStr = trimmed.substring(6, trimmed.length() - 1);
            DataType elementType = parseType(elementTypeStr);
            return new ArrayType(elementType);
        }

        // Handle map types: map<keyType,valueType>
        if (normalized.startsWith("map<") && normalized.endsWith(">")) {
            String inner = trimmed.substring(4, trimmed.length() - 1);
            int commaIndex = findTopLevelComma(inner);
            if (commaIndex == -1) {
                throw new IllegalArgumentException("Invalid map type: " + typeStr);
            }
            String keyTypeStr = inner.substring(0, commaIndex).trim();
            String valueTypeStr = inner.substring(commaIndex + 1).trim();
            DataType keyType = parseType(keyTypeStr);
            DataType valueType = parseType(valueTypeStr);
            return new MapType(keyType, valueType);
        }

        // Handle nested struct types
        if (normalized.startsWith("struct<") && normalized.endsWith(">")) {
            return parseStructFields(trimmed.substring(7, trimmed.length() - 1));
        }

        // Handle primitive types
        return parsePrimitiveType(normalized.replaceAll("\\s+", " "));
    }

    /**
     * Parses a primitive type string.
     *
     * @param typeStr the normalized type string (lowercase)
     * @return the DataType
     */
    private static DataType parsePrimitiveType(String typeStr) {
        switch (typeStr) {
            case "void":
            case "null":
                return NullType.get();

            // Integer types
            case "byte":
            case "tinyint":
                return ByteType.get();
            case "short":
            case "smallint":
                return ShortType.get();
            case "int":
            case "integer":
                return IntegerType.get();
            case "long":
            case "bigint":
                return LongType.get();

            // Floating point types
            case "float":
            case "real":
                return FloatType.get();
            case "double":
                return DoubleType.get();

            // String and boolean
            case "string":
            case "varchar":
            case "text":
                return StringType.get();
            case "boolean":
            case "bool":
                return BooleanType.get();

            // Temporal types
            case "date":
                return DateType.get();
            case "timestamp":
            case "timestamp_ltz":
                return TimestampType.get();
            case "timestamp_ntz":
                return TimestampNTZType.get();
            case "interval day to second":
                return DayTimeIntervalType.get();
            case "interval year to month":
                return YearMonthIntervalType.get();

            // Binary
            case "binary":
            case "blob":
                return BinaryType.get();

            case "decimal":
            case "dec":
            case "numeric":
                return new DecimalType(10, 0);

            default:
                // Handle decimal types: decimal(p,s)
                if (typeStr.startsWith("decimal(") || typeStr.startsWith("numeric(")
                        || typeStr.startsWith("dec(")) {
                    return parseDecimalType(typeStr);
                }
                throw new IllegalArgumentException("Unsupported type: " + typeStr);
        }
    }

    /**
     * Parses a decimal type string.
     *
     * @param typeStr the decimal type string (e.g., "decimal(10,2)")
     * @return the DecimalType
     */
    private static DecimalType parseDecimalType(String typeStr) {
        int start = typeStr.indexOf('(');
        int end = typeStr.indexOf(')');
        if (start == -1 || end == -1 || end != typeStr.length() - 1) {
            throw new IllegalArgumentException("Invalid decimal type: " + typeStr);
        }

        String params = typeStr.substring(start + 1, end);
        String[] parts = params.split(",");
        try {
            int precision = Integer.parseInt(parts[0].trim());
            int scale = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            return new DecimalType(precision, scale);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal type: " + typeStr, e);
        }
    }

    /**
     * Splits a string by a delimiter, respecting nested angle brackets.
     *
     * @param str the string to split
     * @param delimiter the delimiter character
     * @return the list of parts
     */
    private static List<String> splitTopLevel(String str, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (c == delimiter && depth == 0) {
                String part = str.substring(start, i).trim();
                if (!part.isEmpty()) {
                    parts.add(part);
                }
                start = i + 1;
            }
        }

        // Add the last part
        if (start < str.length()) {
            String part = str.substring(start).trim();
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }

        return parts;
    }

    /**
     * Finds the top-level comma in a string (ignoring nested angle brackets).
     *
     * @param str the string to search
     * @return the index of the comma, or -1 if not found
     */
    private static int findTopLevelComma(String str) {
        int depth = 0;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
