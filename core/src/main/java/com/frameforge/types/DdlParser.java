package com.frameforge.types;

/**
 * Parses a textual schema declaration into a data type.
 *
 * <p>A declaration is either a field list ({@code "a int, b string"}), which yields a
 * {@link StructType}, or a single type ({@code "int"}), which yields that type.
 * {@link SchemaParser} is the built-in implementation.
 */
@FunctionalInterface
public interface DdlParser {

    /**
     * Parses a DDL string.
     *
     * @param ddl the declaration
     * @return the parsed type
     * @throws IllegalArgumentException if the declaration is malformed
     */
    DataType parseDdl(String ddl);
}
