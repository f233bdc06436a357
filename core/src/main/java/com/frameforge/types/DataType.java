package com.frameforge.types;

/**
 * Sealed interface for all data types in the frameforge type system.
 *
 * <p>This represents the data type of a column or of a value observed in local data.
 * The type system follows Spark's DataType hierarchy and maps cleanly onto Arrow's
 * columnar types (see {@link TypeMapper}).
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Primitive types: IntegerType, LongType, DoubleType, StringType, etc.</li>
 *   <li>Temporal types: DateType, TimestampType, TimestampNTZType, DayTimeIntervalType</li>
 *   <li>Complex types: ArrayType, MapType, StructType</li>
 *   <li>NullType, the type of a value that is always null</li>
 * </ul>
 *
 * <p>Types are immutable and compared structurally.
 */
public sealed interface DataType
    permits NullType, BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType, BinaryType,
            DateType, TimestampType, TimestampNTZType,
            DayTimeIntervalType, YearMonthIntervalType,
            ArrayType, MapType, StructType {

    /**
     * Returns the name of this data type as used in Spark's JSON schema format.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the canonical DDL form of this type (e.g. {@code int},
     * {@code array<string>}, {@code struct<a:bigint>}).
     *
     * <p>The result can be read back by {@link SchemaParser}.
     *
     * @return the DDL string
     */
    default String simpleString() {
        return typeName();
    }

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Array).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
