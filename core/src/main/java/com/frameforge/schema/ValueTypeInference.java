package com.frameforge.schema;

import com.frameforge.exception.InvalidInputTypeException;
import com.frameforge.input.Row;
import com.frameforge.types.ArrayType;
import com.frameforge.types.BinaryType;
import com.frameforge.types.BooleanType;
import com.frameforge.types.ByteType;
import com.frameforge.types.DataType;
import com.frameforge.types.DateType;
import com.frameforge.types.DayTimeIntervalType;
import com.frameforge.types.DecimalType;
import com.frameforge.types.DoubleType;
import com.frameforge.types.FloatType;
import com.frameforge.types.IntegerType;
import com.frameforge.types.LongType;
import com.frameforge.types.MapType;
import com.frameforge.types.NullType;
import com.frameforge.types.ShortType;
import com.frameforge.types.StringType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import com.frameforge.types.TimestampNTZType;
import com.frameforge.types.TimestampType;
import com.frameforge.types.TypeMerger;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Infers the data type of a single value.
 *
 * <h2>Type Rules</h2>
 * <ul>
 *   <li>null → NullType</li>
 *   <li>Boolean, Byte, Short, Integer, Long, Float, Double → the matching type</li>
 *   <li>BigInteger → decimal(38,0); BigDecimal → decimal(38,18)</li>
 *   <li>CharSequence, Character → string; byte[] → binary</li>
 *   <li>LocalDate, java.sql.Date → date</li>
 *   <li>Instant, OffsetDateTime, ZonedDateTime → timestamp</li>
 *   <li>LocalDateTime, java.sql.Timestamp → timestamp_ntz if preferred, else timestamp</li>
 *   <li>Duration → interval day to second</li>
 *   <li>Map → struct with sorted keys, or map of merged key/value types</li>
 *   <li>List, arrays → array of merged element types (or of the first element's type)</li>
 *   <li>Row, Java record → struct</li>
 * </ul>
 */
public final class ValueTypeInference {

    private ValueTypeInference() {}

    /**
     * Infers the type of a value.
     *
     * @param value the value, may be null
     * @param options inference switches
     * @return the inferred type
     * @throws InvalidInputTypeException if no type can be inferred for the value's class
     */
    public static DataType inferType(Object value, InferenceOptions options) {
        if (value == null) {
            return NullType.get();
        }
        if (value instanceof Boolean) return BooleanType.get();
        if (value instanceof Byte) return ByteType.get();
        if (value instanceof Short) return ShortType.get();
        if (value instanceof Integer) return IntegerType.get();
        if (value instanceof Long) return LongType.get();
        if (value instanceof Float) return FloatType.get();
        if (value instanceof Double) return DoubleType.get();
        if (value instanceof BigInteger) return DecimalType.BIG_INTEGER;
        if (value instanceof BigDecimal) return DecimalType.SYSTEM_DEFAULT;
        if (value instanceof CharSequence || value instanceof Character) return StringType.get();
        if (value instanceof byte[]) return BinaryType.get();

        // java.sql.Timestamp extends java.util.Date, so it is checked first
        if (value instanceof java.sql.Timestamp || value instanceof LocalDateTime) {
            return options.preferTimestampNtz() ? TimestampNTZType.get() : TimestampType.get();
        }
        if (value instanceof LocalDate || value instanceof java.sql.Date) return DateType.get();
        if (value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime) {
            return TimestampType.get();
        }
        if (value instanceof Duration) return DayTimeIntervalType.get();

        if (value instanceof Map) {
            return inferMapType((Map<?, ?>) value, options);
        }
        if (value instanceof Row && !((Row) value).hasFieldNames()) {
            return inferTupleType((Row) value, options);
        }
        if (RecordAccess.isNamedObject(value)) {
            return inferStructType(RecordAccess.namedFields(value), options);
        }
        if (RecordAccess.isSequence(value)) {
            return inferArrayType(RecordAccess.sequenceValues(value), options);
        }

        throw new InvalidInputTypeException("value", value.getClass().getName());
    }

    private static DataType inferMapType(Map<?, ?> map, InferenceOptions options) {
        if (options.inferDictAsStruct()) {
            return inferStructType(RecordAccess.sortedEntries(map), options);
        }
        DataType keyType = NullType.get();
        DataType valueType = NullType.get();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            keyType = TypeMerger.merge(keyType, inferType(entry.getKey(), options));
            valueType = TypeMerger.merge(valueType, inferType(entry.getValue(), options));
        }
        return new MapType(keyType, valueType, true);
    }

    private static DataType inferArrayType(List<Object> elements, InferenceOptions options) {
        if (options.inferArrayFromFirstElement()) {
            DataType first = elements.isEmpty() ? NullType.get() : inferType(elements.get(0), options);
            return new ArrayType(first, true);
        }
        DataType elementType = NullType.get();
        for (Object element : elements) {
            elementType = TypeMerger.merge(elementType, inferType(element, options));
        }
        return new ArrayType(elementType, true);
    }

    private static DataType inferTupleType(Row row, InferenceOptions options) {
        List<StructField> fields = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            fields.add(new StructField("_" + (i + 1), inferType(row.get(i), options), true));
        }
        return new StructType(fields);
    }

    static StructType inferStructType(Map<String, Object> fields, InferenceOptions options) {
        List<StructField> structFields = new ArrayList<>(fields.size());
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            structFields.add(new StructField(entry.getKey(), inferType(entry.getValue(), options), true));
        }
        return new StructType(structFields);
    }
}
