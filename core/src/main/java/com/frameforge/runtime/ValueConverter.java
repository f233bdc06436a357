package com.frameforge.runtime;

import com.frameforge.exception.AxisLengthMismatchException;
import com.frameforge.exception.UnsupportedTypeForEncodingException;
import com.frameforge.exception.ValueConversionException;
import com.frameforge.schema.RecordAccess;
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
import com.frameforge.types.ShortType;
import com.frameforge.types.StringType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import com.frameforge.types.TimestampNTZType;
import com.frameforge.types.TimestampType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts Java values to the physical representation of a primitive column type.
 *
 * <p>Physical representations:
 * <ul>
 *   <li>boolean → {@code Boolean}</li>
 *   <li>byte/short/integer/long → {@code Byte}/{@code Short}/{@code Integer}/{@code Long}</li>
 *   <li>float/double → {@code Float}/{@code Double}</li>
 *   <li>decimal(p,s) → {@code BigDecimal} with scale {@code s}</li>
 *   <li>string → {@code String}; binary → {@code byte[]}</li>
 *   <li>date → days since epoch ({@code Integer})</li>
 *   <li>timestamp → microseconds since epoch, UTC ({@code Long})</li>
 *   <li>timestamp_ntz → microseconds since epoch of the wall-clock time ({@code Long})</li>
 *   <li>interval day to second → microseconds ({@code Long})</li>
 * </ul>
 *
 * <p>Naive date-times written to a timestamp column are localized in the configured
 * time zone. With safe casting enabled, numeric conversions that would overflow or
 * drop a fractional part fail with {@link ValueConversionException}; without it they
 * truncate the way a C cast does.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class ValueConverter {

    private final ZoneId timeZone;
    private final boolean safe;

    /**
     * Creates a converter.
     *
     * @param timeZone the zone used to localize naive date-times
     * @param safe whether lossy numeric conversions are refused
     */
    public ValueConverter(ZoneId timeZone, boolean safe) {
        this.timeZone = Objects.requireNonNull(timeZone, "timeZone must not be null");
        this.safe = safe;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public boolean isSafe() {
        return safe;
    }

    /**
     * Converts a non-null value to the physical representation of a primitive type.
     *
     * @param value the value, not null
     * @param type the target type
     * @param field the field path, used in error messages
     * @return the converted value
     * @throws ValueConversionException if the value cannot be represented
     */
    public Object convert(Object value, DataType type, String field) {
        if (type instanceof BooleanType) return toBoolean(value, type, field);
        if (type instanceof ByteType) return (byte) toIntegral(value, type, field, Byte.MIN_VALUE, Byte.MAX_VALUE);
        if (type instanceof ShortType) return (short) toIntegral(value, type, field, Short.MIN_VALUE, Short.MAX_VALUE);
        if (type instanceof IntegerType) return (int) toIntegral(value, type, field, Integer.MIN_VALUE, Integer.MAX_VALUE);
        if (type instanceof LongType) return toIntegral(value, type, field, Long.MIN_VALUE, Long.MAX_VALUE);
        if (type instanceof FloatType) return toFloat(value, type, field);
        if (type instanceof DoubleType) return toDouble(value, type, field);
        if (type instanceof DecimalType) return toDecimal(value, (DecimalType) type, field);
        if (type instanceof StringType) return toStringValue(value);
        if (type instanceof BinaryType) return toBinary(value, type, field);
        if (type instanceof DateType) return toEpochDay(value, type, field);
        if (type instanceof TimestampType) return toInstantMicros(value, type, field);
        if (type instanceof TimestampNTZType) return toLocalMicros(value, type, field);
        if (type instanceof DayTimeIntervalType) return toDurationMicros(value, type, field);

        throw new UnsupportedTypeForEncodingException(type);
    }

    /**
     * Reads the field values of a struct-shaped value in schema order.
     *
     * <p>Maps are read by (stringified) key, named-field objects by attribute, and ordered
     * sequences by position. Missing keys and attributes read as null.
     *
     * @param value the record, not null
     * @param struct the struct type
     * @param field the field path, used in error messages
     * @return one value per struct field
     * @throws AxisLengthMismatchException if a sequence has a different length than the struct
     * @throws ValueConversionException if the value is not record-shaped
     */
    public List<Object> structValues(Object value, StructType struct, String field) {
        List<Object> values = new ArrayList<>(struct.size());
        if (RecordAccess.isMapping(value)) {
            Map<String, Object> entries = RecordAccess.sortedEntries((Map<?, ?>) value);
            for (StructField f : struct.fields()) {
                values.add(entries.get(f.name()));
            }
            return values;
        }
        if (RecordAccess.isNamedObject(value)) {
            Map<String, Object> attributes = RecordAccess.namedFields(value);
            for (StructField f : struct.fields()) {
                values.add(attributes.get(f.name()));
            }
            return values;
        }
        if (RecordAccess.isSequence(value)) {
            List<Object> elements = RecordAccess.sequenceValues(value);
            if (elements.size() != struct.size()) {
                throw new AxisLengthMismatchException(struct.size(), elements.size());
            }
            return elements;
        }
        throw new ValueConversionException(field, struct, value, "not a record");
    }

    private Boolean toBoolean(Object value, DataType type, String field) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (!safe && value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        throw mismatch(value, type, field);
    }

    private long toIntegral(Object value, DataType type, String field, long min, long max) {
        if (value instanceof Boolean && !safe) {
            return (Boolean) value ? 1 : 0;
        }
        if (!(value instanceof Number)) {
            throw mismatch(value, type, field);
        }
        Number number = (Number) value;
        if (!safe) {
            return number.longValue();
        }

        BigDecimal exact = toBigDecimal(number, type, field);
        long result;
        try {
            result = exact.longValueExact();
        } catch (ArithmeticException e) {
            throw new ValueConversionException(field, type, value, "value is not an integer in range", e);
        }
        if (result < min || result > max) {
            throw new ValueConversionException(field, type, value, "integer overflow");
        }
        return result;
    }

    private Float toFloat(Object value, DataType type, String field) {
        if (!(value instanceof Number)) {
            throw mismatch(value, type, field);
        }
        float result = ((Number) value).floatValue();
        if (safe && isIntegralNumber(value) && !Float.isInfinite(result)
                && BigDecimal.valueOf(result).compareTo(toBigDecimal((Number) value, type, field)) != 0) {
            throw new ValueConversionException(field, type, value, "integer value is not exactly representable");
        }
        return result;
    }

    private Double toDouble(Object value, DataType type, String field) {
        if (!(value instanceof Number)) {
            throw mismatch(value, type, field);
        }
        double result = ((Number) value).doubleValue();
        if (safe && isIntegralNumber(value) && !Double.isInfinite(result)
                && BigDecimal.valueOf(result).compareTo(toBigDecimal((Number) value, type, field)) != 0) {
            throw new ValueConversionException(field, type, value, "integer value is not exactly representable");
        }
        return result;
    }

    private BigDecimal toDecimal(Object value, DecimalType type, String field) {
        if (!(value instanceof Number)) {
            throw mismatch(value, type, field);
        }
        BigDecimal decimal = toBigDecimal((Number) value, type, field);
        BigDecimal scaled;
        try {
            scaled = decimal.setScale(type.scale(), safe ? RoundingMode.UNNECESSARY : RoundingMode.DOWN);
        } catch (ArithmeticException e) {
            throw new ValueConversionException(field, type, value, "rescaling would lose digits", e);
        }
        // Precision overflow cannot be truncated into a decimal column
        if (scaled.precision() > type.precision()) {
            throw new ValueConversionException(field, type, value,
                "precision " + scaled.precision() + " exceeds " + type.precision());
        }
        return scaled;
    }

    private static String toStringValue(Object value) {
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        return String.valueOf(value);
    }

    private static byte[] toBinary(Object value, DataType type, String field) {
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        }
        throw mismatch(value, type, field);
    }

    private Integer toEpochDay(Object value, DataType type, String field) {
        LocalDate date;
        if (value instanceof LocalDate) {
            date = (LocalDate) value;
        } else if (value instanceof java.sql.Date) {
            date = ((java.sql.Date) value).toLocalDate();
        } else if (value instanceof LocalDateTime) {
            date = ((LocalDateTime) value).toLocalDate();
        } else {
            throw mismatch(value, type, field);
        }
        return Math.toIntExact(date.toEpochDay());
    }

    private Long toInstantMicros(Object value, DataType type, String field) {
        Instant instant;
        if (value instanceof Instant) {
            instant = (Instant) value;
        } else if (value instanceof OffsetDateTime) {
            instant = ((OffsetDateTime) value).toInstant();
        } else if (value instanceof ZonedDateTime) {
            instant = ((ZonedDateTime) value).toInstant();
        } else if (value instanceof java.sql.Timestamp) {
            instant = ((java.sql.Timestamp) value).toInstant();
        } else if (value instanceof LocalDateTime) {
            instant = ((LocalDateTime) value).atZone(timeZone).toInstant();
        } else if (value instanceof LocalDate) {
            instant = ((LocalDate) value).atStartOfDay(timeZone).toInstant();
        } else {
            throw mismatch(value, type, field);
        }
        return micros(instant, value, type, field);
    }

    private Long toLocalMicros(Object value, DataType type, String field) {
        LocalDateTime local;
        if (value instanceof LocalDateTime) {
            local = (LocalDateTime) value;
        } else if (value instanceof java.sql.Timestamp) {
            local = ((java.sql.Timestamp) value).toLocalDateTime();
        } else if (value instanceof LocalDate) {
            local = ((LocalDate) value).atStartOfDay();
        } else if (value instanceof Instant) {
            local = LocalDateTime.ofInstant((Instant) value, timeZone);
        } else if (value instanceof OffsetDateTime) {
            local = ((OffsetDateTime) value).atZoneSameInstant(timeZone).toLocalDateTime();
        } else if (value instanceof ZonedDateTime) {
            local = ((ZonedDateTime) value).withZoneSameInstant(timeZone).toLocalDateTime();
        } else {
            throw mismatch(value, type, field);
        }
        return micros(local.toInstant(ZoneOffset.UTC), value, type, field);
    }

    private Long toDurationMicros(Object value, DataType type, String field) {
        if (!(value instanceof Duration)) {
            throw mismatch(value, type, field);
        }
        Duration duration = (Duration) value;
        try {
            return Math.addExact(Math.multiplyExact(duration.getSeconds(), 1_000_000L),
                duration.getNano() / 1_000L);
        } catch (ArithmeticException e) {
            throw new ValueConversionException(field, type, value, "microsecond overflow", e);
        }
    }

    private Long micros(Instant instant, Object value, DataType type, String field) {
        try {
            return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
        } catch (ArithmeticException e) {
            throw new ValueConversionException(field, type, value, "microsecond overflow", e);
        }
    }

    private static BigDecimal toBigDecimal(Number number, DataType type, String field) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValueConversionException(field, type, number, "value is not finite");
            }
            return new BigDecimal(Double.toString(d));
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static boolean isIntegralNumber(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    private static ValueConversionException mismatch(Object value, DataType type, String field) {
        return new ValueConversionException(field, type, value,
            "incompatible value class " + value.getClass().getName());
    }
}
