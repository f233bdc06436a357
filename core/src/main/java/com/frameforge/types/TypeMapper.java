package com.frameforge.types;

import com.frameforge.exception.UnsupportedTypeForEncodingException;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps frameforge DataTypes to Arrow columnar types and back.
 *
 * <p>This is the canonical wire encoding of the type model: every column of a
 * {@code ColumnarTable} is an Arrow vector whose field is produced here.
 *
 * <p>Key features:
 * <ul>
 *   <li>Complete coverage of the primitive types</li>
 *   <li>Support for complex types (arrays, maps, structs)</li>
 *   <li>Decimal precision/scale preservation</li>
 *   <li>Microsecond precision for timestamps and intervals</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   IntegerType          → Int(32, signed)
 *   StringType           → Utf8
 *   DecimalType(10, 2)   → Decimal(10, 2, 128)
 *   TimestampType        → Timestamp(MICROSECOND, "UTC")
 *   TimestampNTZType     → Timestamp(MICROSECOND, null)
 *   ArrayType(Integer)   → List&lt;element: Int(32)&gt;
 *   MapType(String, Int) → Map&lt;entries: Struct&lt;key: Utf8, value: Int(32)&gt;&gt;
 * </pre>
 *
 * @see DataType
 */
public class TypeMapper {

    /** Time zone of every TimestampType column; values are UTC instants. */
    public static final String TIMESTAMP_TIME_ZONE = "UTC";

    static final String LIST_ELEMENT_NAME = "element";
    static final String MAP_ENTRIES_NAME = "entries";
    static final String MAP_KEY_NAME = "key";
    static final String MAP_VALUE_NAME = "value";

    private TypeMapper() {} // Utility class

    /**
     * Converts a struct to an Arrow schema, one top-level Arrow field per struct field.
     *
     * @param schema the struct
     * @return the Arrow schema
     * @throws UnsupportedTypeForEncodingException if any field type has no encoding
     */
    public static Schema toArrowSchema(StructType schema) {
        List<Field> fields = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            fields.add(toArrowField(field));
        }
        return new Schema(fields);
    }

    /**
     * Converts a struct field to an Arrow field.
     *
     * @param field the struct field
     * @return the Arrow field
     */
    public static Field toArrowField(StructField field) {
        return toArrowField(field.name(), field.dataType(), field.nullable());
    }

    /**
     * Converts a named type to an Arrow field, including child fields of nested types.
     *
     * @param name the field name
     * @param type the data type
     * @param nullable whether the field may hold nulls
     * @return the Arrow field
     * @throws UnsupportedTypeForEncodingException if the type has no encoding
     */
    public static Field toArrowField(String name, DataType type, boolean nullable) {
        if (type instanceof StructType) {
            List<Field> children = new ArrayList<>();
            for (StructField child : ((StructType) type).fields()) {
                children.add(toArrowField(child));
            }
            return new Field(name, new FieldType(nullable, ArrowType.Struct.INSTANCE, null), children);
        }
        if (type instanceof ArrayType) {
            ArrayType array = (ArrayType) type;
            Field element = toArrowField(LIST_ELEMENT_NAME, array.elementType(), array.containsNull());
            return new Field(name, new FieldType(nullable, ArrowType.List.INSTANCE, null), List.of(element));
        }
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            if (map.keyType() instanceof NullType) {
                // Map keys are never null, so a null-typed key column cannot exist
                throw new UnsupportedTypeForEncodingException(map);
            }
            Field key = toArrowField(MAP_KEY_NAME, map.keyType(), false);
            Field value = toArrowField(MAP_VALUE_NAME, map.valueType(), map.valueContainsNull());
            Field entries = new Field(MAP_ENTRIES_NAME,
                FieldType.notNullable(ArrowType.Struct.INSTANCE), List.of(key, value));
            return new Field(name, new FieldType(nullable, new ArrowType.Map(false), null), List.of(entries));
        }
        if (type instanceof NullType) {
            return new Field(name, FieldType.nullable(ArrowType.Null.INSTANCE), null);
        }
        return new Field(name, new FieldType(nullable, toArrowType(type), null), null);
    }

    /**
     * Converts a primitive DataType to its Arrow type.
     *
     * @param type the data type
     * @return the Arrow type
     * @throws UnsupportedTypeForEncodingException if the type has no primitive encoding
     */
    public static ArrowType toArrowType(DataType type) {
        if (type instanceof NullType) return ArrowType.Null.INSTANCE;
        if (type instanceof BooleanType) return ArrowType.Bool.INSTANCE;
        if (type instanceof ByteType) return new ArrowType.Int(8, true);
        if (type instanceof ShortType) return new ArrowType.Int(16, true);
        if (type instanceof IntegerType) return new ArrowType.Int(32, true);
        if (type instanceof LongType) return new ArrowType.Int(64, true);
        if (type instanceof FloatType) return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        if (type instanceof DoubleType) return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        if (type instanceof DecimalType) {
            DecimalType d = (DecimalType) type;
            return new ArrowType.Decimal(d.precision(), d.scale(), 128);
        }
        if (type instanceof StringType) return ArrowType.Utf8.INSTANCE;
        if (type instanceof BinaryType) return ArrowType.Binary.INSTANCE;
        if (type instanceof DateType) return new ArrowType.Date(DateUnit.DAY);
        if (type instanceof TimestampType) return new ArrowType.Timestamp(TimeUnit.MICROSECOND, TIMESTAMP_TIME_ZONE);
        if (type instanceof TimestampNTZType) return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
        if (type instanceof DayTimeIntervalType) return new ArrowType.Duration(TimeUnit.MICROSECOND);

        // YearMonthIntervalType and nested types (which need child fields)
        throw new UnsupportedTypeForEncodingException(type);
    }

    /**
     * Converts an Arrow schema back to a struct.
     *
     * <p>This is the reverse operation of {@link #toArrowSchema(StructType)}.
     *
     * @param schema the Arrow schema
     * @return the struct type
     */
    public static StructType fromArrowSchema(Schema schema) {
        List<StructField> fields = new ArrayList<>();
        for (Field field : schema.getFields()) {
            fields.add(new StructField(field.getName(), fromArrowField(field), field.isNullable()));
        }
        return new StructType(fields);
    }

    /**
     * Converts an Arrow field to the DataType it encodes.
     *
     * @param field the Arrow field
     * @return the data type
     * @throws UnsupportedOperationException if the Arrow type has no counterpart
     */
    public static DataType fromArrowField(Field field) {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Null:
                return NullType.get();
            case Bool:
                return BooleanType.get();
            case Int:
                ArrowType.Int intType = (ArrowType.Int) type;
                switch (intType.getBitWidth()) {
                    case 8: return ByteType.get();
                    case 16: return ShortType.get();
                    case 32: return IntegerType.get();
                    case 64: return LongType.get();
                    default:
                        throw new UnsupportedOperationException("Unsupported Arrow type: " + type);
                }
            case FloatingPoint:
                ArrowType.FloatingPoint fpType = (ArrowType.FloatingPoint) type;
                return fpType.getPrecision() == FloatingPointPrecision.SINGLE
                    ? FloatType.get() : DoubleType.get();
            case Decimal:
                ArrowType.Decimal decimal = (ArrowType.Decimal) type;
                return new DecimalType(decimal.getPrecision(), decimal.getScale());
            case Utf8:
            case LargeUtf8:
                return StringType.get();
            case Binary:
            case LargeBinary:
                return BinaryType.get();
            case Date:
                return DateType.get();
            case Timestamp:
                ArrowType.Timestamp ts = (ArrowType.Timestamp) type;
                return ts.getTimezone() == null ? TimestampNTZType.get() : TimestampType.get();
            case Duration:
                return DayTimeIntervalType.get();
            case List:
                Field element = field.getChildren().get(0);
                return new ArrayType(fromArrowField(element), element.isNullable());
            case Map:
                Field entries = field.getChildren().get(0);
                Field key = entries.getChildren().get(0);
                Field value = entries.getChildren().get(1);
                return new MapType(fromArrowField(key), fromArrowField(value), value.isNullable());
            case Struct:
                List<StructField> children = new ArrayList<>();
                for (Field child : field.getChildren()) {
                    children.add(new StructField(child.getName(), fromArrowField(child), child.isNullable()));
                }
                return new StructType(children);
            default:
                throw new UnsupportedOperationException("Unsupported Arrow type: " + type);
        }
    }
}
