package com.frameforge.runtime;

import com.frameforge.exception.ValueConversionException;
import com.frameforge.schema.RecordAccess;
import com.frameforge.types.ArrayType;
import com.frameforge.types.DataType;
import com.frameforge.types.MapType;
import com.frameforge.types.NullType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import com.frameforge.types.TypeMapper;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.DurationVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.NullVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.MapVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.pojo.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes Java values into Arrow vectors, one column at a time.
 *
 * <p>Each column is described by a {@link StructField}. Values are converted with a
 * {@link ValueConverter} and written recursively: arrays into list vectors, maps into map
 * vectors (an entries struct of key and value), structs into struct vectors. Nulls are
 * written as Arrow nulls unless the field is non-nullable, in which case the write fails.
 *
 * <p>Example usage:
 * <pre>
 *   ArrowVectorWriter writer = new ArrowVectorWriter(new ValueConverter(ZoneOffset.UTC, true));
 *   try (ColumnarTable table = writer.writeTable(schema, columns, rowCount, allocator)) {
 *       ...
 *   }
 * </pre>
 */
public class ArrowVectorWriter {

    private static final Logger logger = LoggerFactory.getLogger(ArrowVectorWriter.class);

    private final ValueConverter converter;

    public ArrowVectorWriter(ValueConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    public ValueConverter getConverter() {
        return converter;
    }

    /**
     * Builds a table from column-major values.
     *
     * <p>Vectors are created against the deduplicated schema (Arrow struct children need
     * unique names), and the top-level columns are renamed back to the schema's names
     * afterwards. If anything fails, every vector created so far is released before the
     * exception propagates.
     *
     * @param schema the table schema, one field per column
     * @param columns the values of each column, each of length {@code rowCount}
     * @param rowCount the number of rows
     * @param allocator the allocator that will own the vectors
     * @return the table; the caller must close it
     * @throws ValueConversionException if a value cannot be stored in its column
     * @throws com.frameforge.exception.UnsupportedTypeForEncodingException if a type has no encoding
     */
    public ColumnarTable writeTable(StructType schema, List<? extends List<?>> columns,
                                    int rowCount, BufferAllocator allocator) {
        if (columns.size() != schema.size()) {
            throw new IllegalArgumentException("Schema has " + schema.size() + " fields but "
                + columns.size() + " columns were supplied");
        }

        StructType physical = schema.deduplicateFieldNames();
        List<FieldVector> vectors = new ArrayList<>(physical.size());
        try {
            for (int i = 0; i < physical.size(); i++) {
                StructField field = physical.fieldAt(i);
                Field arrowField = TypeMapper.toArrowField(field);
                FieldVector vector = arrowField.createVector(allocator);
                vectors.add(vector);
                vector.allocateNew();
                writeColumn(vector, schema.fieldAt(i), columns.get(i), rowCount);
            }
            ColumnarTable table = ColumnarTable.fromVectors(vectors, rowCount, allocator);
            vectors = null;
            return table.renameColumns(schema.fieldNames());
        } catch (RuntimeException e) {
            if (vectors != null) {
                for (FieldVector vector : vectors) {
                    vector.close();
                }
            }
            logger.debug("Failed to write table of schema {}: {}", schema.simpleString(), e.getMessage());
            throw e;
        }
    }

    /**
     * Writes all values of one column and sets the vector's value count.
     *
     * @param vector the allocated vector for the column
     * @param field the logical field (name is used in error messages)
     * @param values the values, at least {@code rowCount} of them
     * @param rowCount the number of values to write
     */
    public void writeColumn(FieldVector vector, StructField field, List<?> values, int rowCount) {
        for (int row = 0; row < rowCount; row++) {
            write(vector, row, values.get(row), field.dataType(), field.nullable(), field.name());
        }
        vector.setValueCount(rowCount);
    }

    private void write(FieldVector vector, int index, Object value, DataType type,
                       boolean nullable, String path) {
        if (value == null) {
            if (!nullable) {
                throw new ValueConversionException(path, type, null, "null value in non-nullable field");
            }
            setNull(vector, index);
            return;
        }
        if (type instanceof NullType) {
            throw new ValueConversionException(path, type, value, "only nulls fit a void column");
        }
        if (type instanceof StructType) {
            writeStruct((StructVector) vector, index, value, (StructType) type, path);
        } else if (type instanceof MapType) {
            writeMap((MapVector) vector, index, value, (MapType) type, path);
        } else if (type instanceof ArrayType) {
            writeArray((ListVector) vector, index, value, (ArrayType) type, path);
        } else {
            writePrimitive(vector, index, converter.convert(value, type, path));
        }
    }

    private void writeStruct(StructVector vector, int index, Object value, StructType type, String path) {
        List<Object> fieldValues = converter.structValues(value, type, path);
        List<FieldVector> children = vector.getChildrenFromFields();
        vector.setIndexDefined(index);
        for (int i = 0; i < type.size(); i++) {
            StructField field = type.fieldAt(i);
            write(children.get(i), index, fieldValues.get(i), field.dataType(), field.nullable(),
                path + "." + field.name());
        }
    }

    private void writeArray(ListVector vector, int index, Object value, ArrayType type, String path) {
        if (!RecordAccess.isSequence(value)) {
            throw new ValueConversionException(path, type, value, "not a sequence");
        }
        List<Object> elements = RecordAccess.sequenceValues(value);
        FieldVector child = vector.getDataVector();
        int offset = vector.startNewValue(index);
        for (int i = 0; i < elements.size(); i++) {
            write(child, offset + i, elements.get(i), type.elementType(), type.containsNull(),
                path + "[" + i + "]");
        }
        vector.endValue(index, elements.size());
    }

    private void writeMap(MapVector vector, int index, Object value, MapType type, String path) {
        if (!(value instanceof Map)) {
            throw new ValueConversionException(path, type, value, "not a map");
        }
        Map<?, ?> map = (Map<?, ?>) value;
        StructVector entries = (StructVector) vector.getDataVector();
        List<FieldVector> keyAndValue = entries.getChildrenFromFields();
        int offset = vector.startNewValue(index);
        int i = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.setIndexDefined(offset + i);
            write(keyAndValue.get(0), offset + i, entry.getKey(), type.keyType(), false, path + ".key");
            write(keyAndValue.get(1), offset + i, entry.getValue(), type.valueType(),
                type.valueContainsNull(), path + ".value");
            i++;
        }
        vector.endValue(index, map.size());
    }

    private static void writePrimitive(FieldVector vector, int index, Object value) {
        if (vector instanceof BitVector) {
            ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
        } else if (vector instanceof TinyIntVector) {
            ((TinyIntVector) vector).setSafe(index, (Byte) value);
        } else if (vector instanceof SmallIntVector) {
            ((SmallIntVector) vector).setSafe(index, (Short) value);
        } else if (vector instanceof IntVector) {
            ((IntVector) vector).setSafe(index, (Integer) value);
        } else if (vector instanceof BigIntVector) {
            ((BigIntVector) vector).setSafe(index, (Long) value);
        } else if (vector instanceof Float4Vector) {
            ((Float4Vector) vector).setSafe(index, (Float) value);
        } else if (vector instanceof Float8Vector) {
            ((Float8Vector) vector).setSafe(index, (Double) value);
        } else if (vector instanceof DecimalVector) {
            ((DecimalVector) vector).setSafe(index, (BigDecimal) value);
        } else if (vector instanceof VarCharVector) {
            ((VarCharVector) vector).setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
        } else if (vector instanceof VarBinaryVector) {
            ((VarBinaryVector) vector).setSafe(index, (byte[]) value);
        } else if (vector instanceof DateDayVector) {
            ((DateDayVector) vector).setSafe(index, (Integer) value);
        } else if (vector instanceof TimeStampVector) {
            ((TimeStampVector) vector).setSafe(index, (Long) value);
        } else if (vector instanceof DurationVector) {
            ((DurationVector) vector).setSafe(index, (Long) value);
        } else {
            throw new IllegalStateException("Unexpected vector " + vector.getClass().getSimpleName());
        }
    }

    private static void setNull(FieldVector vector, int index) {
        if (vector instanceof NullVector) {
            return;
        }
        if (vector instanceof BaseFixedWidthVector) {
            ((BaseFixedWidthVector) vector).setNull(index);
        } else if (vector instanceof BaseVariableWidthVector) {
            ((BaseVariableWidthVector) vector).setNull(index);
        } else if (vector instanceof ListVector) {
            ((ListVector) vector).setNull(index);
        } else if (vector instanceof StructVector) {
            ((StructVector) vector).setNull(index);
        } else {
            throw new IllegalStateException("Unexpected vector " + vector.getClass().getSimpleName());
        }
    }
}
