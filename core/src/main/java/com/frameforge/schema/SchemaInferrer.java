package com.frameforge.schema;

import com.frameforge.exception.EmptyInputException;
import com.frameforge.exception.UnresolvedTypeException;
import com.frameforge.types.ArrayType;
import com.frameforge.types.DataType;
import com.frameforge.types.MapType;
import com.frameforge.types.NullType;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import com.frameforge.types.TypeMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Infers one schema for a sequence of heterogeneous records.
 *
 * <p>Each record gets its own schema according to its shape, and the per-record schemas
 * are merged left to right with {@link TypeMerger}:
 * <ul>
 *   <li>mapping: one field per key, sorted by key</li>
 *   <li>named-field object: one field per attribute, in declaration order</li>
 *   <li>ordered sequence: one field per position, named from the column names and padded
 *       with {@code _k} (1-based) if there are fewer names than values</li>
 *   <li>scalar: a single field named {@code value}</li>
 * </ul>
 *
 * <p>Null records are skipped. Fields typed only by nulls stay {@link NullType}; callers
 * that need a fully typed schema check {@link #hasNullType(DataType)}.
 */
public class SchemaInferrer {

    private static final Logger logger = LoggerFactory.getLogger(SchemaInferrer.class);

    /** Name of the single field describing a non-record value. */
    public static final String VALUE_FIELD = "value";

    private final InferenceOptions options;

    /**
     * Creates a schema inferrer.
     *
     * @param options the inference switches
     */
    public SchemaInferrer(InferenceOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Infers the schema of a list of records.
     *
     * @param records the records, not empty
     * @param columnNames names for positional fields, or null for {@code _1, _2, ...}
     * @return the merged schema, possibly containing NullType fields
     * @throws EmptyInputException if there are no records
     * @throws UnresolvedTypeException if every record is null
     * @throws com.frameforge.exception.TypeMergeException if records disagree on a field's type
     */
    public StructType infer(List<?> records, List<String> columnNames) {
        if (records.isEmpty()) {
            throw new EmptyInputException();
        }

        StructType merged = null;
        for (Object record : records) {
            if (record == null) {
                continue;
            }
            StructType recordSchema = inferRecord(record, columnNames);
            merged = merged == null ? recordSchema : TypeMerger.mergeStructs(merged, recordSchema);
        }

        if (merged == null) {
            throw new UnresolvedTypeException(StructType.EMPTY);
        }

        logger.debug("Inferred schema {} from {} records", merged.simpleString(), records.size());
        return merged;
    }

    /**
     * Infers the schema of a single record.
     *
     * @param record the record, not null
     * @param columnNames names for positional fields, or null
     * @return the record's schema
     */
    public StructType inferRecord(Object record, List<String> columnNames) {
        if (RecordAccess.isMapping(record)) {
            return ValueTypeInference.inferStructType(
                RecordAccess.sortedEntries((Map<?, ?>) record), options);
        }
        if (RecordAccess.isNamedObject(record)) {
            return ValueTypeInference.inferStructType(RecordAccess.namedFields(record), options);
        }
        if (RecordAccess.isSequence(record)) {
            List<Object> values = RecordAccess.sequenceValues(record);
            List<String> names = positionalNames(columnNames, values.size());
            List<StructField> structFields = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                structFields.add(new StructField(names.get(i),
                    ValueTypeInference.inferType(values.get(i), options), true));
            }
            return new StructType(structFields);
        }
        String name = columnNames != null && !columnNames.isEmpty() ? columnNames.get(0) : VALUE_FIELD;
        return new StructType(new StructField(name, ValueTypeInference.inferType(record, options), true));
    }

    /**
     * Returns the field names for a positional record of the given width.
     *
     * @param columnNames the caller's names, or null
     * @param width the number of values in the record
     * @return exactly {@code width} names: the caller's names cut to the width, padded
     *         with {@code _k} if there are too few
     */
    public static List<String> positionalNames(List<String> columnNames, int width) {
        List<String> names = new ArrayList<>(width);
        if (columnNames != null) {
            for (int i = 0; i < Math.min(columnNames.size(), width); i++) {
                names.add(columnNames.get(i));
            }
        }
        for (int i = names.size(); i < width; i++) {
            names.add("_" + (i + 1));
        }
        return names;
    }

    /**
     * Checks whether a type still contains NullType anywhere, i.e. some part of it was
     * never observed with a non-null value.
     *
     * @param type the type to check
     * @return true if the type is or contains NullType
     */
    public static boolean hasNullType(DataType type) {
        if (type instanceof NullType) {
            return true;
        }
        if (type instanceof StructType) {
            for (StructField field : ((StructType) type).fields()) {
                if (hasNullType(field.dataType())) {
                    return true;
                }
            }
            return false;
        }
        if (type instanceof ArrayType) {
            return hasNullType(((ArrayType) type).elementType());
        }
        if (type instanceof MapType) {
            MapType map = (MapType) type;
            return hasNullType(map.keyType()) || hasNullType(map.valueType());
        }
        return false;
    }
}
