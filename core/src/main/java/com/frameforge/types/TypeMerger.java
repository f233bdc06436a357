package com.frameforge.types;

import com.frameforge.exception.TypeMergeException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges two observed types for the same logical field into one type compatible with both.
 *
 * <h2>Merge Rules</h2>
 * <ul>
 *   <li>Equal types: unchanged</li>
 *   <li>NullType with anything: the other type</li>
 *   <li>Numeric with numeric: promoted (Byte &lt; Short &lt; Integer &lt; Long &lt; Float &lt; Double,
 *       Decimal unified with integral types)</li>
 *   <li>Array with Array, Map with Map: element/key/value types merged recursively</li>
 *   <li>Struct with Struct: merged field by field (see {@link #mergeStructs})</li>
 *   <li>Anything else: {@link TypeMergeException}</li>
 * </ul>
 *
 * <p>The merge is commutative for everything except struct field order, which follows
 * the left operand.
 */
public final class TypeMerger {

    private TypeMerger() {
        // Utility class - prevent instantiation
    }

    /**
     * Merges two types.
     *
     * @param left the type observed first
     * @param right the type observed next
     * @return the merged type
     * @throws TypeMergeException if the types are incompatible
     */
    public static DataType merge(DataType left, DataType right) {
        if (left.equals(right)) {
            return left;
        }
        if (left instanceof NullType) {
            return right;
        }
        if (right instanceof NullType) {
            return left;
        }

        if (isNumericType(left) && isNumericType(right)) {
            return promoteNumericTypes(left, right);
        }

        if (left instanceof ArrayType && right instanceof ArrayType) {
            ArrayType l = (ArrayType) left;
            ArrayType r = (ArrayType) right;
            return new ArrayType(
                merge(l.elementType(), r.elementType()),
                l.containsNull() || r.containsNull());
        }

        if (left instanceof MapType && right instanceof MapType) {
            MapType l = (MapType) left;
            MapType r = (MapType) right;
            return new MapType(
                merge(l.keyType(), r.keyType()),
                merge(l.valueType(), r.valueType()),
                l.valueContainsNull() || r.valueContainsNull());
        }

        if (left instanceof StructType && right instanceof StructType) {
            return mergeStructs((StructType) left, (StructType) right);
        }

        throw new TypeMergeException(left, right);
    }

    /**
     * Merges two structs by field name.
     *
     * <p>Fields present on both sides are merged recursively and are nullable if either
     * side is nullable or carried only nulls. Fields present on one side only become
     * nullable. The result keeps the left field order and appends new right fields in
     * the order they appear.
     *
     * @param left the left struct
     * @param right the right struct
     * @return the merged struct
     */
    public static StructType mergeStructs(StructType left, StructType right) {
        // Same names in the same order (duplicates included) merge by position
        if (left.fieldNames().equals(right.fieldNames())) {
            List<StructField> merged = new ArrayList<>(left.size());
            for (int i = 0; i < left.size(); i++) {
                merged.add(mergeFields(left.fieldAt(i), right.fieldAt(i)));
            }
            return new StructType(merged);
        }

        Map<String, StructField> rightByName = new LinkedHashMap<>();
        for (StructField field : right.fields()) {
            rightByName.putIfAbsent(field.name(), field);
        }

        List<StructField> merged = new ArrayList<>();
        for (StructField l : left.fields()) {
            StructField r = rightByName.remove(l.name());
            if (r == null) {
                merged.add(l.withNullable(true));
            } else {
                merged.add(mergeFields(l, r));
            }
        }
        for (StructField r : rightByName.values()) {
            merged.add(r.withNullable(true));
        }
        return new StructType(merged);
    }

    private static StructField mergeFields(StructField l, StructField r) {
        boolean nullable = l.nullable() || r.nullable()
            || l.dataType() instanceof NullType || r.dataType() instanceof NullType;
        return new StructField(l.name(), merge(l.dataType(), r.dataType()), nullable);
    }

    /**
     * Promotes numeric types according to Spark's type coercion rules.
     *
     * <p>Promotion order: Byte &lt; Short &lt; Integer &lt; Long &lt; Float &lt; Double.
     * Decimal types are handled separately (widest precision wins).
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        // If either is Double, result is Double
        if (left instanceof DoubleType || right instanceof DoubleType) {
            return DoubleType.get();
        }

        // If either is Float, result is Float
        if (left instanceof FloatType || right instanceof FloatType) {
            return FloatType.get();
        }

        // If either is Decimal, result is Decimal with appropriate precision
        if (left instanceof DecimalType || right instanceof DecimalType) {
            DecimalType leftDec = toDecimalForUnification(left);
            DecimalType rightDec = toDecimalForUnification(right);
            return unifyDecimalTypes(leftDec, rightDec);
        }

        if (left instanceof LongType || right instanceof LongType) {
            return LongType.get();
        }

        if (left instanceof IntegerType || right instanceof IntegerType) {
            return IntegerType.get();
        }

        if (left instanceof ShortType || right instanceof ShortType) {
            return ShortType.get();
        }

        return ByteType.get();
    }

    /**
     * Checks if a type is numeric.
     *
     * @param type the type to check
     * @return true for integral, floating point and decimal types
     */
    public static boolean isNumericType(DataType type) {
        return isIntegralType(type) ||
               type instanceof FloatType ||
               type instanceof DoubleType ||
               type instanceof DecimalType;
    }

    /**
     * Checks if a type is an integral type.
     *
     * @param type the type to check
     * @return true for Byte, Short, Integer and Long
     */
    public static boolean isIntegralType(DataType type) {
        return type instanceof ByteType ||
               type instanceof ShortType ||
               type instanceof IntegerType ||
               type instanceof LongType;
    }

    /**
     * Converts a type to DecimalType for unification.
     *
     * <p>Spark promotes integral types to Decimal with fixed precision:
     * <ul>
     *   <li>ByteType → Decimal(3,0)</li>
     *   <li>ShortType → Decimal(5,0)</li>
     *   <li>IntegerType → Decimal(10,0)</li>
     *   <li>LongType → Decimal(20,0)</li>
     * </ul>
     */
    private static DecimalType toDecimalForUnification(DataType type) {
        if (type instanceof DecimalType) {
            return (DecimalType) type;
        }
        if (type instanceof ByteType) {
            return new DecimalType(3, 0);
        }
        if (type instanceof ShortType) {
            return new DecimalType(5, 0);
        }
        if (type instanceof IntegerType) {
            return new DecimalType(10, 0);
        }
        return new DecimalType(20, 0);
    }

    /**
     * Unifies two DecimalTypes.
     *
     * <p>Formula:
     * <ul>
     *   <li>resultScale = max(s1, s2)</li>
     *   <li>resultIntDigits = max(p1-s1, p2-s2)</li>
     *   <li>resultPrecision = min(resultIntDigits + resultScale, 38)</li>
     * </ul>
     */
    static DecimalType unifyDecimalTypes(DecimalType left, DecimalType right) {
        int s1 = left.scale();
        int s2 = right.scale();
        int intDigits1 = left.precision() - s1;
        int intDigits2 = right.precision() - s2;

        int resultScale = Math.max(s1, s2);
        int resultIntDigits = Math.max(intDigits1, intDigits2);
        int resultPrecision = Math.min(resultIntDigits + resultScale, DecimalType.MAX_PRECISION);

        return new DecimalType(resultPrecision, resultScale);
    }
}
