package com.frameforge.exception;

import com.frameforge.types.DataType;

import java.util.Map;

/**
 * Thrown when a single value cannot be stored in a column of the resolved type:
 * the value's class does not fit the type, a safe cast would lose information,
 * or a null is written to a non-nullable field.
 */
public class ValueConversionException extends IngestionException {

    public ValueConversionException(String field, DataType target, Object value, String reason) {
        this(field, target, value, reason, null);
    }

    public ValueConversionException(String field, DataType target, Object value, String reason,
                                    Throwable cause) {
        super("CANNOT_CONVERT_VALUE",
            "Cannot convert " + describe(value) + " in field `" + field + "` to "
                + target.simpleString() + ": " + reason,
            Map.of("field", field, "data_type", target.simpleString(), "reason", reason),
            cause);
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + " value " + value;
    }
}
