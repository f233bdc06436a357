package com.frameforge.exception;

import com.frameforge.types.DataType;

import java.util.Map;

/**
 * Thrown when a type has no columnar (Arrow) encoding, or cannot be used where a
 * columnar table schema is required.
 */
public class UnsupportedTypeForEncodingException extends IngestionException {

    private final DataType dataType;

    public UnsupportedTypeForEncodingException(DataType dataType) {
        super("UNSUPPORTED_DATA_TYPE_FOR_ARROW",
            "Single data type " + dataType.simpleString() + " is not supported with Arrow.",
            Map.of("data_type", dataType.simpleString()));
        this.dataType = dataType;
    }

    public DataType getDataType() {
        return dataType;
    }
}
