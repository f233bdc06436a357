package com.frameforge.exception;

import java.util.Map;

/**
 * Thrown when an argument is of a kind the pipeline cannot ingest: the data itself is
 * not a frame, an array or an iterable of records, it is an already produced table,
 * or a value inside a record has a class no type can be inferred for.
 */
public class InvalidInputTypeException extends IngestionException {

    public InvalidInputTypeException(String argName, String dataType) {
        super("INVALID_TYPE",
            "Argument `" + argName + "` should not be a " + dataType + ".",
            Map.of("arg_name", argName, "data_type", dataType));
    }
}
