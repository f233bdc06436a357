package com.frameforge.exception;

import java.util.Map;

/**
 * Thrown when a schema has to be inferred from zero records.
 *
 * <p>Supplying a full schema (a type or a DDL string, not just column names) avoids it.
 */
public class EmptyInputException extends IngestionException {

    public EmptyInputException() {
        super("CANNOT_INFER_EMPTY_SCHEMA", "Can not infer schema from an empty dataset.", Map.of());
    }
}
