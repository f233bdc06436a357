package com.frameforge.exception;

import com.frameforge.types.StructType;

import java.util.Map;

/**
 * Thrown when schema inference leaves a field without a type because no record
 * carries a non-null value for it, e.g. {@code [("Alice", null, 80.1)]}.
 *
 * <p>The pipeline does not guess in this case; the caller has to supply a schema.
 */
public class UnresolvedTypeException extends IngestionException {

    private final StructType inferredSchema;

    public UnresolvedTypeException(StructType inferredSchema) {
        super("CANNOT_DETERMINE_TYPE",
            "Some of types cannot be determined after inferring, "
                + "a StructType Schema is required in this case.",
            Map.of("inferred_schema", inferredSchema.simpleString()));
        this.inferredSchema = inferredSchema;
    }

    /**
     * Returns the schema as far as inference got, with NullType where no type was found.
     *
     * @return the partially inferred schema
     */
    public StructType getInferredSchema() {
        return inferredSchema;
    }
}
