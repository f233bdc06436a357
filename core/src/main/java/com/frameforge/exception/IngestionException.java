package com.frameforge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for all failures of the local data ingestion pipeline.
 *
 * <p>Every failure is fatal for the call that raised it: nothing is retried and no
 * partial result is returned. Each subclass carries a stable error class (the same
 * identifiers Spark uses, e.g. {@code AXIS_LENGTH_MISMATCH}) and the parameters that
 * were substituted into its message, so callers can react without parsing text.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       LocalRelation relation = ingestor.createDataFrame(rows);
 *   } catch (IngestionException e) {
 *       log.warn("{}: {}", e.getErrorClass(), e.getMessageParameters());
 *   }
 * </pre>
 */
public abstract class IngestionException extends RuntimeException {

    private final String errorClass;
    private final Map<String, String> messageParameters;

    protected IngestionException(String errorClass, String message,
                                 Map<String, String> messageParameters) {
        this(errorClass, message, messageParameters, null);
    }

    protected IngestionException(String errorClass, String message,
                                 Map<String, String> messageParameters, Throwable cause) {
        super("[" + errorClass + "] " + message, cause);
        this.errorClass = errorClass;
        this.messageParameters = Collections.unmodifiableMap(new LinkedHashMap<>(messageParameters));
    }

    /**
     * Returns the error class identifier.
     *
     * @return the error class, e.g. {@code CANNOT_INFER_EMPTY_SCHEMA}
     */
    public String getErrorClass() {
        return errorClass;
    }

    /**
     * Returns the named parameters of the message.
     *
     * @return an unmodifiable map of parameter names to values
     */
    public Map<String, String> getMessageParameters() {
        return messageParameters;
    }
}
