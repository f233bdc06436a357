package com.frameforge.input;

import com.frameforge.exception.InvalidInputTypeException;

/**
 * The three shapes of local data the pipeline can ingest, determined from the runtime
 * class of the input.
 */
public enum InputShape {
    /** A {@link LocalFrame}. */
    FRAME,
    /** An {@link NdArray} or a Java primitive array of any rank. */
    ARRAY,
    /** Any other {@link Iterable} or object array of records. */
    SEQUENCE;

    /**
     * Classifies an input.
     *
     * @param data the input, not null
     * @return its shape
     * @throws InvalidInputTypeException if the input has none of the supported shapes
     */
    public static InputShape of(Object data) {
        if (data instanceof LocalFrame) {
            return FRAME;
        }
        if (data instanceof NdArray || NdArray.arrayRank(data) > 0) {
            return ARRAY;
        }
        if (data instanceof Iterable || data instanceof Object[]) {
            return SEQUENCE;
        }
        throw new InvalidInputTypeException("data", data.getClass().getSimpleName());
    }
}
