package com.frameforge.exception;

import java.util.Map;

/**
 * Thrown when the number of columns the caller declared (through a schema or a list
 * of names) differs from the number of columns the data actually has.
 */
public class AxisLengthMismatchException extends IngestionException {

    private final int expected;
    private final int actual;

    /**
     * Creates the exception.
     *
     * @param expected the declared column count
     * @param actual the column count found in the data
     */
    public AxisLengthMismatchException(int expected, int actual) {
        super("AXIS_LENGTH_MISMATCH",
            "Length mismatch: Expected axis has " + expected + " element(s), new values have "
                + actual + " element(s).",
            Map.of("expected_length", String.valueOf(expected),
                   "actual_length", String.valueOf(actual)));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
