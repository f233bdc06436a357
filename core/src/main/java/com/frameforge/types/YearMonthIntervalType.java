package com.frameforge.types;

/**
 * Data type representing a year-month interval.
 *
 * <p>Accepted in declared schemas only. It has no columnar encoding, so ingesting
 * data against it fails.
 */
public final class YearMonthIntervalType implements DataType {

    private static final YearMonthIntervalType INSTANCE = new YearMonthIntervalType();

    private YearMonthIntervalType() {}

    public static YearMonthIntervalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "interval year to month";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof YearMonthIntervalType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
