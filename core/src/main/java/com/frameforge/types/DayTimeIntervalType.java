package com.frameforge.types;

/**
 * Data type representing a day-time interval with microsecond precision.
 * Encoded as Arrow {@code Duration(MICROSECOND)}.
 */
public final class DayTimeIntervalType implements DataType {

    private static final DayTimeIntervalType INSTANCE = new DayTimeIntervalType();

    private DayTimeIntervalType() {}

    public static DayTimeIntervalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "interval day to second";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DayTimeIntervalType;
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
