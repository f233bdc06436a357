package com.frameforge.types;

/**
 * Data type representing a local date-time without a time zone.
 *
 * <p>Stored as microseconds since 1970-01-01T00:00:00 in wall-clock terms. Encoded as
 * Arrow {@code Timestamp(MICROSECOND, null)}.
 */
public final class TimestampNTZType implements DataType {

    private static final TimestampNTZType INSTANCE = new TimestampNTZType();

    private TimestampNTZType() {}

    public static TimestampNTZType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp_ntz";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampNTZType;
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
