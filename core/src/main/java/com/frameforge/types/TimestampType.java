package com.frameforge.types;

/**
 * Data type representing an instant in time with microsecond precision.
 *
 * <p>Values are interpreted relative to the session time zone and stored as
 * microseconds since Unix epoch (1970-01-01 00:00:00 UTC). Encoded as Arrow
 * {@code Timestamp(MICROSECOND, "UTC")}.
 *
 * @see TimestampNTZType
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public int defaultSize() {
        return 8; // Stored as 64-bit integer (microseconds since epoch)
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
