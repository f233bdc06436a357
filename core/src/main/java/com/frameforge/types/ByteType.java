package com.frameforge.types;

/**
 * Data type representing an 8-bit signed integer.
 * Encoded as Arrow {@code Int(8, signed)}.
 */
public final class ByteType implements DataType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {}

    public static ByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "byte";
    }

    @Override
    public String simpleString() {
        return "tinyint";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ByteType;
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
