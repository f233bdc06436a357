package com.frameforge.types;

/**
 * Data type representing a 16-bit signed integer.
 * Encoded as Arrow {@code Int(16, signed)}.
 */
public final class ShortType implements DataType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {}

    public static ShortType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "short";
    }

    @Override
    public String simpleString() {
        return "smallint";
    }

    @Override
    public int defaultSize() {
        return 2;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ShortType;
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
