package com.frameforge.types;

/**
 * Data type of a value that is always null.
 *
 * <p>Inferred for {@code null} observations. A field that is still NullType after
 * schema inference has no usable type; see {@code SchemaInferrer#hasNullType}.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "void";
    }

    @Override
    public String simpleString() {
        return "null";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NullType;
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
