package com.frameforge.exception;

import com.frameforge.types.DataType;

import java.util.Map;

/**
 * Thrown when two types observed for the same field cannot be merged into one.
 */
public class TypeMergeException extends IngestionException {

    private final DataType left;
    private final DataType right;

    public TypeMergeException(DataType left, DataType right) {
        super("CANNOT_MERGE_TYPE",
            "Can not merge type " + left.simpleString() + " and " + right.simpleString() + ".",
            Map.of("data_type1", left.simpleString(), "data_type2", right.simpleString()));
        this.left = left;
        this.right = right;
    }

    public DataType getLeft() {
        return left;
    }

    public DataType getRight() {
        return right;
    }
}
