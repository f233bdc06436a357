package com.frameforge.exception;

import java.util.Map;

/**
 * Thrown when an array input is neither one- nor two-dimensional.
 */
public class InvalidRankException extends IngestionException {

    private final int rank;

    public InvalidRankException(int rank) {
        super("INVALID_NDARRAY_DIMENSION",
            "NumPy-style array input should be of 1 or 2 dimensions, got " + rank + ".",
            Map.of("dimensions", "1 or 2", "actual", String.valueOf(rank)));
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }
}
