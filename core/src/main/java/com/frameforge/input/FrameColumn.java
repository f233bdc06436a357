package com.frameforge.input;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One labelled column of a {@link LocalFrame}.
 *
 * @param label the column label; any object, stringified when used as a column name
 * @param storage the native storage kind of the values
 * @param values the values, nulls allowed
 */
public record FrameColumn(Object label, ColumnStorage storage, List<Object> values) {

    public FrameColumn {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(storage, "storage must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static FrameColumn of(Object label, ColumnStorage storage, Object... values) {
        return new FrameColumn(label, storage, Arrays.asList(values));
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns the label as a column name.
     *
     * @return the stringified label
     */
    public String name() {
        return String.valueOf(label);
    }
}
