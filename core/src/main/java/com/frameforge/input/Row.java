package com.frameforge.input;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A record of values, either positional or with field names.
 *
 * <p>A named row is a named-field object: its field names become column names, in the
 * order given. A positional row behaves like a tuple.
 */
public final class Row {

    private final List<String> fieldNames;
    private final List<Object> values;

    private Row(List<String> fieldNames, List<Object> values) {
        this.fieldNames = fieldNames;
        this.values = values;
    }

    /**
     * Creates a positional row.
     *
     * @param values the values, nulls allowed
     * @return the row
     */
    public static Row of(Object... values) {
        return new Row(null, Collections.unmodifiableList(new ArrayList<>(Arrays.asList(values))));
    }

    /**
     * Creates a row with named fields.
     *
     * @param fieldNames the field names
     * @param values the values, one per name
     * @return the row
     * @throws IllegalArgumentException if the counts differ
     */
    public static Row named(List<String> fieldNames, List<?> values) {
        Objects.requireNonNull(fieldNames, "fieldNames must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (fieldNames.size() != values.size()) {
            throw new IllegalArgumentException("Row has " + fieldNames.size() + " field names but "
                + values.size() + " values");
        }
        return new Row(List.copyOf(fieldNames),
            Collections.unmodifiableList(new ArrayList<Object>(values)));
    }

    /**
     * Creates a named row from a map, keeping the map's iteration order.
     *
     * @param fields field names to values
     * @return the row
     */
    public static Row fromMap(Map<String, ?> fields) {
        return named(new ArrayList<>(fields.keySet()), new ArrayList<>(fields.values()));
    }

    public boolean hasFieldNames() {
        return fieldNames != null;
    }

    /**
     * Returns the field names.
     *
     * @return the names, or an empty list for a positional row
     */
    public List<String> fieldNames() {
        return fieldNames == null ? List.of() : fieldNames;
    }

    public List<Object> values() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Returns the fields as an ordered map.
     *
     * @return field names to values
     * @throws IllegalStateException for a positional row
     */
    public Map<String, Object> asMap() {
        if (fieldNames == null) {
            throw new IllegalStateException("Positional row has no field names");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            map.put(fieldNames.get(i), values.get(i));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row that = (Row) o;
        return Objects.equals(fieldNames, that.fieldNames) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldNames, values);
    }

    @Override
    public String toString() {
        return hasFieldNames() ? "Row" + asMap() : "Row" + values;
    }
}
