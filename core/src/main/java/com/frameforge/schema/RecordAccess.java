package com.frameforge.schema;

import com.frameforge.input.Row;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classifies record-shaped values and reads their fields.
 *
 * <p>A record is one of:
 * <ul>
 *   <li>a mapping: any {@link Map}, keys stringified</li>
 *   <li>a named-field object: a {@link Row} with field names, or a Java {@code record}</li>
 *   <li>an ordered sequence: a {@link List}, an object or primitive array, or a positional {@link Row}</li>
 * </ul>
 * Anything else is a scalar. {@code byte[]} is a scalar (binary value), not a sequence.
 */
public final class RecordAccess {

    private RecordAccess() {}

    public static boolean isMapping(Object value) {
        return value instanceof Map;
    }

    public static boolean isNamedObject(Object value) {
        return (value instanceof Row && ((Row) value).hasFieldNames())
            || (value != null && value.getClass().isRecord());
    }

    public static boolean isSequence(Object value) {
        return value instanceof List
            || (value instanceof Row && !((Row) value).hasFieldNames())
            || (value != null && value.getClass().isArray() && !(value instanceof byte[]));
    }

    public static boolean isRecordShaped(Object value) {
        return isMapping(value) || isNamedObject(value) || isSequence(value);
    }

    /**
     * Returns the entries of a mapping sorted lexicographically by stringified key.
     *
     * @param mapping the map
     * @return a new ordered map
     */
    public static Map<String, Object> sortedEntries(Map<?, ?> mapping) {
        Map<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : mapping.entrySet()) {
            sorted.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return new LinkedHashMap<>(sorted);
    }

    /**
     * Returns the fields of a named-field object in declaration order.
     *
     * @param value a named {@link Row} or a Java record
     * @return field names to values
     */
    public static Map<String, Object> namedFields(Object value) {
        if (value instanceof Row) {
            return ((Row) value).asMap();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (RecordComponent component : value.getClass().getRecordComponents()) {
            fields.put(component.getName(), readComponent(value, component));
        }
        return fields;
    }

    /**
     * Returns the elements of an ordered sequence.
     *
     * @param value a list, array, or positional row
     * @return the elements, boxed
     */
    public static List<Object> sequenceValues(Object value) {
        if (value instanceof Row) {
            return ((Row) value).values();
        }
        if (value instanceof List) {
            return new ArrayList<Object>((List<?>) value);
        }
        if (value instanceof Object[]) {
            return Arrays.asList((Object[]) value);
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(value, i));
        }
        return elements;
    }

    private static Object readComponent(Object record, RecordComponent component) {
        Method accessor = component.getAccessor();
        try {
            accessor.setAccessible(true);
            return accessor.invoke(record);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalArgumentException("Failed to read component '" + component.getName()
                + "' of " + record.getClass().getName(), e);
        }
    }
}
