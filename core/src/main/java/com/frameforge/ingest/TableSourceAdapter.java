package com.frameforge.ingest;

import com.frameforge.types.DataType;
import org.apache.arrow.memory.BufferAllocator;

import java.util.List;

/**
 * Turns one shape of local data into a columnar table.
 *
 * <p>At most one of {@code schema} and {@code columnNames} is given. Implementations
 * validate the input against the schema, build the table and report the naming and
 * column-count expectations the reconciler still has to enforce.
 *
 * @param <T> the input shape
 */
public interface TableSourceAdapter<T> {

    /**
     * Builds the table.
     *
     * @param data the input, not empty
     * @param schema the caller's schema, or null
     * @param columnNames the caller's column names, or null
     * @param allocator the allocator that will own the table
     * @return the table with its pending schema and naming
     */
    AdapterResult adapt(T data, DataType schema, List<String> columnNames, BufferAllocator allocator);
}
