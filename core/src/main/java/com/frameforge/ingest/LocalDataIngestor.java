package com.frameforge.ingest;

import com.frameforge.config.ConfigProvider;
import com.frameforge.exception.EmptyInputException;
import com.frameforge.exception.InvalidInputTypeException;
import com.frameforge.exception.InvalidRankException;
import com.frameforge.input.InputShape;
import com.frameforge.input.LocalFrame;
import com.frameforge.input.NdArray;
import com.frameforge.logical.LocalRelation;
import com.frameforge.runtime.ColumnarTable;
import com.frameforge.schema.SchemaInferrer;
import com.frameforge.types.DataType;
import com.frameforge.types.DdlParser;
import com.frameforge.types.SchemaParser;
import com.frameforge.types.StructField;
import com.frameforge.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of local data ingestion: turns in-memory data into a {@link LocalRelation}.
 *
 * <p>Accepted inputs are a {@link LocalFrame}, an {@link NdArray} (or a Java primitive
 * array such as {@code double[]} or {@code double[][]}), and any {@link Iterable} or object array of records. The optional
 * schema argument is a {@link DataType}, a DDL string, or a list of column names.
 *
 * <p>Each call runs these steps:
 * <ol>
 *   <li>reject a null input and an already produced table</li>
 *   <li>resolve a DDL schema through the {@link DdlParser}</li>
 *   <li>reject arrays of rank other than 1 or 2</li>
 *   <li>answer empty input with an empty table of the given schema, or fail if there is none</li>
 *   <li>build the table with the adapter for the input's shape</li>
 *   <li>reconcile table and schema</li>
 * </ol>
 *
 * <p>Configuration is read at the start of every call. The ingestor holds no other state
 * and can be shared between threads; the returned relation belongs to the caller.
 *
 * <p>Example usage:
 * <pre>
 *   LocalDataIngestor ingestor = new LocalDataIngestor(allocator, new SessionConfig());
 *   try (LocalRelation relation = ingestor.createDataFrame(List.of(1, 2, 3))) {
 *       relation.schema();   // struct&lt;value:int&gt;
 *   }
 * </pre>
 */
public class LocalDataIngestor {

    private static final Logger logger = LoggerFactory.getLogger(LocalDataIngestor.class);

    private final BufferAllocator allocator;
    private final ConfigProvider config;
    private final DdlParser ddlParser;
    private final SchemaReconciler reconciler = new SchemaReconciler();

    /**
     * Creates an ingestor.
     *
     * @param allocator the allocator that will own every produced table
     * @param config the session configuration
     * @param ddlParser the parser for schema strings
     */
    public LocalDataIngestor(BufferAllocator allocator, ConfigProvider config, DdlParser ddlParser) {
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.ddlParser = Objects.requireNonNull(ddlParser, "ddlParser must not be null");
    }

    /**
     * Creates an ingestor that parses schema strings with {@link SchemaParser}.
     *
     * @param allocator the allocator that will own every produced table
     * @param config the session configuration
     */
    public LocalDataIngestor(BufferAllocator allocator, ConfigProvider config) {
        this(allocator, config, new SchemaParser());
    }

    public LocalRelation createDataFrame(Object data) {
        return createDataFrame(data, SchemaSpec.none());
    }

    public LocalRelation createDataFrame(Object data, DataType schema) {
        return createDataFrame(data, SchemaSpec.ofType(schema));
    }

    public LocalRelation createDataFrame(Object data, String ddl) {
        return createDataFrame(data, SchemaSpec.ofDdl(ddl));
    }

    public LocalRelation createDataFrame(Object data, List<String> columnNames) {
        return createDataFrame(data, SchemaSpec.ofNames(columnNames));
    }

    /**
     * Ingests local data.
     *
     * @param data the input, not null
     * @param spec the schema argument
     * @return the table and its schema; the caller must close it
     * @throws NullPointerException if {@code data} is null
     * @throws com.frameforge.exception.IngestionException if the input cannot be ingested
     */
    public LocalRelation createDataFrame(Object data, SchemaSpec spec) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(spec, "spec must not be null");
        if (data instanceof LocalRelation || data instanceof ColumnarTable) {
            throw new InvalidInputTypeException("data", data.getClass().getSimpleName());
        }

        DataType schema = null;
        List<String> columnNames = null;
        switch (spec.kind()) {
            case TYPE:
                schema = spec.dataType();
                break;
            case DDL:
                schema = ddlParser.parseDdl(spec.ddl());
                break;
            case NAMES:
                columnNames = spec.names();
                break;
            default:
                break;
        }

        NdArray array = asNdArray(data);
        if (array != null && array.rank() != 1 && array.rank() != 2) {
            throw new InvalidRankException(array.rank());
        }

        InputShape shape = InputShape.of(data);
        if (isEmpty(data, array)) {
            if (schema == null) {
                throw new EmptyInputException();
            }
            StructType struct = asStruct(schema);
            logger.debug("Empty {} input, returning empty table with schema {}", shape, struct.simpleString());
            return new LocalRelation(ColumnarTable.empty(struct, allocator), struct);
        }

        IngestionOptions options = IngestionOptions.fromConfig(config);
        AdapterResult result;
        switch (shape) {
            case FRAME:
                result = new FrameAdapter(options).adapt((LocalFrame) data, schema, columnNames, allocator);
                break;
            case ARRAY:
                result = new NdArrayAdapter(options).adapt(array, schema, columnNames, allocator);
                break;
            default:
                result = new RecordSequenceAdapter(options).adapt(data, schema, columnNames, allocator);
                break;
        }

        LocalRelation relation = reconciler.reconcile(result);
        logger.debug("Created local relation from {} input: {} rows, schema {}",
            shape, relation.rowCount(), relation.schema().simpleString());
        return relation;
    }

    /**
     * Views array input as an {@link NdArray}: one-dimensional primitive arrays are wrapped,
     * two-dimensional ones ({@code double[][]}) are copied row by row.
     *
     * @return the array, or null if the input is not an array
     * @throws InvalidRankException for primitive arrays of three or more dimensions
     */
    private static NdArray asNdArray(Object data) {
        if (data instanceof NdArray) {
            return (NdArray) data;
        }
        int rank = NdArray.arrayRank(data);
        switch (rank) {
            case 0:
                return null;
            case 1:
                return NdArray.of(data);
            case 2:
                return NdArray.ofRows((Object[]) data);
            default:
                throw new InvalidRankException(rank);
        }
    }

    private static boolean isEmpty(Object data, NdArray array) {
        if (array != null) {
            return array.length() == 0;
        }
        if (data instanceof LocalFrame) {
            return ((LocalFrame) data).isEmpty();
        }
        if (data instanceof Collection) {
            return ((Collection<?>) data).isEmpty();
        }
        if (data instanceof Object[]) {
            return ((Object[]) data).length == 0;
        }
        return false;
    }

    private static StructType asStruct(DataType schema) {
        if (schema instanceof StructType) {
            return (StructType) schema;
        }
        return new StructType(new StructField(SchemaInferrer.VALUE_FIELD, schema, true));
    }
}
