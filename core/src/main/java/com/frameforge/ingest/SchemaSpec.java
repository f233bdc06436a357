package com.frameforge.ingest;

import com.frameforge.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * The schema argument of a {@code createDataFrame} call: nothing, a data type, a DDL
 * string, or a list of column names.
 */
public final class SchemaSpec {

    /**
     * The form of the schema argument.
     */
    public enum Kind {
        NONE,
        TYPE,
        DDL,
        NAMES
    }

    private static final SchemaSpec NONE = new SchemaSpec(Kind.NONE, null, null, null);

    private final Kind kind;
    private final DataType dataType;
    private final String ddl;
    private final List<String> names;

    private SchemaSpec(Kind kind, DataType dataType, String ddl, List<String> names) {
        this.kind = kind;
        this.dataType = dataType;
        this.ddl = ddl;
        this.names = names;
    }

    public static SchemaSpec none() {
        return NONE;
    }

    /**
     * A struct schema, or an atomic type describing a single {@code value} column.
     *
     * @param dataType the type
     * @return the schema argument
     */
    public static SchemaSpec ofType(DataType dataType) {
        return new SchemaSpec(Kind.TYPE, Objects.requireNonNull(dataType, "dataType must not be null"),
            null, null);
    }

    /**
     * A DDL or JSON schema string, resolved by a {@link com.frameforge.types.DdlParser}.
     *
     * @param ddl the schema string
     * @return the schema argument
     */
    public static SchemaSpec ofDdl(String ddl) {
        return new SchemaSpec(Kind.DDL, null, Objects.requireNonNull(ddl, "ddl must not be null"), null);
    }

    /**
     * Column names only; types are inferred.
     *
     * @param names the column names
     * @return the schema argument
     */
    public static SchemaSpec ofNames(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        return new SchemaSpec(Kind.NAMES, null, null, List.copyOf(names));
    }

    public Kind kind() {
        return kind;
    }

    public DataType dataType() {
        return dataType;
    }

    public String ddl() {
        return ddl;
    }

    public List<String> names() {
        return names;
    }

    @Override
    public String toString() {
        switch (kind) {
            case TYPE:
                return "SchemaSpec(" + dataType.simpleString() + ")";
            case DDL:
                return "SchemaSpec(ddl=" + ddl + ")";
            case NAMES:
                return "SchemaSpec(names=" + names + ")";
            default:
                return "SchemaSpec(none)";
        }
    }
}
