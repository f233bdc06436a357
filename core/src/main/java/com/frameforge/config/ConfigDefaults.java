package com.frameforge.config;

import java.util.HashMap;
import java.util.Map;
import java.util.TimeZone;

/**
 * Configuration keys read by the ingestion pipeline and their default values.
 *
 * These defaults match Apache Spark 3.5+ behavior.
 */
public final class ConfigDefaults {

    /** Infer nested maps as structs instead of map types. */
    public static final String INFER_DICT_AS_STRUCT =
        "spark.sql.pyspark.inferNestedDictAsStruct.enabled";

    /** Type an array from its first element instead of merging all elements. */
    public static final String INFER_ARRAY_FROM_FIRST_ELEMENT =
        "spark.sql.pyspark.legacy.inferArrayTypeFromFirstElement.enabled";

    /** {@code TIMESTAMP_NTZ} makes local date-times infer as timestamp_ntz. */
    public static final String TIMESTAMP_TYPE = "spark.sql.timestampType";

    /** Time zone used to localize naive date-times of frame columns. */
    public static final String SESSION_TIME_ZONE = "spark.sql.session.timeZone";

    /** Refuse lossy casts while converting frame columns. */
    public static final String SAFE_ARRAY_CAST =
        "spark.sql.execution.pandas.convertToArrowArraySafely";

    public static final String TIMESTAMP_NTZ = "TIMESTAMP_NTZ";

    /**
     * Get standard configuration defaults.
     *
     * @return Map of default configuration key-value pairs
     */
    public static Map<String, String> getDefaults() {
        Map<String, String> defaults = new HashMap<>();

        // Session configuration
        defaults.put(SESSION_TIME_ZONE, TimeZone.getDefault().getID());

        // Timestamp configuration
        defaults.put(TIMESTAMP_TYPE, "TIMESTAMP_LTZ");

        // Pandas configuration
        defaults.put(SAFE_ARRAY_CAST, "false");

        // Pyspark nested types inference
        defaults.put(INFER_DICT_AS_STRUCT, "false");
        defaults.put(INFER_ARRAY_FROM_FIRST_ELEMENT, "false");

        return defaults;
    }

    private ConfigDefaults() {
        // Utility class - prevent instantiation
    }
}
