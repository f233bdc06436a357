package com.frameforge.schema;

import com.frameforge.config.ConfigDefaults;
import com.frameforge.config.ConfigProvider;

import java.util.List;

/**
 * Switches that change how types are inferred from values.
 *
 * @param inferDictAsStruct infer nested maps as structs (one field per key) instead of map types
 * @param inferArrayFromFirstElement take an array's element type from its first element
 *                                   instead of merging the types of all elements
 * @param preferTimestampNtz infer local date-times as timestamp_ntz instead of timestamp
 */
public record InferenceOptions(boolean inferDictAsStruct,
                               boolean inferArrayFromFirstElement,
                               boolean preferTimestampNtz) {

    /** Spark's defaults: maps as map types, merged array elements, session-zone timestamps. */
    public static final InferenceOptions DEFAULTS = new InferenceOptions(false, false, false);

    /**
     * Reads the options from configuration.
     *
     * @param config the configuration
     * @return the options
     */
    public static InferenceOptions fromConfig(ConfigProvider config) {
        List<String> values = config.getConfigs(
            ConfigDefaults.INFER_DICT_AS_STRUCT,
            ConfigDefaults.INFER_ARRAY_FROM_FIRST_ELEMENT,
            ConfigDefaults.TIMESTAMP_TYPE);
        return fromValues(values.get(0), values.get(1), values.get(2));
    }

    /**
     * Builds the options from raw configuration values.
     *
     * @param inferDictAsStruct value of {@link ConfigDefaults#INFER_DICT_AS_STRUCT}
     * @param inferArrayFromFirstElement value of {@link ConfigDefaults#INFER_ARRAY_FROM_FIRST_ELEMENT}
     * @param timestampType value of {@link ConfigDefaults#TIMESTAMP_TYPE}
     * @return the options; unset values read as the defaults
     */
    public static InferenceOptions fromValues(String inferDictAsStruct, String inferArrayFromFirstElement,
                                              String timestampType) {
        return new InferenceOptions(
            "true".equals(inferDictAsStruct),
            "true".equals(inferArrayFromFirstElement),
            ConfigDefaults.TIMESTAMP_NTZ.equals(timestampType));
    }
}
