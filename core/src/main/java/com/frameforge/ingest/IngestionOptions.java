package com.frameforge.ingest;

import com.frameforge.config.ConfigDefaults;
import com.frameforge.config.ConfigProvider;
import com.frameforge.schema.InferenceOptions;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Settings of one ingestion call, read from configuration when the call starts.
 *
 * @param inference switches for schema inference
 * @param timeZone the session time zone, used to localize naive date-times
 * @param safeArrayCast whether lossy conversions of frame and array columns are refused
 */
public record IngestionOptions(InferenceOptions inference, ZoneId timeZone, boolean safeArrayCast) {

    public IngestionOptions {
        Objects.requireNonNull(inference, "inference must not be null");
        Objects.requireNonNull(timeZone, "timeZone must not be null");
    }

    /**
     * Reads the options from configuration in one lookup.
     *
     * @param config the configuration
     * @return the options; an unset time zone falls back to the JVM default
     */
    public static IngestionOptions fromConfig(ConfigProvider config) {
        List<String> values = config.getConfigs(
            ConfigDefaults.INFER_DICT_AS_STRUCT,
            ConfigDefaults.INFER_ARRAY_FROM_FIRST_ELEMENT,
            ConfigDefaults.TIMESTAMP_TYPE,
            ConfigDefaults.SESSION_TIME_ZONE,
            ConfigDefaults.SAFE_ARRAY_CAST);

        InferenceOptions inference = InferenceOptions.fromValues(values.get(0), values.get(1), values.get(2));
        return new IngestionOptions(inference, parseTimeZone(values.get(3)), "true".equals(values.get(4)));
    }

    private static ZoneId parseTimeZone(String zone) {
        if (zone == null || zone.isEmpty()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid value '" + zone + "' for "
                + ConfigDefaults.SESSION_TIME_ZONE + ": " + e.getMessage(), e);
        }
    }
}
