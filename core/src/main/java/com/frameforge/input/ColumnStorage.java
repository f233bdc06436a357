package com.frameforge.input;

import com.frameforge.types.BooleanType;
import com.frameforge.types.ByteType;
import com.frameforge.types.DataType;
import com.frameforge.types.DayTimeIntervalType;
import com.frameforge.types.DoubleType;
import com.frameforge.types.FloatType;
import com.frameforge.types.IntegerType;
import com.frameforge.types.LongType;
import com.frameforge.types.ShortType;
import com.frameforge.types.StringType;
import com.frameforge.types.TimestampType;

/**
 * Native storage kind of a frame column or array, the equivalent of a NumPy dtype.
 *
 * <p>Fixed-width kinds determine their column type directly. {@link #OBJECT} columns hold
 * arbitrary values whose type has to be inferred from the values themselves.
 */
public enum ColumnStorage {
    BOOL(BooleanType.get()),
    INT8(ByteType.get()),
    INT16(ShortType.get()),
    INT32(IntegerType.get()),
    INT64(LongType.get()),
    FLOAT32(FloatType.get()),
    FLOAT64(DoubleType.get()),
    STRING(StringType.get()),
    OBJECT(null),
    /** Naive date-times ({@code LocalDateTime}), localized in the session time zone. */
    DATETIME(TimestampType.get()),
    /** Zone-aware date-times ({@code Instant}, {@code OffsetDateTime}, {@code ZonedDateTime}). */
    DATETIME_TZ(TimestampType.get()),
    /** Durations ({@code java.time.Duration}). */
    TIMEDELTA(DayTimeIntervalType.get());

    private final DataType nativeType;

    ColumnStorage(DataType nativeType) {
        this.nativeType = nativeType;
    }

    /**
     * Returns the column type implied by this storage kind.
     *
     * @return the type, or null for {@link #OBJECT}
     */
    public DataType nativeType() {
        return nativeType;
    }
}
