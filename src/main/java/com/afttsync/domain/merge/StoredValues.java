package com.afttsync.domain.merge;

import java.time.temporal.TemporalAccessor;

/**
 * Converts attribute values to the shape they are stored in: dates as ISO strings, enums by name.
 */
public final class StoredValues {

    private StoredValues() {
    }

    public static Object encode(Object value) {
        if (value instanceof TemporalAccessor temporal) {
            return temporal.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }
}
