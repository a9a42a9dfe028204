package com.yuzhi.studyhub.common.status;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Width of the intervals submission counts are grouped into.
 */
public enum TimeBucket {
    DAY,
    WEEK,
    MONTH;

    /** Lower-case field name, as accepted by {@code DATE_TRUNC} and emitted in reports. */
    @JsonValue
    public String fieldName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
