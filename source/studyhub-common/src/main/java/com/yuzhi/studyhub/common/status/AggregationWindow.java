package com.yuzhi.studyhub.common.status;

import java.time.Instant;
import java.util.Objects;

/**
 * Bucket choice for one study's submission history. Derived per request, never stored.
 */
public record AggregationWindow(TimeBucket unit, long rangeDays, Instant earliest, Instant latest) {
    public AggregationWindow {
        Objects.requireNonNull(unit, "unit");
    }

    /** Window used when a study has no submissions or its history could not be read. */
    public static AggregationWindow empty() {
        return new AggregationWindow(TimeBucket.DAY, 0, null, null);
    }

    public boolean hasRange() {
        return earliest != null && latest != null;
    }
}
