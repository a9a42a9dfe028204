package com.yuzhi.studyhub.common.status;

import java.time.Duration;
import java.time.Instant;

/**
 * Picks a time-bucket width from the span of a study's submission history.
 * <p>
 * The span is counted in whole elapsed days. Spans longer than {@code monthThresholdDays} are
 * grouped by month, spans longer than {@code weekThresholdDays} by week, anything shorter by day.
 */
public final class AggregationPlanner {

    public static final int DEFAULT_WEEK_THRESHOLD_DAYS = 60;
    public static final int DEFAULT_MONTH_THRESHOLD_DAYS = 365;

    private final int weekThresholdDays;
    private final int monthThresholdDays;

    public AggregationPlanner() {
        this(DEFAULT_WEEK_THRESHOLD_DAYS, DEFAULT_MONTH_THRESHOLD_DAYS);
    }

    public AggregationPlanner(int weekThresholdDays, int monthThresholdDays) {
        if (weekThresholdDays < 0 || monthThresholdDays <= weekThresholdDays) {
            throw new IllegalArgumentException(
                "Thresholds must satisfy 0 <= week < month, got week=" + weekThresholdDays + ", month=" + monthThresholdDays
            );
        }
        this.weekThresholdDays = weekThresholdDays;
        this.monthThresholdDays = monthThresholdDays;
    }

    public AggregationWindow plan(Instant earliest, Instant latest) {
        if (earliest == null || latest == null) {
            return AggregationWindow.empty();
        }
        long rangeDays = Math.abs(Duration.between(earliest, latest).toDays());
        return new AggregationWindow(unitFor(rangeDays), rangeDays, earliest, latest);
    }

    public TimeBucket unitFor(long rangeDays) {
        if (rangeDays > monthThresholdDays) {
            return TimeBucket.MONTH;
        }
        if (rangeDays > weekThresholdDays) {
            return TimeBucket.WEEK;
        }
        return TimeBucket.DAY;
    }
}
