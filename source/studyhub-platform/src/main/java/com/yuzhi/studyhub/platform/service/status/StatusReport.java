package com.yuzhi.studyhub.platform.service.status;

import com.yuzhi.studyhub.common.status.TimeBucket;
import java.time.Instant;
import java.util.List;

/**
 * Usage status of every study visible to a caller. {@code byStudy} follows the order of the
 * grouped summary query; {@code timeAggregation} is the bucket unit most studies were given.
 */
public record StatusReport(StatusMetrics overall, List<StudyStatus> byStudy, int periodDays, Instant cutoffDate, TimeBucket timeAggregation) {
    public StatusReport {
        byStudy = byStudy == null ? List.of() : List.copyOf(byStudy);
    }
}
