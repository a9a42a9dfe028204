package com.yuzhi.studyhub.platform.service.status;

import com.yuzhi.studyhub.common.status.TimeBucket;
import java.util.List;

public record StudyStatus(
    String studyId,
    StatusMetrics metrics,
    List<SubmissionBucket> submissionsByBucket,
    TimeBucket timeAggregation,
    long dateRangeDays
) {
    public StudyStatus {
        submissionsByBucket = submissionsByBucket == null ? List.of() : List.copyOf(submissionsByBucket);
    }
}
