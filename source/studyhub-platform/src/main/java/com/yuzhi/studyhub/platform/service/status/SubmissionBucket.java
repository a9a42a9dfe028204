package com.yuzhi.studyhub.platform.service.status;

import java.time.LocalDate;

/** Distinct submissions whose timestamp truncates to {@code bucketStart}. */
public record SubmissionBucket(LocalDate bucketStart, long count) {}
