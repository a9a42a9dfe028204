package com.yuzhi.studyhub.platform.service.status;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Counters and timing figures of one study, or the sum over several.
 */
public record StatusMetrics(UserCounts users, TaskCounts tasks, ActivityMetrics activity, TaskInstanceCounts taskInstances) {
    public record UserCounts(long total, long activeInPeriod) {}

    public record TaskCounts(long assigned, long enabled) {}

    /**
     * Average figures are seconds with two decimals, taken over the submissions of the period;
     * {@code null} when a study had none.
     */
    public record ActivityMetrics(
        long totalSubmissions,
        long submissionsInPeriod,
        BigDecimal avgSubmissionLagSeconds,
        BigDecimal avgProcessingTimeSeconds,
        Instant latestSubmission,
        Instant earliestSubmission,
        Instant latestProcessing
    ) {}

    public record TaskInstanceCounts(long totalUsed, long usedInPeriod) {}

    public static StatusMetrics zero() {
        return new StatusMetrics(
            new UserCounts(0, 0),
            new TaskCounts(0, 0),
            new ActivityMetrics(0, 0, BigDecimal.ZERO, BigDecimal.ZERO, null, null, null),
            new TaskInstanceCounts(0, 0)
        );
    }

    /**
     * Sums counters across studies. Averages are the mean of the per-study averages that are
     * present; timestamps keep the extreme value.
     */
    public static StatusMetrics summarize(List<StatusMetrics> perStudy) {
        if (perStudy == null || perStudy.isEmpty()) {
            return zero();
        }
        long usersTotal = 0, usersActive = 0, assigned = 0, enabled = 0, submissions = 0, recent = 0, instances = 0, recentInstances = 0;
        Instant latest = null, earliest = null, latestProcessing = null;
        for (StatusMetrics metrics : perStudy) {
            usersTotal += metrics.users().total();
            usersActive += metrics.users().activeInPeriod();
            assigned += metrics.tasks().assigned();
            enabled += metrics.tasks().enabled();
            submissions += metrics.activity().totalSubmissions();
            recent += metrics.activity().submissionsInPeriod();
            instances += metrics.taskInstances().totalUsed();
            recentInstances += metrics.taskInstances().usedInPeriod();
            latest = max(latest, metrics.activity().latestSubmission());
            earliest = min(earliest, metrics.activity().earliestSubmission());
            latestProcessing = max(latestProcessing, metrics.activity().latestProcessing());
        }
        return new StatusMetrics(
            new UserCounts(usersTotal, usersActive),
            new TaskCounts(assigned, enabled),
            new ActivityMetrics(
                submissions,
                recent,
                mean(perStudy.stream().map(m -> m.activity().avgSubmissionLagSeconds()).filter(Objects::nonNull).toList()),
                mean(perStudy.stream().map(m -> m.activity().avgProcessingTimeSeconds()).filter(Objects::nonNull).toList()),
                latest,
                earliest,
                latestProcessing
            ),
            new TaskInstanceCounts(instances, recentInstances)
        );
    }

    private static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal sum = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
    }

    private static Instant max(Instant current, Instant candidate) {
        if (candidate == null) return current;
        return current == null || candidate.isAfter(current) ? candidate : current;
    }

    private static Instant min(Instant current, Instant candidate) {
        if (candidate == null) return current;
        return current == null || candidate.isBefore(current) ? candidate : current;
    }
}
