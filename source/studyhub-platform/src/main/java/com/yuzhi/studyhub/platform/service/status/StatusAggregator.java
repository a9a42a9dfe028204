package com.yuzhi.studyhub.platform.service.status;

import com.yuzhi.studyhub.common.error.EmptyGrantSetException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyRole;
import com.yuzhi.studyhub.common.sql.SqlPredicate;
import com.yuzhi.studyhub.common.status.AggregationPlanner;
import com.yuzhi.studyhub.common.status.AggregationWindow;
import com.yuzhi.studyhub.common.status.TimeBucket;
import com.yuzhi.studyhub.platform.config.StatusReportProperties;
import com.yuzhi.studyhub.platform.config.StudyAccessConfiguration;
import com.yuzhi.studyhub.platform.repository.RowValues;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.security.StudyPredicateContexts;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Builds the usage status report of every study a caller can reach.
 * <p>
 * One grouped summary query covers all studies under the caller's compiled predicate; a failure
 * there fails the report. Each study found is then expanded with its submission history
 * (date range, bucket unit, bucketed counts) on a bounded executor. A study whose expansion fails
 * or runs out of time keeps its summary metrics and falls back to an empty daily series.
 */
@Service
public class StatusAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatusAggregator.class);

    public static final int MIN_PERIOD_DAYS = 1;
    public static final int MAX_PERIOD_DAYS = 365;

    private static final String SCOPE = "{scope}";

    static final String SUMMARY_SQL =
        """
        SELECT
          u.study_id,
          COUNT(DISTINCT u.user_id) AS total_users,
          COUNT(DISTINCT CASE WHEN utl.submission_time >= $1 THEN u.user_id ELSE NULL END) AS active_users,
          COUNT(DISTINCT ut.user_task_id) AS assigned_tasks,
          COUNT(DISTINCT CASE WHEN ut.enabled = true THEN ut.user_task_id ELSE NULL END) AS enabled_tasks,
          COUNT(utl.user_task_log_id) AS total_submissions,
          COUNT(CASE WHEN utl.submission_time >= $1 THEN utl.user_task_log_id ELSE NULL END) AS recent_submissions,
          ROUND(AVG(CASE WHEN utl.submission_time >= $1
            THEN EXTRACT(EPOCH FROM (utl.submission_time - ut.assigned_time)) ELSE NULL END)::numeric, 2) AS avg_submission_lag_seconds,
          ROUND(AVG(CASE WHEN utl.submission_time >= $1
            THEN EXTRACT(EPOCH FROM (utl.processing_time - utl.submission_time)) ELSE NULL END)::numeric, 2) AS avg_processing_time_seconds,
          MAX(utl.submission_time) AS latest_submission,
          MIN(utl.submission_time) AS earliest_submission,
          MAX(utl.processing_time) AS latest_processing,
          COUNT(DISTINCT uti.user_task_instance_id) AS total_instances_used,
          COUNT(DISTINCT CASE WHEN utl.submission_time >= $1 THEN uti.user_task_instance_id ELSE NULL END) AS recent_instances_used
        FROM fw_psy_user u
        LEFT JOIN fw_psy_user_task ut ON u.user_id = ut.user_id
        LEFT JOIN fw_psy_user_task_log utl ON ut.user_task_id = utl.user_task_id
        LEFT JOIN fw_psy_user_task_instance uti ON utl.user_task_instance_id = uti.user_task_instance_id
        WHERE {scope}
        GROUP BY u.study_id
        ORDER BY u.study_id
        """;

    static final String RANGE_SQL =
        """
        SELECT
          MIN(utl.submission_time) AS earliest_submission,
          MAX(utl.submission_time) AS latest_submission
        FROM fw_psy_user_task_log utl
        JOIN fw_psy_user_task ut ON utl.user_task_id = ut.user_task_id
        JOIN fw_psy_user u ON ut.user_id = u.user_id
        WHERE {scope}
        """;

    static final String BUCKET_SQL =
        """
        SELECT
          DATE_TRUNC($1, utl.submission_time)::date AS bucket_start,
          COUNT(DISTINCT utl.user_task_log_id) AS submission_count
        FROM fw_psy_user_task_log utl
        JOIN fw_psy_user_task ut ON utl.user_task_id = ut.user_task_id
        JOIN fw_psy_user u ON ut.user_id = u.user_id
        WHERE {scope}
        GROUP BY 1
        ORDER BY 1
        """;

    private final StudyDataStore store;
    private final AccessGate accessGate;
    private final AggregationPlanner planner;
    private final ExecutorService executor;
    private final StatusReportProperties properties;
    private final Clock clock;

    public StatusAggregator(
        StudyDataStore store,
        AccessGate accessGate,
        AggregationPlanner planner,
        @Qualifier(StudyAccessConfiguration.STATUS_FAN_OUT_EXECUTOR) ExecutorService executor,
        StatusReportProperties properties,
        Clock clock
    ) {
        this.store = store;
        this.accessGate = accessGate;
        this.planner = planner;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public StatusReport buildReport(Caller caller, int periodDays) {
        if (periodDays < MIN_PERIOD_DAYS || periodDays > MAX_PERIOD_DAYS) {
            throw new StudyValidationException("Days parameter must be between " + MIN_PERIOD_DAYS + " and " + MAX_PERIOD_DAYS);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(periodDays));

        if (accessGate.accessibleStudies(caller, StudyRole.VIEWER).isEmpty()) {
            log.debug("Caller {} has no study grants; returning empty status report", caller == null ? null : caller.id());
            return new StatusReport(StatusMetrics.zero(), List.of(), periodDays, cutoff, TimeBucket.DAY);
        }

        SqlPredicate predicate = accessGate
            .scope(caller, StudyPredicateContexts.PARTICIPANT, 2)
            .orElseThrow(EmptyGrantSetException::new);
        List<Object> params = new ArrayList<>();
        params.add(cutoff);
        params.addAll(predicate.params());
        List<Map<String, Object>> rows = store.execute(
            SUMMARY_SQL.replace(SCOPE, predicate.clauseTemplate()),
            params,
            properties.getSummaryQueryTimeout()
        );

        Map<String, StatusMetrics> metricsByStudy = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            metricsByStudy.put(RowValues.asString(row.get("study_id")), toMetrics(row));
        }

        Map<String, StudySeries> seriesByStudy = expandStudies(caller, metricsByStudy.keySet().stream().toList());

        List<StudyStatus> byStudy = new ArrayList<>(metricsByStudy.size());
        Map<TimeBucket, Integer> unitCounts = new EnumMap<>(TimeBucket.class);
        List<TimeBucket> unitOrder = new ArrayList<>();
        metricsByStudy.forEach((studyId, metrics) -> {
            StudySeries series = seriesByStudy.getOrDefault(studyId, StudySeries.EMPTY);
            TimeBucket unit = series.window().unit();
            byStudy.add(new StudyStatus(studyId, metrics, series.buckets(), unit, series.window().rangeDays()));
            if (unitCounts.merge(unit, 1, Integer::sum) == 1) {
                unitOrder.add(unit);
            }
        });

        StatusMetrics overall = StatusMetrics.summarize(byStudy.stream().map(StudyStatus::metrics).toList());
        return new StatusReport(overall, byStudy, periodDays, cutoff, mostFrequent(unitOrder, unitCounts));
    }

    private Map<String, StudySeries> expandStudies(Caller caller, List<String> studyIds) {
        Map<String, Future<StudySeries>> futures = new LinkedHashMap<>();
        for (String studyId : studyIds) {
            futures.put(studyId, executor.submit(() -> loadSeries(studyId, caller.scopedTo(studyId))));
        }

        long deadline = System.nanoTime() + properties.getFanOutTimeout().toNanos();
        Map<String, StudySeries> results = new LinkedHashMap<>();
        for (Map.Entry<String, Future<StudySeries>> entry : futures.entrySet()) {
            String studyId = entry.getKey();
            Future<StudySeries> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                results.put(studyId, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                future.cancel(true);
                log.warn("Submission history of study {} not ready before the report deadline; using empty series", studyId);
                results.put(studyId, StudySeries.EMPTY);
            } catch (ExecutionException ex) {
                log.warn("Submission history of study {} failed; using empty series: {}", studyId, ex.getCause().getMessage());
                results.put(studyId, StudySeries.EMPTY);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("Interrupted while waiting for study {}; using empty series", studyId);
                results.put(studyId, StudySeries.EMPTY);
            }
        }
        return results;
    }

    private StudySeries loadSeries(String studyId, Caller studyCaller) {
        Duration timeout = properties.getStudyQueryTimeout();

        SqlPredicate rangePredicate = accessGate
            .scope(studyCaller, StudyPredicateContexts.PARTICIPANT, 1)
            .orElseThrow(() -> new IllegalStateException("Caller holds no grant on study " + studyId));
        List<Map<String, Object>> rangeRows = store.execute(
            RANGE_SQL.replace(SCOPE, rangePredicate.clauseTemplate()),
            rangePredicate.params(),
            timeout
        );
        Map<String, Object> range = rangeRows.isEmpty() ? Map.of() : rangeRows.get(0);
        AggregationWindow window = planner.plan(
            RowValues.asInstant(range.get("earliest_submission")),
            RowValues.asInstant(range.get("latest_submission"))
        );
        if (!window.hasRange()) {
            return StudySeries.EMPTY;
        }

        SqlPredicate bucketPredicate = accessGate
            .scope(studyCaller, StudyPredicateContexts.PARTICIPANT, 2)
            .orElseThrow(() -> new IllegalStateException("Caller holds no grant on study " + studyId));
        List<Object> params = new ArrayList<>();
        params.add(window.unit().fieldName());
        params.addAll(bucketPredicate.params());
        List<Map<String, Object>> bucketRows = store.execute(BUCKET_SQL.replace(SCOPE, bucketPredicate.clauseTemplate()), params, timeout);

        List<SubmissionBucket> buckets = new ArrayList<>(bucketRows.size());
        for (Map<String, Object> row : bucketRows) {
            buckets.add(new SubmissionBucket(RowValues.asLocalDate(row.get("bucket_start")), RowValues.asLong(row.get("submission_count"))));
        }
        return new StudySeries(window, buckets);
    }

    /** Ties go to the unit that appeared first in study order. */
    private static TimeBucket mostFrequent(List<TimeBucket> unitOrder, Map<TimeBucket, Integer> unitCounts) {
        TimeBucket best = TimeBucket.DAY;
        int bestCount = 0;
        for (TimeBucket unit : unitOrder) {
            int count = unitCounts.get(unit);
            if (count > bestCount) {
                best = unit;
                bestCount = count;
            }
        }
        return best;
    }

    private static StatusMetrics toMetrics(Map<String, Object> row) {
        return new StatusMetrics(
            new StatusMetrics.UserCounts(RowValues.asLong(row.get("total_users")), RowValues.asLong(row.get("active_users"))),
            new StatusMetrics.TaskCounts(RowValues.asLong(row.get("assigned_tasks")), RowValues.asLong(row.get("enabled_tasks"))),
            new StatusMetrics.ActivityMetrics(
                RowValues.asLong(row.get("total_submissions")),
                RowValues.asLong(row.get("recent_submissions")),
                RowValues.asDecimal(row.get("avg_submission_lag_seconds")),
                RowValues.asDecimal(row.get("avg_processing_time_seconds")),
                RowValues.asInstant(row.get("latest_submission")),
                RowValues.asInstant(row.get("earliest_submission")),
                RowValues.asInstant(row.get("latest_processing"))
            ),
            new StatusMetrics.TaskInstanceCounts(
                RowValues.asLong(row.get("total_instances_used")),
                RowValues.asLong(row.get("recent_instances_used"))
            )
        );
    }

    private record StudySeries(AggregationWindow window, List<SubmissionBucket> buckets) {
        static final StudySeries EMPTY = new StudySeries(AggregationWindow.empty(), List.of());
    }
}
