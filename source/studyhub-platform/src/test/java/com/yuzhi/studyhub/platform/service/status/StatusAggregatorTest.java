package com.yuzhi.studyhub.platform.service.status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yuzhi.studyhub.common.error.StudyQueryException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyGrant;
import com.yuzhi.studyhub.common.status.AggregationPlanner;
import com.yuzhi.studyhub.common.status.TimeBucket;
import com.yuzhi.studyhub.platform.config.StatusReportProperties;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant HISTORY_START = Instant.parse("2023-01-01T00:00:00Z");

    private FakeStore store;
    private ExecutorService executor;
    private StatusReportProperties properties;
    private StatusAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new FakeStore();
        executor = Executors.newFixedThreadPool(2);
        properties = new StatusReportProperties();
        aggregator = new StatusAggregator(
            store,
            new AccessGate(),
            new AggregationPlanner(),
            executor,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void callerWithoutGrantsGetsZeroedReport() {
        StatusReport report = aggregator.buildReport(new Caller("u-1", List.of()), 30);

        assertThat(report.byStudy()).isEmpty();
        assertThat(report.overall()).isEqualTo(StatusMetrics.zero());
        assertThat(report.periodDays()).isEqualTo(30);
        assertThat(report.cutoffDate()).isEqualTo(NOW.minus(Duration.ofDays(30)));
        assertThat(report.timeAggregation()).isEqualTo(TimeBucket.DAY);
        assertThat(store.calls).isEmpty();
    }

    @Test
    void missingCallerGetsZeroedReportWithoutQueries() {
        StatusReport report = aggregator.buildReport(null, 7);

        assertThat(report.byStudy()).isEmpty();
        assertThat(report.overall()).isEqualTo(StatusMetrics.zero());
        assertThat(store.calls).isEmpty();
    }

    @Test
    void periodOutsideRangeIsRejected() {
        Caller caller = new Caller("u-1", List.of(StudyGrant.studyAdmin("A")));

        assertThatThrownBy(() -> aggregator.buildReport(caller, 0)).isInstanceOf(StudyValidationException.class);
        assertThatThrownBy(() -> aggregator.buildReport(caller, 400)).isInstanceOf(StudyValidationException.class);
        assertThat(store.calls).isEmpty();
    }

    @Test
    void oneFailingStudyDefaultsWithoutAffectingOthers() {
        store.summary("A", 3, 10).summary("B", 5, 20).summary("C", 2, 4);
        store.range("A", HISTORY_START, HISTORY_START.plus(Duration.ofDays(400)));
        store.range("C", HISTORY_START, HISTORY_START.plus(Duration.ofDays(5)));
        store.failing.add("B");

        StatusReport report = aggregator.buildReport(caller("A", "B", "C"), 7);

        assertThat(report.byStudy()).extracting(StudyStatus::studyId).containsExactly("A", "B", "C");
        StudyStatus failed = report.byStudy().get(1);
        assertThat(failed.timeAggregation()).isEqualTo(TimeBucket.DAY);
        assertThat(failed.dateRangeDays()).isZero();
        assertThat(failed.submissionsByBucket()).isEmpty();
        assertThat(failed.metrics().users().total()).isEqualTo(5);
        assertThat(report.overall().users().total()).isEqualTo(10);
        assertThat(report.overall().activity().totalSubmissions()).isEqualTo(34);

        StudyStatus monthly = report.byStudy().get(0);
        assertThat(monthly.timeAggregation()).isEqualTo(TimeBucket.MONTH);
        assertThat(monthly.dateRangeDays()).isEqualTo(400);
        assertThat(monthly.submissionsByBucket()).containsExactly(new SubmissionBucket(LocalDate.of(2023, 1, 1), 3));
        assertThat(store.bucketUnits).containsEntry("A", "month").containsEntry("C", "day");
    }

    @Test
    void studyOrderFollowsSummaryEvenWhenFanOutFinishesOutOfOrder() {
        store.summary("C", 1, 1).summary("A", 1, 1).summary("B", 1, 1);
        store.range("A", HISTORY_START, HISTORY_START.plus(Duration.ofDays(100)));
        store.range("B", HISTORY_START, HISTORY_START.plus(Duration.ofDays(100)));
        store.range("C", HISTORY_START, HISTORY_START.plus(Duration.ofDays(100)));
        store.slow.add("C");

        StatusReport report = aggregator.buildReport(caller("A", "B", "C"), 7);

        assertThat(report.byStudy()).extracting(StudyStatus::studyId).containsExactly("C", "A", "B");
        assertThat(report.byStudy()).extracting(StudyStatus::timeAggregation).containsOnly(TimeBucket.WEEK);
    }

    @Test
    void topLevelAggregationIsMostFrequentUnit() {
        store.summary("A", 1, 1).summary("B", 1, 1).summary("C", 1, 1);
        store.range("A", HISTORY_START, HISTORY_START.plus(Duration.ofDays(3)));
        store.range("B", HISTORY_START, HISTORY_START.plus(Duration.ofDays(500)));
        store.range("C", HISTORY_START, HISTORY_START.plus(Duration.ofDays(450)));

        StatusReport report = aggregator.buildReport(caller("A", "B", "C"), 7);

        assertThat(report.timeAggregation()).isEqualTo(TimeBucket.MONTH);
    }

    @Test
    void studyWithoutSubmissionsUsesEmptyDailyWindow() {
        store.summary("A", 4, 0);

        StatusReport report = aggregator.buildReport(caller("A"), 7);

        StudyStatus study = report.byStudy().get(0);
        assertThat(study.timeAggregation()).isEqualTo(TimeBucket.DAY);
        assertThat(study.submissionsByBucket()).isEmpty();
        assertThat(store.bucketUnits).isEmpty();
    }

    @Test
    void stragglingStudyTimesOutToDefault() {
        properties.setFanOutTimeout(Duration.ofMillis(200));
        store.summary("A", 1, 1).summary("B", 1, 1);
        store.range("A", HISTORY_START, HISTORY_START.plus(Duration.ofDays(100)));
        store.blocked.add("B");

        StatusReport report = aggregator.buildReport(caller("A", "B"), 7);

        assertThat(report.byStudy()).hasSize(2);
        assertThat(report.byStudy().get(0).timeAggregation()).isEqualTo(TimeBucket.WEEK);
        assertThat(report.byStudy().get(1).timeAggregation()).isEqualTo(TimeBucket.DAY);
        assertThat(report.byStudy().get(1).submissionsByBucket()).isEmpty();
    }

    @Test
    void summaryFailureFailsTheReport() {
        store.summaryFailure = new StudyQueryException("Study store query timed out", null, true);

        assertThatThrownBy(() -> aggregator.buildReport(caller("A"), 7))
            .isInstanceOfSatisfying(StudyQueryException.class, ex -> assertThat(ex.isTimedOut()).isTrue());
    }

    @Test
    void summaryQueryBindsCutoffThenStudiesThenSampleArrays() {
        store.summary("A", 1, 1);
        Caller caller = new Caller("u-1", List.of(StudyGrant.sampleAdmin("A", List.of("s1", "s2")), StudyGrant.viewer("B")));

        aggregator.buildReport(caller, 14);

        Call summary = store.calls.get(0);
        assertThat(summary.params()).containsExactly(NOW.minus(Duration.ofDays(14)), "A", "B", List.of("s1", "s2"));
        assertThat(summary.sql()).contains("u.study_id = $2 AND EXISTS").contains("ANY($4::text[])").contains("(u.study_id = $3)");
        assertThat(summary.timeout()).isEqualTo(properties.getSummaryQueryTimeout());
    }

    @Test
    void perStudyQueriesOnlyCarryThatStudysGrants() {
        store.summary("A", 1, 1);
        store.range("A", HISTORY_START, HISTORY_START.plus(Duration.ofDays(2)));
        Caller caller = new Caller("u-1", List.of(StudyGrant.viewer("B"), StudyGrant.sampleAdmin("A", List.of("s1"))));

        aggregator.buildReport(caller, 7);

        List<Call> rangeCalls = store.calls.stream().filter(call -> call.kind().equals("range")).toList();
        assertThat(rangeCalls).hasSize(1);
        assertThat(rangeCalls.get(0).params()).containsExactly("A", List.of("s1"));
        assertThat(rangeCalls.get(0).timeout()).isEqualTo(properties.getStudyQueryTimeout());
    }

    @Test
    void overallAveragesIgnoreStudiesWithoutAverages() {
        store.summaryRows.add(summaryRow("A", 1, 1, new BigDecimal("10.00")));
        store.summaryRows.add(summaryRow("B", 1, 1, null));
        store.summaryRows.add(summaryRow("C", 1, 1, new BigDecimal("15.25")));

        StatusReport report = aggregator.buildReport(caller("A", "B", "C"), 7);

        assertThat(report.overall().activity().avgSubmissionLagSeconds()).isEqualByComparingTo("12.63");
    }

    private static Caller caller(String... studies) {
        List<StudyGrant> grants = new ArrayList<>();
        for (String study : studies) {
            grants.add(StudyGrant.studyAdmin(study));
        }
        return new Caller("u-1", grants);
    }

    private static Map<String, Object> summaryRow(String studyId, long users, long submissions, BigDecimal avgLag) {
        Map<String, Object> row = new HashMap<>();
        row.put("study_id", studyId);
        row.put("total_users", users);
        row.put("active_users", users);
        row.put("assigned_tasks", 2L);
        row.put("enabled_tasks", 1L);
        row.put("total_submissions", submissions);
        row.put("recent_submissions", submissions);
        row.put("avg_submission_lag_seconds", avgLag);
        row.put("avg_processing_time_seconds", null);
        row.put("total_instances_used", 1L);
        row.put("recent_instances_used", 0L);
        return row;
    }

    private record Call(String kind, String sql, List<Object> params, Duration timeout) {}

    private static final class FakeStore implements StudyDataStore {

        final List<Map<String, Object>> summaryRows = new ArrayList<>();
        final Map<String, Instant[]> ranges = new HashMap<>();
        final Set<String> failing = new HashSet<>();
        final Set<String> slow = new HashSet<>();
        final Set<String> blocked = new HashSet<>();
        final Map<String, String> bucketUnits = new ConcurrentHashMap<>();
        final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch never = new CountDownLatch(1);
        StudyQueryException summaryFailure;

        FakeStore summary(String studyId, long users, long submissions) {
            summaryRows.add(summaryRow(studyId, users, submissions, new BigDecimal("1.50")));
            return this;
        }

        void range(String studyId, Instant earliest, Instant latest) {
            ranges.put(studyId, new Instant[] { earliest, latest });
        }

        @Override
        public List<Map<String, Object>> execute(String template, List<?> params, Duration timeout) {
            List<Object> values = new ArrayList<>(params);
            if (template.contains("total_users")) {
                calls.add(new Call("summary", template, values, timeout));
                if (summaryFailure != null) {
                    throw summaryFailure;
                }
                return summaryRows;
            }
            if (template.contains("DATE_TRUNC")) {
                calls.add(new Call("bucket", template, values, timeout));
                String studyId = (String) values.get(1);
                bucketUnits.put(studyId, (String) values.get(0));
                Instant earliest = ranges.get(studyId)[0];
                Map<String, Object> row = new HashMap<>();
                row.put("bucket_start", java.sql.Date.valueOf(LocalDate.ofInstant(earliest, ZoneOffset.UTC)));
                row.put("submission_count", 3L);
                return List.of(row);
            }
            calls.add(new Call("range", template, values, timeout));
            String studyId = (String) values.get(0);
            if (failing.contains(studyId)) {
                throw new StudyQueryException("Study store query failed", new IllegalStateException("boom"));
            }
            pause(studyId);
            Instant[] range = ranges.get(studyId);
            Map<String, Object> row = new HashMap<>();
            row.put("earliest_submission", range == null ? null : Timestamp.from(range[0]));
            row.put("latest_submission", range == null ? null : Timestamp.from(range[1]));
            return List.of(row);
        }

        private void pause(String studyId) {
            try {
                if (slow.contains(studyId)) {
                    Thread.sleep(150);
                }
                if (blocked.contains(studyId)) {
                    never.await();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", ex);
            }
        }
    }
}
