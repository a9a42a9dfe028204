package com.yuzhi.studyhub.platform.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studyhub.platform.status")
public class StatusReportProperties {

    /** Reporting period used when the request does not pass {@code days}. */
    private int defaultPeriodDays = 7;

    /** Upper bound of studies whose range/bucket queries run at the same time. */
    private int fanOutConcurrency = 4;

    /** Statement timeout of the grouped summary query. A timeout fails the whole report. */
    private Duration summaryQueryTimeout = Duration.ofSeconds(30);

    /** Statement timeout of each per-study range and bucket query. */
    private Duration studyQueryTimeout = Duration.ofSeconds(10);

    /** Total time the report waits for the per-study fan-out before defaulting the stragglers. */
    private Duration fanOutTimeout = Duration.ofSeconds(30);

    /** Submission histories spanning more days than this are grouped by week. */
    private int weekThresholdDays = 60;

    /** Submission histories spanning more days than this are grouped by month. */
    private int monthThresholdDays = 365;

    public int getDefaultPeriodDays() {
        return defaultPeriodDays;
    }

    public void setDefaultPeriodDays(int defaultPeriodDays) {
        this.defaultPeriodDays = defaultPeriodDays;
    }

    public int getFanOutConcurrency() {
        return fanOutConcurrency;
    }

    public void setFanOutConcurrency(int fanOutConcurrency) {
        this.fanOutConcurrency = fanOutConcurrency;
    }

    public Duration getSummaryQueryTimeout() {
        return summaryQueryTimeout;
    }

    public void setSummaryQueryTimeout(Duration summaryQueryTimeout) {
        this.summaryQueryTimeout = summaryQueryTimeout;
    }

    public Duration getStudyQueryTimeout() {
        return studyQueryTimeout;
    }

    public void setStudyQueryTimeout(Duration studyQueryTimeout) {
        this.studyQueryTimeout = studyQueryTimeout;
    }

    public Duration getFanOutTimeout() {
        return fanOutTimeout;
    }

    public void setFanOutTimeout(Duration fanOutTimeout) {
        this.fanOutTimeout = fanOutTimeout;
    }

    public int getWeekThresholdDays() {
        return weekThresholdDays;
    }

    public void setWeekThresholdDays(int weekThresholdDays) {
        this.weekThresholdDays = weekThresholdDays;
    }

    public int getMonthThresholdDays() {
        return monthThresholdDays;
    }

    public void setMonthThresholdDays(int monthThresholdDays) {
        this.monthThresholdDays = monthThresholdDays;
    }
}
