package com.yuzhi.studyhub.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yuzhi.studyhub.common.security.GrantClaimsParser;
import com.yuzhi.studyhub.common.status.AggregationPlanner;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free access core into the application context.
 */
@Configuration
public class StudyAccessConfiguration {

    public static final String STATUS_FAN_OUT_EXECUTOR = "statusFanOutExecutor";

    @Bean
    public GrantClaimsParser grantClaimsParser(ObjectMapper objectMapper, AccessPolicyProperties accessPolicyProperties) {
        return new GrantClaimsParser(objectMapper, accessPolicyProperties.getDuplicateGrants());
    }

    @Bean
    public AggregationPlanner aggregationPlanner(StatusReportProperties properties) {
        return new AggregationPlanner(properties.getWeekThresholdDays(), properties.getMonthThresholdDays());
    }

    @Bean(name = STATUS_FAN_OUT_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService statusFanOutExecutor(StatusReportProperties properties) {
        int threads = Math.max(1, properties.getFanOutConcurrency());
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "status-fan-out-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
