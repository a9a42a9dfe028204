package com.yuzhi.studyhub.platform.management.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class StudyStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public StudyStoreHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            Long studies = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM fw_psy_study", Long.class);
            return Health.up().withDetail("studyDb", "reachable").withDetail("studies", studies == null ? 0L : studies).build();
        } catch (Exception e) {
            return Health.down(e).withDetail("studyDb", "unreachable").build();
        }
    }
}
