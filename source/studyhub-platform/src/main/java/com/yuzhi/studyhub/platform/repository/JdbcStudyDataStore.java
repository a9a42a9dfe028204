package com.yuzhi.studyhub.platform.repository;

import com.yuzhi.studyhub.common.error.StudyQueryException;
import com.yuzhi.studyhub.common.sql.BoundStatement;
import com.yuzhi.studyhub.common.sql.PlaceholderBinder;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.SqlTypeValue;
import org.springframework.jdbc.core.StatementCreatorUtils;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcStudyDataStore implements StudyDataStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcStudyDataStore.class);

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** PostgreSQL SQLSTATE for a statement cancelled by its timeout. */
    private static final String QUERY_CANCELED = "57014";

    private final JdbcTemplate jdbcTemplate;

    public JdbcStudyDataStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> execute(String template, List<?> params, Duration timeout) {
        BoundStatement statement = PlaceholderBinder.bind(template, params);
        int timeoutSeconds = toSeconds(timeout == null ? DEFAULT_TIMEOUT : timeout);
        if (log.isDebugEnabled()) {
            log.debug("Study store query ({} bind values, timeout {}s): {}", statement.bindValues().size(), timeoutSeconds, statement.sql());
        }
        PreparedStatementSetter setter = ps -> bindValues(ps, statement.bindValues(), timeoutSeconds);
        try {
            return jdbcTemplate.query(statement.sql(), setter, new ColumnMapRowMapper());
        } catch (DataAccessException ex) {
            boolean timedOut = isTimeout(ex);
            log.warn("Study store query {}: {}", timedOut ? "timed out" : "failed", ex.getMostSpecificCause().getMessage());
            throw new StudyQueryException(timedOut ? "Study store query timed out" : "Study store query failed", ex, timedOut);
        }
    }

    private static void bindValues(PreparedStatement ps, List<Object> values, int timeoutSeconds) throws SQLException {
        ps.setQueryTimeout(timeoutSeconds);
        for (int i = 0; i < values.size(); i++) {
            int position = i + 1;
            Object value = values.get(i);
            if (value instanceof Collection<?> collection) {
                Array array = ps.getConnection().createArrayOf("text", collection.stream().map(String::valueOf).toArray());
                ps.setArray(position, array);
            } else if (value instanceof Instant instant) {
                ps.setObject(position, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
            } else {
                StatementCreatorUtils.setParameterValue(ps, position, SqlTypeValue.TYPE_UNKNOWN, value);
            }
        }
    }

    private static int toSeconds(Duration timeout) {
        long millis = Math.max(0, timeout.toMillis());
        // JDBC timeouts are whole seconds and 0 disables them
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    private static boolean isTimeout(DataAccessException ex) {
        if (ex instanceof QueryTimeoutException) {
            return true;
        }
        Throwable cause = ex.getCause();
        while (cause != null) {
            if (cause instanceof SQLException sql && QUERY_CANCELED.equals(sql.getSQLState())) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
