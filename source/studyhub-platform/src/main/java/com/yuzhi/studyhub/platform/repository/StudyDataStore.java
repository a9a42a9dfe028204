package com.yuzhi.studyhub.platform.repository;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read access to the study database. Templates use 1-based {@code $N} placeholders; every
 * parameter must be referenced at least once. Collection parameters bind as text arrays.
 */
public interface StudyDataStore {
    /**
     * Run a query with an explicit statement timeout. A {@code null} timeout falls back to the
     * store default.
     *
     * @throws com.yuzhi.studyhub.common.error.StudyQueryException when the statement fails or times out
     */
    List<Map<String, Object>> execute(String template, List<?> params, Duration timeout);

    default List<Map<String, Object>> execute(String template, List<?> params) {
        return execute(template, params, null);
    }
}
