package com.yuzhi.studyhub.platform.service.study;

import com.yuzhi.studyhub.common.error.StudyForbiddenException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyPermissions;
import com.yuzhi.studyhub.common.security.StudyRole;
import com.yuzhi.studyhub.common.sql.SqlPredicate;
import com.yuzhi.studyhub.platform.config.AccessPolicyProperties;
import com.yuzhi.studyhub.platform.repository.RowValues;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.security.StudyPredicateContexts;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paged participant listing of one study with per-participant submission figures.
 */
@Service
public class ParticipantService {

    private static final Logger log = LoggerFactory.getLogger(ParticipantService.class);

    static final String PAGE_SQL =
        """
        SELECT
          u.user_id,
          u.user_code,
          u.email_address,
          MAX(utl.submission_time) AS last_submission,
          COUNT(DISTINCT utl.user_task_log_id) AS completed_tasks,
          COUNT(DISTINCT ut.task_id) AS assigned_tasks
        FROM fw_psy_user u
        LEFT JOIN fw_psy_user_task ut ON u.user_id = ut.user_id
        LEFT JOIN fw_psy_user_task_log utl ON ut.user_task_id = utl.user_task_id
        WHERE {conditions}
        GROUP BY u.user_id, u.user_code, u.email_address
        ORDER BY {order}
        LIMIT {limit} OFFSET {offset}
        """;

    static final String COUNT_SQL =
        """
        SELECT COUNT(DISTINCT u.user_id) AS total_rows
        FROM fw_psy_user u
        WHERE {conditions}
        """;

    private final StudyDataStore store;
    private final AccessGate accessGate;
    private final AccessPolicyProperties accessPolicyProperties;

    public ParticipantService(StudyDataStore store, AccessGate accessGate, AccessPolicyProperties accessPolicyProperties) {
        this.store = store;
        this.accessGate = accessGate;
        this.accessPolicyProperties = accessPolicyProperties;
    }

    public ParticipantPage page(Caller caller, ParticipantQuery query) {
        accessGate.authorize(caller, StudyPermissions.READ_USERS);
        String studyId = StringUtils.trimToNull(query.studyId());
        if (studyId == null) {
            throw new StudyValidationException("studyId is required");
        }
        accessGate.authorizeStudy(caller, studyId, StudyRole.SAMPLE_ADMIN);
        String sampleId = StringUtils.trimToNull(query.sampleId());
        if (sampleId != null && !accessGate.authorizeSample(caller, studyId, sampleId)) {
            throw StudyForbiddenException.sampleNotAccessible(studyId, sampleId);
        }
        ParticipantSort sort = ParticipantSort.fromParameter(query.sortBy());
        if (sort == null) {
            throw new StudyValidationException("Unsupported sortBy: " + query.sortBy());
        }
        boolean descending = "desc".equalsIgnoreCase(StringUtils.trimToEmpty(query.sortOrder()));
        int page = Math.max(1, query.page());
        int pageSize = Math.min(Math.max(1, query.pageSize()), accessPolicyProperties.getMaxPageSize());
        long offset = (long) (page - 1) * pageSize;

        // authorizeStudy passed, so the scoped grant list is never empty
        SqlPredicate predicate = accessGate
            .scope(caller.scopedTo(studyId), StudyPredicateContexts.PARTICIPANT, 1)
            .orElseThrow(() -> StudyForbiddenException.studyNotAccessible(studyId));

        StringBuilder conditions = new StringBuilder(predicate.clauseTemplate());
        List<Object> params = new ArrayList<>(predicate.params());
        int next = predicate.nextParamIndex();
        if (sampleId != null) {
            conditions
                .append(" AND EXISTS (SELECT 1 FROM fw_psy_sample_user sf WHERE sf.user_id = u.user_id AND sf.sample_id::text = $")
                .append(next++)
                .append("::text)");
            params.add(sampleId);
        }
        String search = StringUtils.trimToNull(query.search());
        if (search != null) {
            int placeholder = next++;
            conditions
                .append(" AND (u.user_code ILIKE $")
                .append(placeholder)
                .append(" OR u.email_address ILIKE $")
                .append(placeholder)
                .append(")");
            params.add("%" + escapeLike(search) + "%");
        }

        String where = conditions.toString();
        List<Map<String, Object>> countRows = store.execute(COUNT_SQL.replace("{conditions}", where), params);
        long totalRows = countRows.isEmpty() ? 0L : RowValues.asLong(countRows.get(0).get("total_rows"));

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(pageSize);
        pageParams.add(offset);
        String sql = PAGE_SQL
            .replace("{conditions}", where)
            .replace("{order}", sort.expression() + (descending ? " DESC" : " ASC") + ", u.user_id ASC")
            .replace("{limit}", "$" + next)
            .replace("{offset}", "$" + (next + 1));
        List<Map<String, Object>> data = store.execute(sql, pageParams);

        long totalPages = (totalRows + pageSize - 1) / pageSize;
        if (log.isDebugEnabled()) {
            log.debug("Participants of study {} page {}/{} ({} rows total) for caller {}", studyId, page, totalPages, totalRows, caller.id());
        }
        return new ParticipantPage(data, new ParticipantPage.Pagination(page, pageSize, totalRows, totalPages));
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
