package com.yuzhi.studyhub.platform.service.study;

import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.StudyPermissions;
import com.yuzhi.studyhub.common.sql.SqlPredicate;
import com.yuzhi.studyhub.platform.repository.StudyDataStore;
import com.yuzhi.studyhub.platform.service.security.AccessGate;
import com.yuzhi.studyhub.platform.service.security.StudyPredicateContexts;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Raw participant, task-log and assigned-task rows, filtered to the caller's studies and samples.
 */
@Service
public class StudyRecordService {

    private static final String SCOPE = "{scope}";

    static final String USERS_SQL =
        """
        SELECT DISTINCT u.*
        FROM fw_psy_user u
        WHERE {scope}
        ORDER BY u.user_id ASC
        """;

    static final String TASK_LOGS_SQL =
        """
        SELECT l.*
        FROM fw_psy_user_task_log l
        INNER JOIN fw_psy_user_task ut ON l.user_task_id = ut.user_task_id
        INNER JOIN fw_psy_user u ON ut.user_id = u.user_id
        WHERE {scope}
        ORDER BY l.user_task_id ASC
        """;

    static final String USER_TASKS_SQL =
        """
        SELECT ut.*
        FROM fw_psy_user_task ut
        INNER JOIN fw_psy_user u ON ut.user_id = u.user_id
        WHERE ut.user_id::text = $1
        AND {scope}
        ORDER BY ut.user_task_id ASC
        """;

    private final StudyDataStore store;
    private final AccessGate accessGate;

    public StudyRecordService(StudyDataStore store, AccessGate accessGate) {
        this.store = store;
        this.accessGate = accessGate;
    }

    public List<Map<String, Object>> listUsers(Caller caller) {
        accessGate.authorize(caller, StudyPermissions.READ_USERS);
        return accessGate
            .scope(caller, StudyPredicateContexts.PARTICIPANT, 1)
            .map(predicate -> store.execute(USERS_SQL.replace(SCOPE, predicate.clauseTemplate()), predicate.params()))
            .orElse(List.of());
    }

    public List<Map<String, Object>> listTaskLogs(Caller caller) {
        accessGate.authorize(caller, StudyPermissions.READ_LOGS);
        return accessGate
            .scope(caller, StudyPredicateContexts.PARTICIPANT, 1)
            .map(predicate -> store.execute(TASK_LOGS_SQL.replace(SCOPE, predicate.clauseTemplate()), predicate.params()))
            .orElse(List.of());
    }

    public List<Map<String, Object>> listUserTasks(Caller caller, String userId) {
        accessGate.authorize(caller, StudyPermissions.READ_TASKS);
        if (StringUtils.isBlank(userId)) {
            throw new StudyValidationException("Missing user ID");
        }
        Optional<SqlPredicate> scope = accessGate.scope(caller, StudyPredicateContexts.PARTICIPANT, 2);
        if (scope.isEmpty()) {
            return List.of();
        }
        SqlPredicate predicate = scope.get();
        List<Object> params = new ArrayList<>();
        params.add(userId.trim());
        params.addAll(predicate.params());
        return store.execute(USER_TASKS_SQL.replace(SCOPE, predicate.clauseTemplate()), params);
    }
}
