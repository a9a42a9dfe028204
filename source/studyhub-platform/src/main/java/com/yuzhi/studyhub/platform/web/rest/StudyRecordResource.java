package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.service.study.StudyRecordService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Participant, task-log and assigned-task rows of the caller's studies.
 */
@RestController
@RequestMapping("/api")
public class StudyRecordResource {

    private final StudyRecordService studyRecordService;
    private final CallerResolver callerResolver;

    public StudyRecordResource(StudyRecordService studyRecordService, CallerResolver callerResolver) {
        this.studyRecordService = studyRecordService;
        this.callerResolver = callerResolver;
    }

    @GetMapping("/users")
    public ApiResponse<List<Map<String, Object>>> users() {
        return ApiResponses.ok(studyRecordService.listUsers(callerResolver.requireCurrentCaller()));
    }

    @GetMapping("/tasklogs")
    public ApiResponse<List<Map<String, Object>>> taskLogs() {
        return ApiResponses.ok(studyRecordService.listTaskLogs(callerResolver.requireCurrentCaller()));
    }

    @GetMapping("/userTask/{userId}")
    public ApiResponse<List<Map<String, Object>>> userTasks(@PathVariable String userId) {
        return ApiResponses.ok(studyRecordService.listUserTasks(callerResolver.requireCurrentCaller(), userId));
    }
}
