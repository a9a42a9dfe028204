package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.service.study.StudyCatalogService;
import com.yuzhi.studyhub.platform.service.study.StudyCatalogService.StudySummary;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/studies")
public class StudyResource {

    private final StudyCatalogService studyCatalogService;
    private final CallerResolver callerResolver;

    public StudyResource(StudyCatalogService studyCatalogService, CallerResolver callerResolver) {
        this.studyCatalogService = studyCatalogService;
        this.callerResolver = callerResolver;
    }

    @GetMapping
    public ApiResponse<List<StudySummary>> list() {
        return ApiResponses.ok(studyCatalogService.listStudies(callerResolver.requireCurrentCaller()));
    }
}
