package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.service.study.ParticipantPage;
import com.yuzhi.studyhub.platform.service.study.ParticipantQuery;
import com.yuzhi.studyhub.platform.service.study.ParticipantService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/participants")
public class ParticipantResource {

    private final ParticipantService participantService;
    private final CallerResolver callerResolver;

    public ParticipantResource(ParticipantService participantService, CallerResolver callerResolver) {
        this.participantService = participantService;
        this.callerResolver = callerResolver;
    }

    @GetMapping
    public ApiResponse<ParticipantPage> list(
        @RequestParam(value = "studyId", required = false) String studyId,
        @RequestParam(value = "sampleId", required = false) String sampleId,
        @RequestParam(value = "search", required = false) String search,
        @RequestParam(value = "page", defaultValue = "1") int page,
        @RequestParam(value = "pageSize", defaultValue = "20") int pageSize,
        @RequestParam(value = "sortBy", defaultValue = "user_code") String sortBy,
        @RequestParam(value = "sortOrder", defaultValue = "asc") String sortOrder
    ) {
        ParticipantQuery query = new ParticipantQuery(studyId, sampleId, search, page, pageSize, sortBy, sortOrder);
        return ApiResponses.ok(participantService.page(callerResolver.requireCurrentCaller(), query));
    }
}
