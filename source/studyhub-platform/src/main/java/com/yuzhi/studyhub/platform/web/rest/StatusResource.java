package com.yuzhi.studyhub.platform.web.rest;

import com.yuzhi.studyhub.platform.config.StatusReportProperties;
import com.yuzhi.studyhub.platform.security.CallerResolver;
import com.yuzhi.studyhub.platform.service.status.StatusAggregator;
import com.yuzhi.studyhub.platform.service.status.StatusReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/status")
public class StatusResource {

    private final StatusAggregator statusAggregator;
    private final CallerResolver callerResolver;
    private final StatusReportProperties properties;

    public StatusResource(StatusAggregator statusAggregator, CallerResolver callerResolver, StatusReportProperties properties) {
        this.statusAggregator = statusAggregator;
        this.callerResolver = callerResolver;
        this.properties = properties;
    }

    @GetMapping
    public ApiResponse<StatusReport> status(@RequestParam(value = "days", required = false) Integer days) {
        int periodDays = days == null ? properties.getDefaultPeriodDays() : days;
        return ApiResponses.ok(statusAggregator.buildReport(callerResolver.requireCurrentCaller(), periodDays));
    }
}
