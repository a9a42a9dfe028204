package com.yuzhi.studyhub.platform.service.study;

import java.util.List;
import java.util.Map;

public record ParticipantPage(List<Map<String, Object>> data, Pagination pagination) {
    public record Pagination(int page, int pageSize, long totalRows, long totalPages) {}
}
