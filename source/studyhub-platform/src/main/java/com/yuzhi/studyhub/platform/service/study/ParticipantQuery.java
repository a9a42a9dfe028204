package com.yuzhi.studyhub.platform.service.study;

/**
 * Filter, paging and ordering of a participant listing as received from the request.
 * {@code page} is 1-based.
 */
public record ParticipantQuery(
    String studyId,
    String sampleId,
    String search,
    int page,
    int pageSize,
    String sortBy,
    String sortOrder
) {}
