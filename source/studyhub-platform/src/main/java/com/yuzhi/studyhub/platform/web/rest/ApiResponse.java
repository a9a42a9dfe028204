package com.yuzhi.studyhub.platform.web.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON envelope of every {@code /api} answer. {@code status} repeats the HTTP status code;
 * {@code code} is set on failures only, e.g. {@code studyhub-0003}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(int status, String message, String code, T data) {}
