package com.yuzhi.studyhub.platform.service.study;

import java.util.Locale;

/**
 * Columns a participant listing may be ordered by, mapped to the expression placed in ORDER BY.
 */
public enum ParticipantSort {
    USER_ID("u.user_id"),
    USER_CODE("u.user_code"),
    EMAIL_ADDRESS("u.email_address"),
    LAST_SUBMISSION("last_submission"),
    COMPLETED_TASKS("completed_tasks"),
    ASSIGNED_TASKS("assigned_tasks");

    private final String expression;

    ParticipantSort(String expression) {
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }

    /** Request value such as {@code user_code}; {@code null} for anything outside the list. */
    public static ParticipantSort fromParameter(String value) {
        if (value == null || value.isBlank()) {
            return USER_CODE;
        }
        String canonical = value.trim().toUpperCase(Locale.ROOT);
        for (ParticipantSort sort : values()) {
            if (sort.name().equals(canonical)) {
                return sort;
            }
        }
        return null;
    }
}
