package com.yuzhi.studyhub.common.error;

public final class StudyErrorCodes {
    private StudyErrorCodes() {}

    public static final String VALIDATION_FAILED = "studyhub-0001";
    public static final String PERMISSION_DENIED = "studyhub-0002";
    public static final String STUDY_SCOPE_MISMATCH = "studyhub-0003";
    public static final String SAMPLE_SCOPE_MISMATCH = "studyhub-0004";
    public static final String INVALID_GRANT = "studyhub-0005";
    public static final String EMPTY_GRANT_SET = "studyhub-0006";
    public static final String QUERY_FAILED = "studyhub-0007";
    public static final String QUERY_TIMEOUT = "studyhub-0008";
    public static final String RESOURCE_NOT_FOUND = "studyhub-0009";
    public static final String INVALID_TOKEN = "studyhub-0010";
    public static final String ROLE_FOLDER_MISMATCH = "studyhub-0011";
}
