package com.yuzhi.studyhub.common.security;

/**
 * Permission tags derived from study roles.
 */
public final class StudyPermissions {

    public static final String READ_USERS = "READ_USERS";
    public static final String READ_LOGS = "READ_LOGS";
    public static final String READ_TASKS = "READ_TASKS";
    public static final String READ_DATASETS = "READ_DATASETS";
    public static final String WRITE_USERS = "WRITE_USERS";
    public static final String WRITE_TASKS = "WRITE_TASKS";
    public static final String ADMIN = "ADMIN";

    private StudyPermissions() {}
}
