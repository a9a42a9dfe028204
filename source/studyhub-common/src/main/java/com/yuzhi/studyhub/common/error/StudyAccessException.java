package com.yuzhi.studyhub.common.error;

/**
 * Base type of every failure raised by the study access core. Each failure carries a stable,
 * machine-readable code from {@link StudyErrorCodes} so the web layer can map it without
 * inspecting messages.
 */
public abstract class StudyAccessException extends RuntimeException {

    private final String code;

    protected StudyAccessException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected StudyAccessException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
