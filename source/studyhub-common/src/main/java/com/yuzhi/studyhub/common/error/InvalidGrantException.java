package com.yuzhi.studyhub.common.error;

/**
 * Identity claims are structurally malformed (unknown role, missing study id, SAMPLE_ADMIN
 * grant without a sample list...).
 */
public class InvalidGrantException extends StudyAccessException {

    public InvalidGrantException(String message) {
        super(StudyErrorCodes.INVALID_GRANT, message);
    }

    public InvalidGrantException(String message, Throwable cause) {
        super(StudyErrorCodes.INVALID_GRANT, message, cause);
    }
}
