package com.yuzhi.studyhub.common.error;

/**
 * Malformed request input, e.g. a reporting period outside the accepted range.
 */
public class StudyValidationException extends StudyAccessException {

    public StudyValidationException(String message) {
        super(StudyErrorCodes.VALIDATION_FAILED, message);
    }
}
