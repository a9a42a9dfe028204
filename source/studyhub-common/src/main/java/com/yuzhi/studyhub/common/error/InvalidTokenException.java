package com.yuzhi.studyhub.common.error;

/**
 * No verified identity is attached to the request, or a signed link failed verification.
 */
public class InvalidTokenException extends StudyAccessException {

    public InvalidTokenException(String message) {
        super(StudyErrorCodes.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(StudyErrorCodes.INVALID_TOKEN, message, cause);
    }
}
