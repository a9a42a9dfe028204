package com.yuzhi.studyhub.common.error;

/**
 * A statement sent to the study store failed or ran past its timeout.
 */
public class StudyQueryException extends StudyAccessException {

    private final boolean timedOut;

    public StudyQueryException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public StudyQueryException(String message, Throwable cause, boolean timedOut) {
        super(timedOut ? StudyErrorCodes.QUERY_TIMEOUT : StudyErrorCodes.QUERY_FAILED, message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
