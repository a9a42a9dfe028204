package com.yuzhi.studyhub.common.error;

/**
 * Raised when a predicate is compiled from an empty grant list. Callers must turn this into an
 * empty result instead of letting it reach the client.
 */
public class EmptyGrantSetException extends StudyAccessException {

    public EmptyGrantSetException() {
        super(StudyErrorCodes.EMPTY_GRANT_SET, "Cannot compile a study predicate from an empty grant set");
    }
}
