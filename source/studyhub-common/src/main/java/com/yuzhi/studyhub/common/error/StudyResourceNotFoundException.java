package com.yuzhi.studyhub.common.error;

public class StudyResourceNotFoundException extends StudyAccessException {

    public StudyResourceNotFoundException(String message) {
        super(StudyErrorCodes.RESOURCE_NOT_FOUND, message);
    }
}
