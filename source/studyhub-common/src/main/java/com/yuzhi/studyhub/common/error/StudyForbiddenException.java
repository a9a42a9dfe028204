package com.yuzhi.studyhub.common.error;

/**
 * The caller lacks a permission, or the study/sample scope of the requested resource.
 */
public class StudyForbiddenException extends StudyAccessException {

    public StudyForbiddenException(String code, String message) {
        super(code, message);
    }

    public static StudyForbiddenException missingPermission(String permission) {
        return new StudyForbiddenException(StudyErrorCodes.PERMISSION_DENIED, "Insufficient permissions: " + permission);
    }

    public static StudyForbiddenException studyNotAccessible(String studyId) {
        return new StudyForbiddenException(StudyErrorCodes.STUDY_SCOPE_MISMATCH, "Unauthorized study access: " + studyId);
    }

    public static StudyForbiddenException sampleNotAccessible(String studyId, String sampleId) {
        return new StudyForbiddenException(
            StudyErrorCodes.SAMPLE_SCOPE_MISMATCH,
            "Unauthorized sample access: " + studyId + "/" + sampleId
        );
    }

    public static StudyForbiddenException roleFolderNotAccessible(String studyId, String folder) {
        return new StudyForbiddenException(StudyErrorCodes.ROLE_FOLDER_MISMATCH, "Unauthorized role access: " + studyId + "/" + folder);
    }
}
