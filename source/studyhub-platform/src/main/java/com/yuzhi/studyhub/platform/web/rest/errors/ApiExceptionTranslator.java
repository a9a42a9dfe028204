package com.yuzhi.studyhub.platform.web.rest.errors;

import com.yuzhi.studyhub.common.error.InvalidGrantException;
import com.yuzhi.studyhub.common.error.InvalidTokenException;
import com.yuzhi.studyhub.common.error.StudyAccessException;
import com.yuzhi.studyhub.common.error.StudyErrorCodes;
import com.yuzhi.studyhub.common.error.StudyForbiddenException;
import com.yuzhi.studyhub.common.error.StudyQueryException;
import com.yuzhi.studyhub.common.error.StudyResourceNotFoundException;
import com.yuzhi.studyhub.common.error.StudyValidationException;
import com.yuzhi.studyhub.platform.web.rest.ApiResponse;
import com.yuzhi.studyhub.platform.web.rest.ApiResponses;
import jakarta.validation.ConstraintViolationException;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps study access failures to {@link ApiResponse} envelopes. Store failures are logged in full
 * and answered with a generic message.
 */
@RestControllerAdvice
public class ApiExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionTranslator.class);

    @ExceptionHandler(StudyValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(StudyValidationException ex) {
        return ApiResponses.failure(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class, ConstraintViolationException.class })
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception ex) {
        return ApiResponses.failure(HttpStatus.BAD_REQUEST, StudyErrorCodes.VALIDATION_FAILED, ex.getMessage());
    }

    @ExceptionHandler(StudyForbiddenException.class)
    public ResponseEntity<ApiResponse<Void>> handleForbidden(StudyForbiddenException ex) {
        return ApiResponses.failure(HttpStatus.FORBIDDEN, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(InvalidGrantException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidGrant(InvalidGrantException ex) {
        log.warn("Rejected token claims: {}", ex.getMessage());
        return ApiResponses.failure(HttpStatus.FORBIDDEN, ex.getCode(), "Invalid study access claims");
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidToken(InvalidTokenException ex) {
        return ApiResponses.failure(HttpStatus.UNAUTHORIZED, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(StudyResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(StudyResourceNotFoundException ex) {
        return ApiResponses.failure(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(StudyQueryException.class)
    public ResponseEntity<ApiResponse<Void>> handleQuery(StudyQueryException ex) {
        log.error("Study store query failed (timedOut={})", ex.isTimedOut(), ex);
        return ApiResponses.failure(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), "Internal server error");
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ApiResponse<Void>> handleFileSystem(UncheckedIOException ex) {
        log.error("Study file access failed", ex);
        return ApiResponses.failure(HttpStatus.INTERNAL_SERVER_ERROR, StudyErrorCodes.QUERY_FAILED, "Internal server error");
    }

    @ExceptionHandler(StudyAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleOther(StudyAccessException ex) {
        log.error("Unhandled study access failure {}", ex.getCode(), ex);
        return ApiResponses.failure(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), "Internal server error");
    }
}
