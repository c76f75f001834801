package com.di.docsync.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the operator endpoints to a structured {@link ErrorResponse}.
 * <ul>
 *   <li>bad input: 400</li>
 *   <li>unknown job id: 404</li>
 *   <li>source database unreachable: 503</li>
 *   <li>everything else: 500</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(RuntimeException e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnknownJobException.class)
    public ResponseEntity<ErrorResponse> handleUnknownJob(UnknownJobException e) {
        return respond("UNKNOWN_JOB", e, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SourceConnectionException.class)
    public ResponseEntity<ErrorResponse> handleSourceConnection(SourceConnectionException e) {
        return respond("SOURCE_UNAVAILABLE", e, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        if (status.is5xxServerError()) {
            log.error("[API] {} {} [{}] requestId={}", eventType, e.getClass().getSimpleName(),
                    category.getName(), MDC.get("requestId"), e);
        } else {
            log.warn("[API] {} {}: {}", eventType, e.getClass().getSimpleName(), e.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryDescription(category.getDescription());
        response.setRequestId(MDC.get("requestId"));
        response.getDetails().put("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.getDetails().put("rootCauseType", rootCause.getClass().getName());
            response.getDetails().put("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Structured error body for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryDescription;
        private String requestId;
        private Map<String, Object> details = new LinkedHashMap<>();
    }
}
