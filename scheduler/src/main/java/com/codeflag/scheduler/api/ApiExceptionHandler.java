package com.codeflag.scheduler.api;

import com.codeflag.scheduler.api.dto.ErrorResponse;
import com.codeflag.scheduler.service.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps every failure to a status code and a {@code {"detail": ...}} body.
 *
 *   400  unreadable body, missing fields, bad settings token
 *   500  keys not configured, unexpected error
 *   503  broker unavailable
 *   504  no result before the execution deadline
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SubmissionException.class)
    public ResponseEntity<ErrorResponse> handleSubmission(SubmissionException e) {
        return error(statusFor(e.getKind()), e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        return error(e.getStatusCode(), e.getReason());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON request body.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        if (e instanceof org.springframework.web.ErrorResponse framework) {
            // Spring MVC's own rejections (405, 415, 404) keep their status.
            return error(framework.getStatusCode(), framework.getBody().getDetail());
        }
        log.error("An unexpected error occurred in /submit endpoint", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    static HttpStatus statusFor(SubmissionException.Kind kind) {
        return switch (kind) {
            case INVALID_SETTINGS   -> HttpStatus.BAD_REQUEST;
            case UNCONFIGURED       -> HttpStatus.INTERNAL_SERVER_ERROR;
            case BROKER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT            -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL           -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatusCode status, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(detail));
    }
}
