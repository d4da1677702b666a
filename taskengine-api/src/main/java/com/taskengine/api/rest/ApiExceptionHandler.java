package com.taskengine.api.rest;

import com.taskengine.core.exception.EngineException;
import com.taskengine.core.exception.InvalidStateTransitionException;
import com.taskengine.core.exception.NotFoundException;
import com.taskengine.core.exception.OptimisticLockException;
import com.taskengine.core.exception.OrchestrationException;
import com.taskengine.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP responses.
 *
 * Client errors carry the exception message. Server errors only carry the error code;
 * the detail goes to the log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException e) {
        return clientError(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({InvalidStateTransitionException.class, OptimisticLockException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(EngineException e) {
        return clientError(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WorkflowValidationException e) {
        return clientError(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return clientError(HttpStatus.BAD_REQUEST, BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(OrchestrationException.class)
    public ResponseEntity<Map<String, Object>> handleOrchestrationFailure(OrchestrationException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return serverError(e.getErrorCode());
    }

    /**
     * Spring MVC's own failures (unknown path, wrong method, unsupported media type) keep their status.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            if (status.is4xxClientError()) {
                return clientError(status, String.valueOf(status.value()), e.getMessage());
            }
        }
        log.error("Unexpected error handling request", e);
        return serverError(INTERNAL_ERROR);
    }

    private ResponseEntity<Map<String, Object>> clientError(HttpStatusCode status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<Map<String, Object>> serverError(String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }
}
