package com.tasksmith.dispatch.api;

import com.tasksmith.core.run.RetryLimitExceededException;
import com.tasksmith.core.run.TaskOperationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps task operation failures to HTTP responses with an {@code {"error": message}} body.
 */
final class ApiErrors {

    private ApiErrors() {}

    static HttpStatus statusOf(TaskOperationException e) {
        if (e instanceof RetryLimitExceededException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        return switch (e.reason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_STATE -> HttpStatus.BAD_REQUEST;
        };
    }

    static ResponseEntity<Map<String, Object>> of(TaskOperationException e) {
        return error(statusOf(e), e.getMessage());
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
