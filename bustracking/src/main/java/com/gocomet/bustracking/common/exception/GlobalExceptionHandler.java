package com.gocomet.bustracking.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(DuplicateRequestException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateRequestException e) {
        Map<String, Object> body = body("ALREADY_ACTIVE", e.getMessage());
        if (e.getExistingId() != null) {
            body.put("existingId", e.getExistingId());
        }
        return new ResponseEntity<>(body, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidState(InvalidStateTransitionException e) {
        log.debug("Rejected state transition: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage());
    }

    @ExceptionHandler({UnauthorizedException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleUnauthorized(Exception e) {
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", e.getMessage());
    }

    @ExceptionHandler(NotAssignedException.class)
    public ResponseEntity<Map<String, Object>> handleNotAssigned(NotAssignedException e) {
        return error(HttpStatus.FORBIDDEN, "NOT_ASSIGNED", e.getMessage());
    }

    @ExceptionHandler(NotOwnerException.class)
    public ResponseEntity<Map<String, Object>> handleNotOwner(NotOwnerException e) {
        return error(HttpStatus.FORBIDDEN, "NOT_OWNER", e.getMessage());
    }

    @ExceptionHandler(ThrottledException.class)
    public ResponseEntity<Map<String, Object>> handleThrottled(ThrottledException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "THROTTLED", e.getMessage());
    }

    @ExceptionHandler(LocationRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(LocationRejectedException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "REJECTED", e.getMessage());
    }

    @ExceptionHandler(RouteMissingException.class)
    public ResponseEntity<Map<String, Object>> handleRouteMissing(RouteMissingException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "ROUTE_MISSING", e.getMessage());
    }

    @ExceptionHandler(LocationUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleLocationUnavailable(LocationUnavailableException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "LOCATION_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                String.format("Invalid value '%s' for %s", e.getValue(), e.getName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return new ResponseEntity<>(body(code, message), status);
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
